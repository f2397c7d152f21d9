package com.deepansh.policyradar.exception;

/**
 * 5xx from an upstream API. The only status class the retry policies treat as transient.
 */
public class BackendUnavailableException extends ApiException {

    public BackendUnavailableException(String message, int statusCode) {
        super(message, statusCode);
    }
}
