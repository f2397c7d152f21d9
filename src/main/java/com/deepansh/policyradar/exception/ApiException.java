package com.deepansh.policyradar.exception;

import lombok.Getter;

/**
 * Non-2xx answer from a model backend or data provider. The status code is passed through.
 */
@Getter
public class ApiException extends RadarException {

    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
