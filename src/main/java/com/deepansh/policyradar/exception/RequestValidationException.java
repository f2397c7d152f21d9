package com.deepansh.policyradar.exception;

/** Bad caller input, e.g. no data source left after resolution. Mapped to HTTP 400. */
public class RequestValidationException extends RadarException {

    public RequestValidationException(String message) {
        super(message);
    }
}
