package com.deepansh.policyradar.fetch;

/** A URL the fetch policy refuses. The message is safe to show to a model or user. */
public class UnsafeUrlException extends RuntimeException {

    public UnsafeUrlException(String message) {
        super(message);
    }
}
