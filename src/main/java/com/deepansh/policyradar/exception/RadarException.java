package com.deepansh.policyradar.exception;

/**
 * Base unchecked exception for engine failures that should surface to the caller.
 * Tool-level failures never use this; they travel as {"error": ...} payloads.
 */
public class RadarException extends RuntimeException {

    public RadarException(String message) {
        super(message);
    }

    public RadarException(String message, Throwable cause) {
        super(message, cause);
    }
}
