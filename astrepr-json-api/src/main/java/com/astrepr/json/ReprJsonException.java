package com.astrepr.json;

/**
 * Exception thrown when a repr tree cannot be written as JSON.
 */
public class ReprJsonException extends RuntimeException {

    public ReprJsonException(String message) {
        super(message);
    }

    public ReprJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
