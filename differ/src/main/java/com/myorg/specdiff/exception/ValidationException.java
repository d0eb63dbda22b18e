package com.myorg.specdiff.exception;

/**
 * Invalid input from a caller (bad upload, unreadable document, ...).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
