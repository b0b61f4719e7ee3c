package com.reviewgate.exception;

/**
 * Base exception for the review gate.
 */
public class ReviewGateException extends RuntimeException {

    public ReviewGateException(String message) {
        super(message);
    }

    public ReviewGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
