package com.reviewgate.exception;

/**
 * Exception thrown when one of the evaluation inputs cannot be obtained,
 * e.g. the policy document is missing at the expected path or the change
 * snapshot is unreadable.
 * Distinct from a rejected change: the change was never evaluated.
 */
public class InputUnavailableException extends ReviewGateException {

    public InputUnavailableException(String message) {
        super(message);
    }

    public InputUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
