package com.bko.team.completion;

/**
 * Raised when the completion service stays unreachable after every retry.
 */
public class CompletionConnectionException extends RuntimeException {

    public CompletionConnectionException(String message) {
        super(message);
    }

    public CompletionConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
