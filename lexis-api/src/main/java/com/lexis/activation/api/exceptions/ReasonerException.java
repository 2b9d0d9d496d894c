package com.lexis.activation.api.exceptions;

/**
 * The external reasoner could not be reached or returned an unreadable answer.
 */
public class ReasonerException extends Exception {

    public ReasonerException(String message) {
        super(message);
    }

    public ReasonerException(String message, Throwable cause) {
        super(message, cause);
    }
}
