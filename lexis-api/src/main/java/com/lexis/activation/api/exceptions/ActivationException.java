package com.lexis.activation.api.exceptions;

/**
 * Base type of the engine's runtime failures.
 *
 * <p>Unchecked so that evaluation code does not have to declare it everywhere; every
 * subtype is recoverable at the plan level.
 */
public class ActivationException extends RuntimeException {

    public ActivationException(String message) {
        super(message);
    }

    public ActivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
