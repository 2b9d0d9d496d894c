package com.lexis.activation.api.exceptions;

/**
 * The reasoner call failed. Pending modules fail closed; the next request may retry.
 */
public class DispatchTransportException extends ActivationException {

    public DispatchTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
