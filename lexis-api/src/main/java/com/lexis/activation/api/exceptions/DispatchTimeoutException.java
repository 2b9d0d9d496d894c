package com.lexis.activation.api.exceptions;

import java.time.Duration;

/**
 * The reasoner did not answer within the configured timeout. Pending modules fail closed.
 */
public class DispatchTimeoutException extends ActivationException {

    public DispatchTimeoutException(String cacheKey, Duration timeout) {
        super("Reasoner call for " + cacheKey + " timed out after " + timeout.toMillis() + "ms");
    }
}
