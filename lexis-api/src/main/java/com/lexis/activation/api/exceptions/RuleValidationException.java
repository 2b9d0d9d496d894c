package com.lexis.activation.api.exceptions;

import java.util.List;

/**
 * A rule tree document is structurally invalid. Carries every problem found, not only the
 * first one.
 */
public class RuleValidationException extends ActivationException {

    private final List<String> errors;

    public RuleValidationException(List<String> errors) {
        super("Invalid rule: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
