package com.lexis.activation.api.exceptions;

import com.lexis.activation.api.model.VariableType;

/**
 * A raw value could not be coerced to its declared type.
 *
 * <p>Local to one condition: the evaluator downgrades that condition to indeterminate.
 */
public class NormalizationException extends Exception {

    private final transient Object rawValue;
    private final VariableType targetType;

    public NormalizationException(Object rawValue, VariableType targetType, String reason) {
        super("Cannot normalize '" + rawValue + "' to " + targetType.wireName() + ": " + reason);
        this.rawValue = rawValue;
        this.targetType = targetType;
    }

    public Object getRawValue() {
        return rawValue;
    }

    public VariableType getTargetType() {
        return targetType;
    }
}
