package com.lexis.activation.runtime.operators;

import com.lexis.activation.api.model.EvaluationOutcome;

/**
 * Outcome of one leaf condition, with the value that was looked at and, for
 * non-definite results, the reason.
 */
public record ConditionResult(EvaluationOutcome outcome, Object observedValue, String detail) {

    static ConditionResult of(boolean matched, Object observed) {
        return new ConditionResult(EvaluationOutcome.of(matched), observed, null);
    }

    static ConditionResult indeterminate(Object observed, String detail) {
        return new ConditionResult(EvaluationOutcome.INDETERMINATE, observed, detail);
    }
}
