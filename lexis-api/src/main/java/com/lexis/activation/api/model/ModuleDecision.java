package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audit record of how a single module was resolved.
 */
public record ModuleDecision(
        @JsonProperty("module_id") String moduleId,
        @JsonProperty("outcome") EvaluationOutcome outcome,
        @JsonProperty("source") Source source
) {

    public enum Source {
        ALWAYS,
        PRIMARY_RULE,
        FALLBACK_RULE,
        REASONER,
        REASONER_FAIL_CLOSED,
        MISCONFIGURED,
        /** Left unresolved by rules; only visible on plans built without a dispatcher. */
        UNRESOLVED
    }
}
