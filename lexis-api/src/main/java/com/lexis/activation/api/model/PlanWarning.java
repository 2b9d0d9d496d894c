package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Recoverable problem met while planning. Carried on the plan so the caller can log and
 * count it; none of these abort a request.
 *
 * @param kind     warning category
 * @param moduleId affected module, or null when the warning concerns the whole dispatch
 * @param message  human-readable detail
 */
public record PlanWarning(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("module_id") String moduleId,
        @JsonProperty("message") String message
) {

    public enum Kind {
        MISCONFIGURED_MODULE,
        RULE_DEPTH_EXCEEDED,
        INCOMPLETE_REASONER_RESPONSE,
        DISPATCH_TIMEOUT,
        DISPATCH_TRANSPORT_ERROR
    }

    public PlanWarning {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static PlanWarning forModule(Kind kind, String moduleId, String message) {
        return new PlanWarning(kind, moduleId, message);
    }

    public static PlanWarning forDispatch(Kind kind, String message) {
        return new PlanWarning(kind, null, message);
    }
}
