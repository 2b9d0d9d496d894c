package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Verdicts returned by the external reasoner.
 *
 * @param verdicts   one entry per judged module; may omit requested ids
 * @param confidence free-form confidence label reported by the model (may be null)
 */
public record ReasonerResponse(
        @JsonProperty("verdicts") List<ModuleVerdict> verdicts,
        @JsonProperty("confidence") String confidence
) {

    public ReasonerResponse {
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
    }

    public static ReasonerResponse of(List<ModuleVerdict> verdicts) {
        return new ReasonerResponse(verdicts, null);
    }

    public record ModuleVerdict(
            @JsonProperty("id") String moduleId,
            @JsonProperty("activate") boolean activate,
            @JsonProperty("reason") String reason
    ) {
        public static ModuleVerdict activate(String moduleId) {
            return new ModuleVerdict(moduleId, true, null);
        }

        public static ModuleVerdict skip(String moduleId) {
            return new ModuleVerdict(moduleId, false, null);
        }
    }
}
