package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One batched question to the external reasoner covering every indeterminate module of a
 * request. Carries only module descriptions and the variables those modules reference,
 * never source documents.
 */
public record ReasonerRequest(
        @JsonProperty("document_type") String documentType,
        @JsonProperty("modules") List<ModuleBrief> modules,
        @JsonProperty("variables") Map<String, Object> variables
) {

    public ReasonerRequest {
        modules = List.copyOf(modules);
        variables = variables == null ? Map.of() : variables;
    }

    public List<String> moduleIds() {
        return modules.stream().map(ModuleBrief::id).toList();
    }

    /**
     * Description of a module the reasoner has to judge.
     */
    public record ModuleBrief(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("category") String category,
            @JsonProperty("activation_condition") String activationCondition,
            @JsonProperty("variables") List<String> variables
    ) {
        public static ModuleBrief of(ContentModule module) {
            return new ModuleBrief(module.id(), module.title(), module.category(),
                    module.activationCondition(), List.copyOf(module.reasonerVariables()));
        }
    }
}
