package com.lexis.activation.compiler.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One module as stored by the module storage collaborator. Rules stay raw JSON until
 * {@link com.lexis.activation.compiler.RuleTreeParser} validates them, so one bad rule does
 * not prevent the rest of the catalog from loading.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModuleDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("activation_mode") String activationMode,
        @JsonProperty("primary_rule") JsonNode primaryRule,
        @JsonProperty("fallback_rule") JsonNode fallbackRule,
        @JsonProperty("category") String category,
        @JsonProperty("ordering_key") Integer orderingKey,
        @JsonProperty("activation_condition") String activationCondition,
        @JsonProperty("relevant_variables") List<String> relevantVariables,
        @JsonProperty("enabled") Boolean enabled
) {

    public boolean isEnabled() {
        return enabled == null || enabled;
    }
}
