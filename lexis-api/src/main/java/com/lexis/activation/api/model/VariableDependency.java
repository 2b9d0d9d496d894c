package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Declares that a variable only applies when a condition on another variable holds
 * (e.g. {@code qual_cirurgia} only applies when {@code pleiteada_cirurgia equals true}).
 */
public record VariableDependency(
        @JsonProperty("slug") String slug,
        @JsonProperty("depends_on") String dependsOn,
        @JsonProperty("operator") Operator operator,
        @JsonProperty("value") Object value
) {

    public VariableDependency {
        Objects.requireNonNull(slug, "slug cannot be null");
        Objects.requireNonNull(dependsOn, "dependsOn cannot be null");
        if (operator == null) operator = Operator.EQUALS;
    }

    public RuleNode.Condition asCondition() {
        return new RuleNode.Condition(dependsOn, operator, operator.requiresOperand() ? value : null);
    }
}
