package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Node-by-node explanation of a rule evaluation.
 *
 * @param node          rendering of the node ("and", "or", "not" or the condition text)
 * @param outcome       outcome of this node
 * @param observedValue raw value of the condition variable (conditions only, may be null)
 * @param detail        why a condition ended indeterminate, otherwise null
 * @param children      traces of child nodes
 */
public record EvaluationTrace(
        @JsonProperty("node") String node,
        @JsonProperty("outcome") EvaluationOutcome outcome,
        @JsonProperty("observed_value") Object observedValue,
        @JsonProperty("detail") String detail,
        @JsonProperty("children") List<EvaluationTrace> children
) {

    public EvaluationTrace {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
