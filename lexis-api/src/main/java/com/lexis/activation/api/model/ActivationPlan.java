/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Activation result for one generation request.
 *
 * <p>Created fresh per request and never persisted by the engine. {@link #orderedModules()}
 * is the list the document generator consumes; every other field exists for audit and
 * observability.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ActivationPlan plan = planner.plan("contestacao", snapshot);
 * plan.warnings().forEach(w -> auditLog.record(w));
 * generator.render(plan.orderedModules());
 * }</pre>
 */
public record ActivationPlan(
        @JsonProperty("document_type") String documentType,
        @JsonProperty("activated_always") List<String> activatedAlways,
        @JsonProperty("activated_deterministic") List<String> activatedDeterministic,
        @JsonProperty("skipped_deterministic") List<String> skippedDeterministic,
        @JsonProperty("indeterminate") List<String> indeterminate,
        @JsonProperty("activated_llm") List<String> activatedLlm,
        @JsonProperty("skipped_llm") List<String> skippedLlm,
        @JsonProperty("misconfigured") List<String> misconfigured,
        @JsonProperty("ordered_modules") List<String> orderedModules,
        @JsonProperty("dispatch_mode") DispatchMode dispatchMode,
        @JsonProperty("warnings") List<PlanWarning> warnings,
        @JsonProperty("decisions") List<ModuleDecision> decisions,
        @JsonProperty("verdicts_from_cache") boolean verdictsFromCache
) {

    public ActivationPlan {
        activatedAlways = copy(activatedAlways);
        activatedDeterministic = copy(activatedDeterministic);
        skippedDeterministic = copy(skippedDeterministic);
        indeterminate = copy(indeterminate);
        activatedLlm = copy(activatedLlm);
        skippedLlm = copy(skippedLlm);
        misconfigured = copy(misconfigured);
        orderedModules = copy(orderedModules);
        warnings = copy(warnings);
        decisions = copy(decisions);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasConfigurationWarnings() {
        return warnings.stream().anyMatch(w -> w.kind() == PlanWarning.Kind.MISCONFIGURED_MODULE
                || w.kind() == PlanWarning.Kind.RULE_DEPTH_EXCEEDED);
    }

    public boolean usedReasoner() {
        return dispatchMode != DispatchMode.FAST_PATH;
    }
}
