/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Definition of a content module ("argument block") as seen by the activation engine.
 *
 * <p>A {@link ActivationMode#DETERMINISTIC} module without a primary rule is a configuration
 * error. It is kept representable on purpose so that the planner can report it as
 * {@link EvaluationOutcome#MISCONFIGURED_MODULE} instead of the catalog refusing to load.
 *
 * @param id                  stable module identifier
 * @param title               human-readable title
 * @param activationMode      activation mode
 * @param primaryRule         primary deterministic rule (may be null)
 * @param fallbackRule        rule evaluated when the primary one is indeterminate (may be null)
 * @param category            grouping category
 * @param orderingKey         position of the module in the generated document
 * @param activationCondition natural-language condition sent to the reasoner
 * @param relevantVariables   extra slugs the reasoner should see for this module
 */
public record ContentModule(
        String id,
        String title,
        ActivationMode activationMode,
        RuleNode primaryRule,
        RuleNode fallbackRule,
        String category,
        int orderingKey,
        String activationCondition,
        List<String> relevantVariables
) {

    public ContentModule {
        Objects.requireNonNull(id, "Module id cannot be null");
        Objects.requireNonNull(activationMode, "Activation mode cannot be null for module " + id);
        if (title == null) title = id;
        if (category == null) category = "";
        if (activationCondition == null) activationCondition = "";
        relevantVariables = relevantVariables == null ? List.of() : List.copyOf(relevantVariables);
    }

    public static ContentModule always(String id, int orderingKey) {
        return new ContentModule(id, null, ActivationMode.ALWAYS, null, null, null, orderingKey, null, null);
    }

    public static ContentModule deterministic(String id, RuleNode primaryRule, RuleNode fallbackRule, int orderingKey) {
        return new ContentModule(id, null, ActivationMode.DETERMINISTIC, primaryRule, fallbackRule, null,
                orderingKey, null, null);
    }

    public static ContentModule llm(String id, String activationCondition, int orderingKey) {
        return new ContentModule(id, null, ActivationMode.LLM, null, null, null, orderingKey,
                activationCondition, null);
    }

    public boolean isMisconfigured() {
        return activationMode == ActivationMode.DETERMINISTIC && primaryRule == null;
    }

    /**
     * Variables the reasoner needs to judge this module: those read by its rules plus the
     * ones it declares as relevant.
     */
    public Set<String> reasonerVariables() {
        Set<String> slugs = new LinkedHashSet<>();
        if (primaryRule != null) slugs.addAll(primaryRule.referencedVariables());
        if (fallbackRule != null) slugs.addAll(fallbackRule.referencedVariables());
        slugs.addAll(relevantVariables);
        return slugs;
    }
}
