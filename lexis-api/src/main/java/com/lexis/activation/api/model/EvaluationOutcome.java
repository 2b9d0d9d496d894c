/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api.model;

/**
 * Result of resolving a rule or a module.
 *
 * <p>Rule composition follows Kleene's strong three-valued logic (K3) over
 * {@link #ACTIVATE} (true), {@link #SKIP} (false) and {@link #INDETERMINATE} (unknown).
 * {@link #MISCONFIGURED_MODULE} never comes out of rule composition; it is a module-level
 * outcome produced by the planner.
 */
public enum EvaluationOutcome {
    ACTIVATE,
    SKIP,
    INDETERMINATE,
    MISCONFIGURED_MODULE;

    public static EvaluationOutcome of(boolean value) {
        return value ? ACTIVATE : SKIP;
    }

    public boolean isDefinite() {
        return this == ACTIVATE || this == SKIP;
    }

    /**
     * K3 conjunction: false dominates, then unknown.
     */
    public EvaluationOutcome and(EvaluationOutcome other) {
        if (this == SKIP || other == SKIP) return SKIP;
        if (this == ACTIVATE && other == ACTIVATE) return ACTIVATE;
        return INDETERMINATE;
    }

    /**
     * K3 disjunction: true dominates, then unknown.
     */
    public EvaluationOutcome or(EvaluationOutcome other) {
        if (this == ACTIVATE || other == ACTIVATE) return ACTIVATE;
        if (this == SKIP && other == SKIP) return SKIP;
        return INDETERMINATE;
    }

    /**
     * K3 negation: unknown stays unknown.
     */
    public EvaluationOutcome negate() {
        return switch (this) {
            case ACTIVATE -> SKIP;
            case SKIP -> ACTIVATE;
            case INDETERMINATE -> INDETERMINATE;
            case MISCONFIGURED_MODULE -> MISCONFIGURED_MODULE;
        };
    }
}
