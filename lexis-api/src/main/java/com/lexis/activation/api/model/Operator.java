/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators available to a rule {@link RuleNode.Condition}.
 */
public enum Operator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_OR_EQUAL("greater_or_equal"),
    LESS_OR_EQUAL("less_or_equal"),
    EXISTS("exists"),
    NOT_EXISTS("not_exists"),
    IS_EMPTY("is_empty"),
    IS_NOT_EMPTY("is_not_empty"),
    IN_LIST("in_list"),
    NOT_IN_LIST("not_in_list"),
    MATCHES_REGEX("matches_regex");

    private final String wireName;

    Operator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Safely converts a wire name (or enum name) to an Operator.
     *
     * @param text the operator string (e.g., "greater_or_equal")
     * @return the corresponding Operator, or null if not found
     */
    public static Operator fromString(String text) {
        if (text == null) return null;
        String normalized = text.trim();
        for (Operator op : values()) {
            if (op.wireName.equalsIgnoreCase(normalized) || op.name().equalsIgnoreCase(normalized)) {
                return op;
            }
        }
        return null;
    }

    /**
     * Presence operators answer from the presence or emptiness of a variable and never
     * normalize its value.
     */
    public boolean isPresenceCheck() {
        return this == EXISTS || this == NOT_EXISTS || this == IS_EMPTY || this == IS_NOT_EMPTY;
    }

    public boolean isOrdering() {
        return this == GREATER_THAN
                || this == LESS_THAN
                || this == GREATER_OR_EQUAL
                || this == LESS_OR_EQUAL;
    }

    public boolean requiresOperand() {
        return !isPresenceCheck();
    }
}
