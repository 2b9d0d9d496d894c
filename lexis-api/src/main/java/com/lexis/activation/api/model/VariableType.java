/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared type of an extracted variable.
 */
public enum VariableType {
    BOOLEAN("boolean"),
    STRING("string"),
    NUMBER("number"),
    DATE("date"),
    LIST_OF_STRING("list");

    private final String wireName;

    VariableType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a type from its wire name or enum name. Extraction tooling also emits
     * {@code text}, {@code currency} and {@code choice}, which map onto the closest type.
     *
     * @return the type, or null if the name is unknown
     */
    @JsonCreator
    public static VariableType fromString(String text) {
        if (text == null) return null;
        String normalized = text.trim().toLowerCase();
        return switch (normalized) {
            case "boolean", "bool" -> BOOLEAN;
            case "string", "text", "choice" -> STRING;
            case "number", "currency", "integer" -> NUMBER;
            case "date" -> DATE;
            case "list", "list_of_string", "list-of-string" -> LIST_OF_STRING;
            default -> null;
        };
    }
}
