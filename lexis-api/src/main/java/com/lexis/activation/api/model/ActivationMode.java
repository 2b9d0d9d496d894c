package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a module decides whether it is part of a generated document.
 */
public enum ActivationMode {
    /** Always included, no evaluation. */
    ALWAYS("always"),
    /** Included when its primary (or fallback) rule evaluates to activate. */
    DETERMINISTIC("deterministic"),
    /** Decided by the external reasoner. */
    LLM("llm");

    private final String wireName;

    ActivationMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ActivationMode fromString(String text) {
        if (text == null) return null;
        for (ActivationMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(text.trim()) || mode.name().equalsIgnoreCase(text.trim())) {
                return mode;
            }
        }
        return null;
    }
}
