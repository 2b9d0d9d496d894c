package com.lexis.activation.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resolution path a plan took.
 */
public enum DispatchMode {
    /** Every module resolved locally, no reasoner call. */
    FAST_PATH("fast_path"),
    /** Some modules resolved locally, the rest by the reasoner. */
    MIXED("mixed"),
    /** Nothing resolved locally; every included module depends on the reasoner. */
    LLM_ONLY("llm_only");

    private final String wireName;

    DispatchMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
