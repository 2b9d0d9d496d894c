/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api.model;

import java.util.Objects;

/**
 * One extracted variable of a generation request.
 *
 * <p>A variable whose slug is present but whose value is {@code null} is distinct from an
 * absent variable: the slug was extracted, nothing was found. A variable marked
 * {@code notApplicable} belongs to a conditional group whose parent condition does not hold.
 *
 * @param slug          unique key, snake_case
 * @param type          declared type
 * @param value         raw extracted value (may be null)
 * @param notApplicable true when the variable is excluded by a conditional dependency
 */
public record Variable(String slug, VariableType type, Object value, boolean notApplicable) {

    public Variable {
        Objects.requireNonNull(slug, "slug cannot be null");
        Objects.requireNonNull(type, "type cannot be null for variable " + slug);
    }

    public static Variable of(String slug, VariableType type, Object value) {
        return new Variable(slug, type, value, false);
    }

    public static Variable notApplicable(String slug, VariableType type) {
        return new Variable(slug, type, null, true);
    }

    public boolean hasValue() {
        return value != null && !notApplicable;
    }
}
