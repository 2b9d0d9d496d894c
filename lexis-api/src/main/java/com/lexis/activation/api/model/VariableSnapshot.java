/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable view of the variables extracted for one generation request.
 *
 * <p>Consumed read-only by every stage of activation. A slug that is not in the snapshot is
 * <i>absent</i>, which is a third state distinct from {@code false} or an empty string.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * VariableSnapshot snapshot = VariableSnapshot.builder()
 *     .put("pareceres_natureza_cirurgia", VariableType.STRING, "eletiva")
 *     .put("valor_causa", VariableType.NUMBER, "R$ 250.000,00")
 *     .build();
 * }</pre>
 */
public final class VariableSnapshot {

    private static final VariableSnapshot EMPTY = new VariableSnapshot(Map.of());

    private final Map<String, Variable> variables;

    private VariableSnapshot(Map<String, Variable> variables) {
        this.variables = Collections.unmodifiableMap(variables);
    }

    public static VariableSnapshot empty() {
        return EMPTY;
    }

    public static VariableSnapshot of(Collection<Variable> variables) {
        Builder builder = builder();
        variables.forEach(builder::put);
        return builder.build();
    }

    public Optional<Variable> lookup(String slug) {
        return Optional.ofNullable(variables.get(slug));
    }

    public boolean contains(String slug) {
        return variables.containsKey(slug);
    }

    public int size() {
        return variables.size();
    }

    public Collection<Variable> variables() {
        return variables.values();
    }

    /**
     * Restricts the snapshot to the given slugs. Slugs absent from this snapshot stay absent.
     */
    public VariableSnapshot subset(Collection<String> slugs) {
        Map<String, Variable> selected = new LinkedHashMap<>();
        for (String slug : slugs) {
            Variable variable = variables.get(slug);
            if (variable != null) {
                selected.put(slug, variable);
            }
        }
        return new VariableSnapshot(selected);
    }

    /**
     * Returns a copy with the given variables added or replaced.
     */
    public VariableSnapshot with(Collection<Variable> replacements) {
        Map<String, Variable> merged = new LinkedHashMap<>(variables);
        replacements.forEach(v -> merged.put(v.slug(), v));
        return new VariableSnapshot(merged);
    }

    /**
     * Slug-sorted rendering used for content hashing. Two snapshots with the same variables
     * produce the same form regardless of insertion order.
     */
    public SortedMap<String, Variable> canonicalForm() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(variables));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableSnapshot that)) return false;
        return variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return variables.hashCode();
    }

    @Override
    public String toString() {
        return "VariableSnapshot" + canonicalForm().keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Variable> variables = new LinkedHashMap<>();

        public Builder put(Variable variable) {
            variables.put(variable.slug(), variable);
            return this;
        }

        public Builder put(String slug, VariableType type, Object value) {
            return put(Variable.of(slug, type, value));
        }

        public VariableSnapshot build() {
            return variables.isEmpty() ? EMPTY : new VariableSnapshot(new LinkedHashMap<>(variables));
        }
    }
}
