package com.lexis.activation.planner.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.lexis.activation.api.model.Variable;
import com.lexis.activation.api.model.VariableSnapshot;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content hash of a snapshot, used as the variable half of a verdict cache key.
 *
 * <p>Variables are rendered in slug order as {@code [type, value, notApplicable]} with
 * values in their string form, so the hash does not depend on insertion order or on
 * whether a number arrived as {@code 10} or {@code 10L}. Raw strings are hashed as given:
 * {@code "1.500,00"} and {@code "1500.00"} are different inputs to the reasoner.
 */
public final class SnapshotHasher {

    private final ObjectMapper objectMapper;

    public SnapshotHasher() {
        this(new ObjectMapper());
    }

    public SnapshotHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String hash(VariableSnapshot snapshot) {
        return Hashing.sha256()
                .hashString(canonicalJson(snapshot), StandardCharsets.UTF_8)
                .toString();
    }

    String canonicalJson(VariableSnapshot snapshot) {
        Map<String, List<Object>> canonical = new LinkedHashMap<>();
        for (Map.Entry<String, Variable> entry : snapshot.canonicalForm().entrySet()) {
            Variable variable = entry.getValue();
            List<Object> rendered = new ArrayList<>(3);
            rendered.add(variable.type().wireName());
            rendered.add(render(variable.value()));
            rendered.add(variable.notApplicable());
            canonical.put(entry.getKey(), rendered);
        }
        try {
            return objectMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            // only strings, lists and booleans reach the mapper
            throw new IllegalStateException("Cannot render snapshot for hashing", e);
        }
    }

    private static Object render(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> items) {
            List<String> rendered = new ArrayList<>(items.size());
            items.forEach(item -> rendered.add(item == null ? null : String.valueOf(item)));
            return rendered;
        }
        return String.valueOf(value);
    }
}
