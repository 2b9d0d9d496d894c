package com.lexis.activation.api.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of module definitions available to one document type.
 */
public record ModuleCatalog(String documentType, List<ContentModule> modules) {

    public ModuleCatalog {
        Objects.requireNonNull(documentType, "documentType cannot be null");
        modules = modules == null ? List.of() : List.copyOf(modules);
    }

    public Optional<ContentModule> find(String moduleId) {
        return modules.stream().filter(m -> m.id().equals(moduleId)).findFirst();
    }

    public boolean isEmpty() {
        return modules.isEmpty();
    }
}
