package com.lexis.activation.compiler.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lexis.activation.api.model.VariableDependency;

import java.util.List;

/**
 * Catalog file for one document type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogDocument(
        @JsonProperty("document_type") String documentType,
        @JsonProperty("modules") List<ModuleDefinition> modules,
        @JsonProperty("variable_dependencies") List<VariableDependency> variableDependencies
) {

    public CatalogDocument {
        modules = modules == null ? List.of() : modules;
        variableDependencies = variableDependencies == null ? List.of() : variableDependencies;
    }
}
