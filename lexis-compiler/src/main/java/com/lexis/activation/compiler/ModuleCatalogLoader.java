/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexis.activation.api.exceptions.RuleValidationException;
import com.lexis.activation.api.model.ActivationMode;
import com.lexis.activation.api.model.ContentModule;
import com.lexis.activation.api.model.ModuleCatalog;
import com.lexis.activation.api.model.RuleNode;
import com.lexis.activation.compiler.dto.CatalogDocument;
import com.lexis.activation.compiler.dto.ModuleDefinition;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Loads a document type's module catalog from its JSON form.
 *
 * <p>The loader is lenient per module and strict per catalog. A module whose rule fails
 * validation is kept with a {@code null} rule so the planner reports it as misconfigured
 * on every plan; a module with no id or an unknown activation mode is dropped with a
 * warning. Duplicate ids, a missing document type and unreadable JSON fail the load.
 */
public final class ModuleCatalogLoader {

    private static final Logger logger = Logger.getLogger(ModuleCatalogLoader.class.getName());

    static final String INVALID_RULES_METRIC = "lexis_invalid_rules_total";

    private final ObjectMapper objectMapper;
    private final RuleTreeParser parser;
    private final MetricsRegistry metrics;
    private final Tracer tracer;

    public ModuleCatalogLoader() {
        this(new RuleTreeParser(), MetricsRegistry.getInstance(), OpenTelemetry.noop().getTracer("noop"));
    }

    public ModuleCatalogLoader(RuleTreeParser parser, MetricsRegistry metrics, Tracer tracer) {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.parser = parser;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    /**
     * @throws IOException             if the file cannot be read or is not valid JSON
     * @throws RuleValidationException if the catalog as a whole is inconsistent
     */
    public CompiledCatalog load(Path catalogPath) throws IOException {
        Span span = tracer.spanBuilder("load-catalog").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("catalogPath", catalogPath.toString());
            CatalogDocument document = objectMapper.readValue(Files.readString(catalogPath), CatalogDocument.class);
            CompiledCatalog compiled = compile(document);
            span.setAttribute("documentType", compiled.catalog().documentType());
            span.setAttribute("moduleCount", compiled.catalog().modules().size());
            span.setAttribute("invalidRuleCount", compiled.invalidRuleModules().size());
            return compiled;
        } catch (IOException | RuleValidationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public CompiledCatalog loadFromString(String json) {
        CatalogDocument document;
        try {
            document = objectMapper.readValue(json, CatalogDocument.class);
        } catch (JsonProcessingException e) {
            throw new RuleValidationException(List.of("malformed catalog JSON: " + e.getOriginalMessage()));
        }
        return compile(document);
    }

    CompiledCatalog compile(CatalogDocument document) {
        if (document.documentType() == null || document.documentType().isBlank()) {
            throw new RuleValidationException(List.of("catalog is missing 'document_type'"));
        }

        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ModuleDefinition def : document.modules()) {
            if (def.id() != null && !seen.add(def.id())) {
                errors.add("duplicate module id '" + def.id() + "'");
            }
        }
        if (!errors.isEmpty()) {
            throw new RuleValidationException(errors);
        }

        List<ContentModule> modules = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        int position = 0;
        for (ModuleDefinition def : document.modules()) {
            position++;
            if (!def.isEnabled()) {
                continue;
            }
            if (def.id() == null || def.id().isBlank()) {
                logger.warning("Catalog '" + document.documentType() + "': module #" + position
                        + " has no id - skipping");
                continue;
            }
            ActivationMode mode = ActivationMode.fromString(def.activationMode());
            if (mode == null) {
                logger.warning("Module '" + def.id() + "' has unknown activation mode '"
                        + def.activationMode() + "' - skipping");
                continue;
            }

            RuleNode primary = parseRule(def.id(), "primary_rule", def.primaryRule(), invalid);
            RuleNode fallback = parseRule(def.id(), "fallback_rule", def.fallbackRule(), invalid);
            if (mode == ActivationMode.DETERMINISTIC && primary == null && !invalid.contains(def.id())) {
                logger.warning("Deterministic module '" + def.id() + "' has no primary rule");
            }

            modules.add(new ContentModule(
                    def.id(),
                    def.title(),
                    mode,
                    primary,
                    fallback,
                    def.category(),
                    def.orderingKey() == null ? position : def.orderingKey(),
                    def.activationCondition(),
                    def.relevantVariables()));
        }

        logger.info("Loaded catalog '" + document.documentType() + "' with " + modules.size()
                + " modules (" + invalid.size() + " with invalid rules)");
        return new CompiledCatalog(
                new ModuleCatalog(document.documentType(), modules),
                document.variableDependencies(),
                invalid);
    }

    private RuleNode parseRule(String moduleId, String field, JsonNode rule, List<String> invalid) {
        if (rule == null || rule.isNull() || rule.isMissingNode()) {
            return null;
        }
        try {
            return parser.parse(rule);
        } catch (RuleValidationException e) {
            logger.warning("Module '" + moduleId + "' has an invalid " + field + ": " + e.getMessage());
            metrics.counter(INVALID_RULES_METRIC, "module", moduleId).increment();
            if (!invalid.contains(moduleId)) {
                invalid.add(moduleId);
            }
            return null;
        }
    }
}
