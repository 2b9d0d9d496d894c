package com.lexis.activation.compiler;

import com.lexis.activation.api.ModuleCatalogProvider;
import com.lexis.activation.api.exceptions.UnknownDocumentTypeException;
import com.lexis.activation.api.model.ModuleCatalog;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Catalog store keyed by document type. Registering a catalog for a type that already has
 * one replaces it; plans already in progress keep the instance they started with.
 */
public final class InMemoryModuleCatalogProvider implements ModuleCatalogProvider {

    private static final Logger logger = Logger.getLogger(InMemoryModuleCatalogProvider.class.getName());

    private final Map<String, ModuleCatalog> catalogs = new ConcurrentHashMap<>();

    public InMemoryModuleCatalogProvider register(ModuleCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog cannot be null");
        ModuleCatalog previous = catalogs.put(catalog.documentType(), catalog);
        if (previous != null) {
            logger.info("Replaced catalog for document type '" + catalog.documentType() + "'");
        }
        return this;
    }

    public InMemoryModuleCatalogProvider register(CompiledCatalog compiled) {
        return register(compiled.catalog());
    }

    @Override
    public ModuleCatalog catalogFor(String documentType) {
        ModuleCatalog catalog = catalogs.get(documentType);
        if (catalog == null) {
            throw new UnknownDocumentTypeException(documentType);
        }
        return catalog;
    }

    public Set<String> documentTypes() {
        return Set.copyOf(catalogs.keySet());
    }
}
