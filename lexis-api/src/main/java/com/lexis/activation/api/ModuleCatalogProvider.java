package com.lexis.activation.api;

import com.lexis.activation.api.exceptions.UnknownDocumentTypeException;
import com.lexis.activation.api.model.ModuleCatalog;

/**
 * Source of module catalogs, owned by the module storage collaborator.
 *
 * <p>Implementations must be thread-safe.
 */
public interface ModuleCatalogProvider {

    /**
     * Returns the ordered catalog for a document type.
     *
     * @throws UnknownDocumentTypeException if no catalog exists for the type
     */
    ModuleCatalog catalogFor(String documentType);
}
