/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api;

import com.lexis.activation.api.model.ActivationPlan;
import com.lexis.activation.api.model.ModuleCatalog;
import com.lexis.activation.api.model.VariableSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Decides which modules of a catalog are part of a generated document.
 *
 * <p>Implementations resolve what they can with local rules and hand the remainder to the
 * external reasoner in one batched call. When nothing depends on the reasoner the plan is
 * produced without any external call.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe; one instance serves every concurrent request.
 */
public interface IActivationPlanner {

    /**
     * Plans activation for a document type, loading its catalog from the configured
     * {@link ModuleCatalogProvider}.
     */
    ActivationPlan plan(String documentType, VariableSnapshot snapshot);

    /**
     * Plans activation for an explicit catalog, blocking until any reasoner dispatch settles.
     */
    ActivationPlan plan(ModuleCatalog catalog, VariableSnapshot snapshot);

    /**
     * Asynchronous variant of {@link #plan(ModuleCatalog, VariableSnapshot)}.
     *
     * <p>Cancelling the returned future abandons this caller's wait only. A reasoner call
     * shared with other requests keeps running and still populates the verdict cache.
     */
    CompletableFuture<ActivationPlan> planAsync(ModuleCatalog catalog, VariableSnapshot snapshot);

    /**
     * Local evaluation only. Indeterminate modules are reported but never dispatched.
     * Used by activation test screens.
     */
    ActivationPlan evaluateLocally(ModuleCatalog catalog, VariableSnapshot snapshot);
}
