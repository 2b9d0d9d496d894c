/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.infra.cache;

import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.VerdictCacheKey;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Cache of reasoner verdicts keyed by document type and snapshot hash.
 *
 * <p>Async-first so a remote implementation can be dropped in without changing callers;
 * the in-process implementations complete their futures immediately.
 *
 * <p>An entry stores one verdict ({@link EvaluationOutcome#ACTIVATE} or
 * {@link EvaluationOutcome#SKIP}) per module id. Fail-closed results must never be
 * written here.
 */
public interface VerdictCache {

    /**
     * @param verdicts        module id to ACTIVATE or SKIP; unmodifiable
     * @param createTimeNanos ticker reading when the entry was written
     */
    record CacheEntry(VerdictCacheKey key, Map<String, EvaluationOutcome> verdicts, long createTimeNanos) {

        public CacheEntry {
            verdicts = Map.copyOf(verdicts);
        }

        /**
         * True when the entry holds a verdict for every requested module. A partial entry
         * is treated as a miss by the dispatcher.
         */
        public boolean covers(Collection<String> moduleIds) {
            return verdicts.keySet().containsAll(moduleIds);
        }
    }

    CompletableFuture<Optional<CacheEntry>> get(VerdictCacheKey key);

    /**
     * Stores a verdict map, replacing any previous entry and restarting its TTL.
     *
     * @throws IllegalArgumentException if a verdict is neither ACTIVATE nor SKIP
     */
    CompletableFuture<Void> put(VerdictCacheKey key, Map<String, EvaluationOutcome> verdicts);

    CompletableFuture<Void> invalidate(VerdictCacheKey key);

    /**
     * Drops every entry of a document type, e.g. after its catalog was edited.
     */
    CompletableFuture<Void> invalidateDocumentType(String documentType);

    CompletableFuture<Void> clear();

    CacheMetrics getMetrics();

    record CacheMetrics(
            long totalRequests,
            long hits,
            long misses,
            long evictions,
            long currentSize,
            double hitRate
    ) {
        public static final CacheMetrics EMPTY = new CacheMetrics(0, 0, 0, 0, 0, 0.0);

        public String format() {
            return String.format(
                    "Verdict cache: requests=%d, hits=%d (%.1f%%), misses=%d, evictions=%d, size=%d",
                    totalRequests, hits, hitRate * 100, misses, evictions, currentSize);
        }
    }

    static void requireDefinite(Map<String, EvaluationOutcome> verdicts) {
        verdicts.forEach((id, outcome) -> {
            if (outcome == null || !outcome.isDefinite()) {
                throw new IllegalArgumentException("Verdict for '" + id + "' must be ACTIVATE or SKIP, got " + outcome);
            }
        });
    }
}
