package com.lexis.activation.infra.cache;

import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.VerdictCacheKey;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Never stores anything. Every dispatch reaches the reasoner; single-flight still applies.
 */
public final class NoOpVerdictCache implements VerdictCache {

    public static final NoOpVerdictCache INSTANCE = new NoOpVerdictCache();

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private NoOpVerdictCache() {
    }

    @Override
    public CompletableFuture<Optional<CacheEntry>> get(VerdictCacheKey key) {
        return CompletableFuture.completedFuture(Optional.empty());
    }

    @Override
    public CompletableFuture<Void> put(VerdictCacheKey key, Map<String, EvaluationOutcome> verdicts) {
        VerdictCache.requireDefinite(verdicts);
        return DONE;
    }

    @Override
    public CompletableFuture<Void> invalidate(VerdictCacheKey key) {
        return DONE;
    }

    @Override
    public CompletableFuture<Void> invalidateDocumentType(String documentType) {
        return DONE;
    }

    @Override
    public CompletableFuture<Void> clear() {
        return DONE;
    }

    @Override
    public CacheMetrics getMetrics() {
        return CacheMetrics.EMPTY;
    }
}
