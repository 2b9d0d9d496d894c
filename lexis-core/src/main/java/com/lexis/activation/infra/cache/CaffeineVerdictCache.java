/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.VerdictCacheKey;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * In-process verdict cache on Caffeine with write-based expiry.
 *
 * <p>An entry expires {@code ttl} after it was written; reads never extend it. The ticker
 * is injectable so tests can move time forward instead of sleeping.
 */
public final class CaffeineVerdictCache implements VerdictCache {

    private static final Logger logger = Logger.getLogger(CaffeineVerdictCache.class.getName());

    private final Cache<VerdictCacheKey, CacheEntry> cache;
    private final Ticker ticker;
    private final boolean statsEnabled;

    private CaffeineVerdictCache(Builder builder) {
        this.ticker = builder.ticker;
        this.statsEnabled = builder.recordStats;

        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder()
                .maximumSize(builder.maxSize)
                .expireAfterWrite(builder.ttl)
                .ticker(builder.ticker);
        if (builder.executor != null) {
            cacheBuilder.executor(builder.executor);
        }
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }
        cacheBuilder.removalListener((key, value, cause) ->
                logger.fine(String.format("Verdict cache removal: key=%s, cause=%s", key, cause)));
        this.cache = cacheBuilder.build();

        logger.info(String.format("CaffeineVerdictCache initialized: maxSize=%d, ttl=%s, stats=%b",
                builder.maxSize, builder.ttl, builder.recordStats));
    }

    @Override
    public CompletableFuture<Optional<CacheEntry>> get(VerdictCacheKey key) {
        return CompletableFuture.completedFuture(Optional.ofNullable(cache.getIfPresent(key)));
    }

    @Override
    public CompletableFuture<Void> put(VerdictCacheKey key, Map<String, EvaluationOutcome> verdicts) {
        Objects.requireNonNull(key, "key");
        VerdictCache.requireDefinite(verdicts);
        cache.put(key, new CacheEntry(key, verdicts, ticker.read()));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> invalidate(VerdictCacheKey key) {
        cache.invalidate(key);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> invalidateDocumentType(String documentType) {
        cache.asMap().keySet().removeIf(key -> key.documentType().equals(documentType));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> clear() {
        cache.invalidateAll();
        cache.cleanUp();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CacheMetrics getMetrics() {
        CacheStats stats = statsEnabled ? cache.stats() : CacheStats.empty();
        return new CacheMetrics(
                stats.requestCount(),
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                cache.estimatedSize(),
                stats.hitRate());
    }

    public void cleanUp() {
        cache.cleanUp();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long maxSize = 10_000;
        private Duration ttl = Duration.ofMinutes(60);
        private boolean recordStats = true;
        private Ticker ticker = Ticker.systemTicker();
        private Executor executor;

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = Objects.requireNonNull(ttl, "ttl");
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker");
            return this;
        }

        /**
         * Executor for Caffeine's maintenance work; {@code Runnable::run} makes it synchronous.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public CaffeineVerdictCache build() {
            return new CaffeineVerdictCache(this);
        }
    }
}
