package com.lexis.activation.infra.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.VerdictCacheKey;
import com.lexis.activation.infra.config.EngineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static com.lexis.activation.api.model.EvaluationOutcome.ACTIVATE;
import static com.lexis.activation.api.model.EvaluationOutcome.SKIP;
import static org.assertj.core.api.Assertions.*;

class CaffeineVerdictCacheTest {

    private static final VerdictCacheKey KEY = new VerdictCacheKey("mer", "abc123");

    private FakeTicker ticker;
    private CaffeineVerdictCache cache;

    @BeforeEach
    void setup() {
        ticker = new FakeTicker();
        cache = CaffeineVerdictCache.builder()
                .maxSize(100)
                .ttl(Duration.ofMinutes(60))
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Test
    @DisplayName("Should store and retrieve a verdict map")
    void putAndGet() throws Exception {
        // Given
        Map<String, EvaluationOutcome> verdicts = Map.of("jurisprudencia_x", ACTIVATE, "tese_y", SKIP);

        // When
        cache.put(KEY, verdicts).get();
        Optional<VerdictCache.CacheEntry> entry = cache.get(KEY).get();

        // Then
        assertThat(entry).isPresent();
        assertThat(entry.get().verdicts()).isEqualTo(verdicts);
        assertThat(entry.get().key()).isEqualTo(KEY);
    }

    @Test
    @DisplayName("Entry is served until the TTL elapses, then expires")
    void expiresAfterWrite() throws Exception {
        cache.put(KEY, Map.of("m1", ACTIVATE)).get();

        ticker.advance(Duration.ofMinutes(59));
        assertThat(cache.get(KEY).get()).isPresent();

        ticker.advance(Duration.ofMinutes(2));
        assertThat(cache.get(KEY).get()).isEmpty();
    }

    @Test
    @DisplayName("Reads do not extend the lifetime of an entry")
    void readsDoNotRefreshTtl() throws Exception {
        cache.put(KEY, Map.of("m1", ACTIVATE)).get();

        for (int i = 0; i < 6; i++) {
            ticker.advance(Duration.ofMinutes(10));
            cache.get(KEY).get();
        }
        ticker.advance(Duration.ofMinutes(1));

        assertThat(cache.get(KEY).get()).isEmpty();
    }

    @Test
    @DisplayName("Fail-closed or indeterminate verdicts cannot be cached")
    void rejectsNonDefiniteVerdicts() {
        assertThatThrownBy(() -> cache.put(KEY, Map.of("m1", EvaluationOutcome.INDETERMINATE)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("m1");
    }

    @Test
    void covers_requiresEveryRequestedId() throws Exception {
        cache.put(KEY, Map.of("m1", ACTIVATE, "m2", SKIP)).get();
        VerdictCache.CacheEntry entry = cache.get(KEY).get().orElseThrow();

        assertThat(entry.covers(List.of("m1", "m2"))).isTrue();
        assertThat(entry.covers(List.of("m1", "m3"))).isFalse();
    }

    @Test
    void invalidateDocumentType_dropsOnlyThatType() throws Exception {
        VerdictCacheKey other = new VerdictCacheKey("contestacao", "abc123");
        cache.put(KEY, Map.of("m1", ACTIVATE)).get();
        cache.put(other, Map.of("m1", SKIP)).get();

        cache.invalidateDocumentType("mer").get();

        assertThat(cache.get(KEY).get()).isEmpty();
        assertThat(cache.get(other).get()).isPresent();
    }

    @Test
    void clearAndMetrics() throws Exception {
        cache.put(KEY, Map.of("m1", ACTIVATE)).get();
        cache.get(KEY).get();
        cache.get(new VerdictCacheKey("mer", "missing")).get();

        VerdictCache.CacheMetrics metrics = cache.getMetrics();
        assertThat(metrics.hits()).isEqualTo(1);
        assertThat(metrics.misses()).isEqualTo(1);
        assertThat(metrics.format()).contains("hits=1");

        cache.clear().get();
        assertThat(cache.get(KEY).get()).isEmpty();
    }

    @Test
    void factory_honoursCacheEnabledFlag() {
        VerdictCache disabled = VerdictCacheFactory.create(EngineConfig.builder().cacheEnabled(false).build());
        VerdictCache enabled = VerdictCacheFactory.create(EngineConfig.defaults());

        assertThat(disabled).isSameAs(NoOpVerdictCache.INSTANCE);
        assertThat(enabled).isInstanceOf(CaffeineVerdictCache.class);
    }

    @Test
    void noOpCache_neverReturnsEntries() throws Exception {
        NoOpVerdictCache.INSTANCE.put(KEY, Map.of("m1", ACTIVATE)).get();

        assertThat(NoOpVerdictCache.INSTANCE.get(KEY).get()).isEmpty();
    }

    static final class FakeTicker implements Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }
    }
}
