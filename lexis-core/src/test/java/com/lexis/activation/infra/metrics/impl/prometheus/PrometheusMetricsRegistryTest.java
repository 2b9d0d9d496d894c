package com.lexis.activation.infra.metrics.impl.prometheus;

import com.lexis.activation.infra.metrics.Counter;
import com.lexis.activation.infra.metrics.Gauge;
import com.lexis.activation.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectors;
    private PrometheusMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        collectors = new CollectorRegistry();
        registry = new PrometheusMetricsRegistry(collectors);
    }

    @Test
    void counter_sameNameAndTags_returnsSameInstance() {
        Counter first = registry.counter("reasoner_calls", "document_type", "mer");
        Counter second = registry.counter("reasoner_calls", "document_type", "mer");

        assertThat(first).isSameAs(second);
    }

    @Test
    void counter_differentTagValues_shareCollectorButCountIndependently() {
        registry.counter("reasoner_calls", "document_type", "mer").increment();
        registry.counter("reasoner_calls", "document_type", "mer").increment();
        registry.counter("reasoner_calls", "document_type", "contestacao").increment();

        assertThat(collectors.getSampleValue("reasoner_calls_total",
                new String[]{"document_type"}, new String[]{"mer"})).isEqualTo(2.0);
        assertThat(collectors.getSampleValue("reasoner_calls_total",
                new String[]{"document_type"}, new String[]{"contestacao"})).isEqualTo(1.0);
    }

    @Test
    void counter_negativeIncrement_throwsException() {
        Counter counter = registry.counter("cache_hits");

        assertThatThrownBy(() -> counter.increment(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void counter_oddTagCount_isRejected() {
        assertThatThrownBy(() -> registry.counter("broken", "document_type"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pairs");
    }

    @Test
    void gauge_setAndRead() {
        Gauge inFlight = registry.gauge("dispatch_in_flight");

        inFlight.set(3);

        assertThat(inFlight.value()).isEqualTo(3.0);
        assertThat(collectors.getSampleValue("dispatch_in_flight")).isEqualTo(3.0);
    }

    @Test
    void timer_recordsObservationsInSeconds() throws Exception {
        Timer timer = registry.timer("plan_latency");

        timer.record(Duration.ofMillis(250));
        String result = timer.record(() -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(collectors.getSampleValue("plan_latency_seconds_count")).isEqualTo(2.0);
        assertThat(collectors.getSampleValue("plan_latency_seconds_sum")).isGreaterThanOrEqualTo(0.25);
        assertThat(((PrometheusTimerAdapter) timer).observationCount()).isEqualTo(2L);
    }

    @Test
    void timer_percentile_isNotSupported() {
        Timer timer = registry.timer("plan_latency");

        assertThatThrownBy(() -> timer.percentile(0.99))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("histogram_quantile");
    }

    @Test
    void sanitizeName_replacesIllegalCharacters() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Lexis.Cache-Hits")).isEqualTo("lexis_cache_hits");
    }
}
