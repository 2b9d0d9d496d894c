package com.lexis.activation.infra.metrics.impl.inmemory;

import com.lexis.activation.infra.metrics.Timer;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemoryMetricsRegistryTest {

    private final InMemoryMetricsRegistry registry = new InMemoryMetricsRegistry();

    @Test
    void counters_areKeyedByNameAndTags() {
        registry.counter("lexis_reasoner_calls_total", "document_type", "mer").increment();
        registry.counter("lexis_reasoner_calls_total", "document_type", "mer").increment(2);
        registry.counter("lexis_reasoner_calls_total", "document_type", "inicial").increment();

        assertThat(registry.getCounterValue("lexis_reasoner_calls_total", "document_type", "mer")).isEqualTo(3);
        assertThat(registry.getCounterValue("lexis_reasoner_calls_total", "document_type", "inicial")).isEqualTo(1);
        assertThat(registry.getCounterTotal("lexis_reasoner_calls_total")).isEqualTo(4);
        assertThat(registry.getCounterValue("unknown")).isZero();
    }

    @Test
    void counter_isThreadSafe() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            pool.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    registry.counter("hits").increment();
                }
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(registry.getCounterValue("hits")).isEqualTo(8000);
    }

    @Test
    void timer_percentileInterpolatesBetweenRecordings() {
        Timer timer = registry.timer("latency");
        for (int ms = 10; ms <= 100; ms += 10) {
            timer.record(Duration.ofMillis(ms));
        }

        assertThat(timer.percentile(0.0)).isEqualTo(Duration.ofMillis(10));
        assertThat(timer.percentile(1.0)).isEqualTo(Duration.ofMillis(100));
        assertThat(timer.percentile(0.5)).isEqualTo(Duration.ofMillis(55));
        assertThat(registry.getTimerRecordings("latency")).hasSize(10);
    }

    @Test
    void timer_rejectsNegativeDuration() {
        assertThatThrownBy(() -> registry.timer("latency").record(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gauge_andReset() {
        registry.gauge("in_flight").set(2.5);
        assertThat(registry.getGaugeValue("in_flight")).isEqualTo(2.5);

        registry.reset();

        assertThat(registry.getGaugeValue("in_flight")).isZero();
    }
}
