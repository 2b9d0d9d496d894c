package com.lexis.activation.infra.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TracingServiceTest {

    @Test
    void disabledFlag_yieldsNoopService() {
        TracingService service = TracingService.create(Map.of("OTEL_DISABLED", "true"));

        assertThat(service.isEnabled()).isFalse();
        Span span = service.getTracer().spanBuilder("plan-activation").startSpan();
        assertThat(span.getSpanContext().isValid()).isFalse();
        span.end();
    }

    @Test
    void loggingExporter_producesRecordingSpans() {
        try (TracingService service = TracingService.create(Map.of(
                "OTEL_EXPORTER_TYPE", "logging",
                "OTEL_TRACE_SAMPLING_RATIO", "1.0"))) {
            assertThat(service.isEnabled()).isTrue();

            Span span = service.getTracer().spanBuilder("plan-activation").startSpan();
            assertThat(span.getSpanContext().isValid()).isTrue();
            assertThat(span.isRecording()).isTrue();
            span.end();
            service.flush();
        }
    }

    @Test
    void samplingRatio_defaultsByEnvironmentAndClampsConfiguredValues() {
        assertThat(TracingService.samplingRatio(null, "prod")).isEqualTo(0.1);
        assertThat(TracingService.samplingRatio(null, "staging")).isEqualTo(0.5);
        assertThat(TracingService.samplingRatio(null, "dev")).isEqualTo(1.0);
        assertThat(TracingService.samplingRatio("7", "prod")).isEqualTo(1.0);
        assertThat(TracingService.samplingRatio("abc", "prod")).isEqualTo(0.1);
    }
}
