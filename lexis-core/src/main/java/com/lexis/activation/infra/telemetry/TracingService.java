/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the OpenTelemetry SDK used for the engine's {@code plan-activation} and
 * {@code dispatch-reasoner} spans.
 *
 * <p>Configured from environment variables (system properties as fallback):
 * <ul>
 *   <li>{@code OTEL_DISABLED}: no-op tracing when true (default false)</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code logging} or {@code otlp} (default logging)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: default {@code http://localhost:4317}</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0-1.0, defaults by deployment environment</li>
 *   <li>{@code SERVICE_NAME}, {@code SERVICE_VERSION}, {@code DEPLOYMENT_ENVIRONMENT}</li>
 * </ul>
 *
 * <p>The SDK is not registered globally; components receive a {@link Tracer} from
 * {@link #getTracer()}. Close the service on shutdown to drain buffered spans.
 */
public final class TracingService implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.lexis.activation";
    private static final String DEFAULT_SERVICE_NAME = "module-activation-engine";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    public static TracingService fromEnvironment() {
        return create(TracingService::getEnvOrProperty);
    }

    /**
     * Builds the service from an arbitrary key lookup; unknown keys resolve to null.
     */
    static TracingService create(Function<String, String> settings) {
        Function<String, String> lookup = key -> {
            String value = settings.apply(key);
            return value == null || value.isBlank() ? null : value.trim();
        };

        if (Boolean.parseBoolean(lookup.apply("OTEL_DISABLED"))) {
            logger.info("OpenTelemetry tracing disabled (OTEL_DISABLED=true)");
            return noop();
        }

        try {
            String environment = orDefault(lookup.apply("DEPLOYMENT_ENVIRONMENT"), "dev");
            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
                    .put(SERVICE_NAME, orDefault(lookup.apply("SERVICE_NAME"), DEFAULT_SERVICE_NAME))
                    .put(SERVICE_VERSION, orDefault(lookup.apply("SERVICE_VERSION"), "unknown"))
                    .put(DEPLOYMENT_ENVIRONMENT, environment)
                    .build()));

            Sampler sampler = Sampler.parentBasedBuilder(
                    Sampler.traceIdRatioBased(samplingRatio(lookup.apply("OTEL_TRACE_SAMPLING_RATIO"), environment)))
                    .build();

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter(lookup))
                            .setMaxQueueSize(2048)
                            .setMaxExportBatchSize(256)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: env=%s, sampler=%s",
                    environment, sampler.getDescription()));
            return new TracingService(sdk, tracerProvider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry, falling back to no-op", e);
            return noop();
        }
    }

    static TracingService create(Map<String, String> settings) {
        return create(settings::get);
    }

    static double samplingRatio(String configured, String environment) {
        if (configured != null) {
            try {
                return Math.max(0.0, Math.min(1.0, Double.parseDouble(configured)));
            } catch (NumberFormatException e) {
                logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO '" + configured + "', using default");
            }
        }
        return switch (environment.toLowerCase()) {
            case "prod", "production" -> 0.1;
            case "staging" -> 0.5;
            default -> 1.0;
        };
    }

    private static SpanExporter exporter(Function<String, String> lookup) {
        String type = orDefault(lookup.apply("OTEL_EXPORTER_TYPE"), "logging").toLowerCase();
        if (type.equals("otlp")) {
            String endpoint = orDefault(lookup.apply("OTEL_EXPORTER_OTLP_ENDPOINT"), "http://localhost:4317");
            logger.info("Using OTLP span exporter: " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!type.equals("logging")) {
            logger.warning("Unknown exporter type '" + type + "', using logging exporter");
        }
        return LoggingSpanExporter.create();
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    public void flush() {
        if (tracerProvider == null) {
            return;
        }
        tracerProvider.forceFlush().join(10, TimeUnit.SECONDS);
    }

    /**
     * Drains buffered spans, waiting up to 30 seconds.
     */
    @Override
    public void close() {
        if (tracerProvider == null) {
            return;
        }
        logger.info("Shutting down OpenTelemetry");
        tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        return value == null || value.isEmpty() ? System.getProperty(key) : value;
    }
}
