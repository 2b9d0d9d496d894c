/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.planner.dispatch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.lexis.activation.api.ReasonerClient;
import com.lexis.activation.api.exceptions.DispatchTimeoutException;
import com.lexis.activation.api.exceptions.DispatchTransportException;
import com.lexis.activation.api.exceptions.ReasonerException;
import com.lexis.activation.api.model.ContentModule;
import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.PlanWarning;
import com.lexis.activation.api.model.ReasonerRequest;
import com.lexis.activation.api.model.ReasonerResponse;
import com.lexis.activation.api.model.VariableSnapshot;
import com.lexis.activation.api.model.VerdictCacheKey;
import com.lexis.activation.infra.cache.NoOpVerdictCache;
import com.lexis.activation.infra.cache.VerdictCache;
import com.lexis.activation.infra.cache.VerdictCacheFactory;
import com.lexis.activation.infra.config.EngineConfig;
import com.lexis.activation.infra.metrics.Counter;
import com.lexis.activation.infra.metrics.Gauge;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.infra.metrics.Timer;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves indeterminate modules through the external reasoner.
 *
 * <h2>Dispatch protocol</h2>
 * <ol>
 *   <li>Key the request by document type and a hash of the variables the modules read.</li>
 *   <li>Answer from the verdict cache when an entry covers every requested module.</li>
 *   <li>Otherwise join the in-flight call for the same key and module set, or start one.
 *       At most one reasoner call per key and module set is in flight at any time.</li>
 *   <li>Validate the response: missing modules are skipped with a warning, unknown ids
 *       are ignored.</li>
 *   <li>Write the answered verdicts to the cache before the flight completes and its key
 *       is released.</li>
 * </ol>
 *
 * <h2>Failures</h2>
 * <p>When the reasoner does not answer within the timeout, or the call fails, every
 * pending module fails closed to SKIP and the plan carries a warning. Nothing is cached for
 * a failed dispatch. A reasoner answer that arrives after the timeout is still validated
 * and cached; the call itself is never interrupted.
 *
 * <h2>Threading</h2>
 * <p>Reasoner calls run on a dedicated daemon pool. Callers receive a private copy of the
 * shared flight, so cancelling one caller's future never cancels a call that other
 * callers are waiting on.
 */
public final class ReasonerDispatcher implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ReasonerDispatcher.class.getName());

    static final String REASONER_CALLS_METRIC = "lexis_reasoner_calls_total";
    static final String SINGLE_FLIGHT_JOINS_METRIC = "lexis_single_flight_joins_total";
    static final String CACHE_HITS_METRIC = "lexis_verdict_cache_hits_total";
    static final String CACHE_MISSES_METRIC = "lexis_verdict_cache_misses_total";
    static final String DISPATCH_FAILURES_METRIC = "lexis_dispatch_failures_total";
    static final String INCOMPLETE_RESPONSES_METRIC = "lexis_incomplete_reasoner_responses_total";
    static final String LATE_RESPONSES_METRIC = "lexis_late_reasoner_responses_total";
    static final String REASONER_LATENCY_METRIC = "lexis_reasoner_latency";
    static final String IN_FLIGHT_METRIC = "lexis_reasoner_in_flight";

    static final String NOT_APPLICABLE = "not_applicable";

    private final ReasonerClient client;
    private final VerdictCache cache;
    private final Duration timeout;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final SnapshotHasher hasher;
    private final Tracer tracer;

    private final Map<FlightKey, CompletableFuture<DispatchResult>> inFlight = new ConcurrentHashMap<>();

    private final Counter reasonerCalls;
    private final Counter singleFlightJoins;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter timeouts;
    private final Counter transportErrors;
    private final Counter incompleteResponses;
    private final Counter lateResponses;
    private final Timer reasonerLatency;
    private final Gauge inFlightGauge;

    private ReasonerDispatcher(Builder builder) {
        this.client = Objects.requireNonNull(builder.client, "reasoner client is required");
        this.cache = builder.cache;
        this.timeout = builder.timeout;
        this.hasher = builder.hasher;
        this.tracer = builder.tracer;
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newFixedThreadPool(builder.threads,
                    new ThreadFactoryBuilder()
                            .setNameFormat("reasoner-dispatch-%d")
                            .setDaemon(true)
                            .build());
            this.ownsExecutor = true;
        }

        MetricsRegistry metrics = builder.metrics;
        this.reasonerCalls = metrics.counter(REASONER_CALLS_METRIC);
        this.singleFlightJoins = metrics.counter(SINGLE_FLIGHT_JOINS_METRIC);
        this.cacheHits = metrics.counter(CACHE_HITS_METRIC);
        this.cacheMisses = metrics.counter(CACHE_MISSES_METRIC);
        this.timeouts = metrics.counter(DISPATCH_FAILURES_METRIC, "reason", "timeout");
        this.transportErrors = metrics.counter(DISPATCH_FAILURES_METRIC, "reason", "transport");
        this.incompleteResponses = metrics.counter(INCOMPLETE_RESPONSES_METRIC);
        this.lateResponses = metrics.counter(LATE_RESPONSES_METRIC);
        this.reasonerLatency = metrics.timer(REASONER_LATENCY_METRIC);
        this.inFlightGauge = metrics.gauge(IN_FLIGHT_METRIC);

        logger.info(String.format("ReasonerDispatcher initialized: timeout=%dms, executor=%s",
                timeout.toMillis(), ownsExecutor ? builder.threads + " threads" : "external"));
    }

    /**
     * Verdicts for the given modules. The returned future never completes exceptionally:
     * failures become a fail-closed result.
     */
    public CompletableFuture<DispatchResult> resolve(String documentType,
                                                     List<ContentModule> modules,
                                                     VariableSnapshot snapshot) {
        if (modules.isEmpty()) {
            return CompletableFuture.completedFuture(DispatchResult.empty());
        }

        Span span = tracer.spanBuilder("dispatch-reasoner").startSpan();
        span.setAttribute("documentType", documentType);
        span.setAttribute("moduleCount", modules.size());

        ReasonerRequest request = buildRequest(documentType, modules, snapshot);
        Set<String> moduleIds = new TreeSet<>(request.moduleIds());
        VerdictCacheKey cacheKey = new VerdictCacheKey(documentType,
                hasher.hash(snapshot.subset(request.variables().keySet())));

        CompletableFuture<DispatchResult> result = lookup(cacheKey, moduleIds)
                .thenCompose(hit -> {
                    if (hit.isPresent()) {
                        cacheHits.increment();
                        span.setAttribute("cacheHit", true);
                        return CompletableFuture.completedFuture(hit.get());
                    }
                    cacheMisses.increment();
                    span.setAttribute("cacheHit", false);
                    return joinOrLaunch(new FlightKey(cacheKey, List.copyOf(moduleIds)), request, span)
                            .copy()
                            .handle((dispatched, error) -> error == null
                                    ? dispatched
                                    : failClosed(cacheKey, moduleIds, error));
                });

        return result.whenComplete((dispatched, error) -> {
            if (dispatched != null) {
                span.setAttribute("failedClosed", dispatched.failedClosed());
                if (dispatched.failedClosed()) {
                    span.setStatus(StatusCode.ERROR, "reasoner dispatch failed closed");
                }
            }
            span.end();
        });
    }

    /**
     * Builds the batched request: module briefs and only the variables they read.
     * Not-applicable variables are sent as the {@value #NOT_APPLICABLE} marker.
     */
    ReasonerRequest buildRequest(String documentType, List<ContentModule> modules, VariableSnapshot snapshot) {
        List<ReasonerRequest.ModuleBrief> briefs = new ArrayList<>(modules.size());
        Set<String> slugs = new LinkedHashSet<>();
        for (ContentModule module : modules) {
            briefs.add(ReasonerRequest.ModuleBrief.of(module));
            slugs.addAll(module.reasonerVariables());
        }
        Map<String, Object> variables = new LinkedHashMap<>();
        for (String slug : slugs) {
            snapshot.lookup(slug).ifPresent(v -> variables.put(slug, v.notApplicable() ? NOT_APPLICABLE : v.value()));
        }
        return new ReasonerRequest(documentType, briefs, variables);
    }

    private CompletableFuture<Optional<DispatchResult>> lookup(VerdictCacheKey key, Set<String> moduleIds) {
        return cache.get(key)
                .thenApply(entry -> entry
                        .filter(e -> e.covers(moduleIds))
                        .map(e -> {
                            Map<String, EvaluationOutcome> verdicts = new LinkedHashMap<>();
                            moduleIds.forEach(id -> verdicts.put(id, e.verdicts().get(id)));
                            return new DispatchResult(verdicts, List.of(), true, false);
                        }))
                .exceptionally(error -> {
                    logger.log(Level.WARNING, "Verdict cache lookup failed for " + key + ", treating as miss", error);
                    return Optional.empty();
                });
    }

    private CompletableFuture<DispatchResult> joinOrLaunch(FlightKey flightKey, ReasonerRequest request, Span span) {
        CompletableFuture<DispatchResult> flight = new CompletableFuture<>();
        CompletableFuture<DispatchResult> existing = inFlight.putIfAbsent(flightKey, flight);
        if (existing != null) {
            singleFlightJoins.increment();
            span.setAttribute("singleFlightJoin", true);
            logger.fine(() -> "Joining in-flight reasoner call for " + flightKey.cacheKey());
            return existing;
        }
        span.setAttribute("singleFlightJoin", false);
        inFlightGauge.set(inFlight.size());

        // the key is released on success, failure and timeout alike
        flight.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((r, e) -> {
                    inFlight.remove(flightKey, flight);
                    inFlightGauge.set(inFlight.size());
                });

        // a previous flight may have stored these verdicts and left between our lookup and putIfAbsent
        lookup(flightKey.cacheKey(), new TreeSet<>(flightKey.moduleIds()))
                .thenCompose(hit -> {
                    if (hit.isPresent()) {
                        span.setAttribute("cacheRecheckHit", true);
                        logger.fine(() -> "Verdicts for " + flightKey.cacheKey() + " were cached by a finished call");
                        return CompletableFuture.completedFuture(hit.get());
                    }
                    return CompletableFuture
                            .supplyAsync(() -> call(request), executor)
                            .thenApply(response -> validate(request, response))
                            .thenCompose(validated -> store(flightKey.cacheKey(), validated, flight));
                })
                .whenComplete((validated, error) -> {
                    if (error != null) {
                        flight.completeExceptionally(unwrap(error));
                    } else {
                        flight.complete(validated);
                    }
                });
        return flight;
    }

    private ReasonerResponse call(ReasonerRequest request) {
        reasonerCalls.increment();
        long start = System.nanoTime();
        try {
            ReasonerResponse response = client.reason(request);
            if (response == null) {
                throw new ReasonerException("Reasoner returned no response");
            }
            return response;
        } catch (ReasonerException e) {
            throw new CompletionException(new DispatchTransportException(e.getMessage(), e));
        } catch (RuntimeException e) {
            throw new CompletionException(new DispatchTransportException("Reasoner client failed: " + e, e));
        } finally {
            reasonerLatency.record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    DispatchResult validate(ReasonerRequest request, ReasonerResponse response) {
        Set<String> requested = new LinkedHashSet<>(request.moduleIds());
        Map<String, EvaluationOutcome> verdicts = new LinkedHashMap<>();
        for (ReasonerResponse.ModuleVerdict verdict : response.verdicts()) {
            if (verdict.moduleId() == null || !requested.contains(verdict.moduleId())) {
                logger.info("Ignoring reasoner verdict for unknown module '" + verdict.moduleId() + "'");
                continue;
            }
            verdicts.putIfAbsent(verdict.moduleId(), EvaluationOutcome.of(verdict.activate()));
        }

        List<PlanWarning> warnings = new ArrayList<>();
        for (String id : requested) {
            if (!verdicts.containsKey(id)) {
                verdicts.put(id, EvaluationOutcome.SKIP);
                warnings.add(PlanWarning.forModule(PlanWarning.Kind.INCOMPLETE_REASONER_RESPONSE, id,
                        "Reasoner returned no verdict for module '" + id + "'; skipped"));
            }
        }
        if (!warnings.isEmpty()) {
            incompleteResponses.increment();
            logger.warning("Reasoner response for '" + request.documentType() + "' missed "
                    + warnings.size() + " of " + requested.size() + " modules");
        }
        return new DispatchResult(verdicts, warnings, false, false);
    }

    private CompletableFuture<DispatchResult> store(VerdictCacheKey key, DispatchResult validated,
                                                    CompletableFuture<DispatchResult> flight) {
        if (flight.isDone()) {
            lateResponses.increment();
            logger.info("Reasoner answered " + key + " after the timeout; caching the late verdicts");
        }
        // modules skipped for lack of a verdict stay out of the cache, so the next request asks again
        Set<String> unanswered = new HashSet<>();
        validated.warnings().forEach(w -> unanswered.add(w.moduleId()));
        Map<String, EvaluationOutcome> answered = new LinkedHashMap<>(validated.verdicts());
        answered.keySet().removeAll(unanswered);
        if (answered.isEmpty()) {
            return CompletableFuture.completedFuture(validated);
        }
        return cache.put(key, answered)
                .handle((ignored, error) -> {
                    if (error != null) {
                        logger.log(Level.WARNING, "Failed to cache verdicts for " + key, error);
                    }
                    return validated;
                });
    }

    private DispatchResult failClosed(VerdictCacheKey key, Set<String> moduleIds, Throwable error) {
        Throwable cause = unwrap(error);
        PlanWarning warning;
        if (cause instanceof TimeoutException) {
            timeouts.increment();
            DispatchTimeoutException timeoutError = new DispatchTimeoutException(key.toString(), timeout);
            logger.warning(timeoutError.getMessage() + "; skipping " + moduleIds);
            warning = PlanWarning.forDispatch(PlanWarning.Kind.DISPATCH_TIMEOUT, timeoutError.getMessage());
        } else {
            transportErrors.increment();
            logger.log(Level.WARNING, "Reasoner call for " + key + " failed; skipping " + moduleIds, cause);
            warning = PlanWarning.forDispatch(PlanWarning.Kind.DISPATCH_TRANSPORT_ERROR,
                    "Reasoner call failed: " + cause.getMessage());
        }
        return DispatchResult.failClosed(moduleIds, warning);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Number of reasoner calls currently being awaited.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static ReasonerDispatcher fromConfig(EngineConfig config, ReasonerClient client,
                                                MetricsRegistry metrics, Tracer tracer) {
        return builder(client)
                .cache(VerdictCacheFactory.create(config))
                .timeout(config.getReasonerTimeout())
                .threads(config.getDispatcherThreads())
                .metrics(metrics)
                .tracer(tracer)
                .build();
    }

    public static Builder builder(ReasonerClient client) {
        return new Builder(client);
    }

    private record FlightKey(VerdictCacheKey cacheKey, List<String> moduleIds) {
    }

    public static final class Builder {
        private final ReasonerClient client;
        private VerdictCache cache = NoOpVerdictCache.INSTANCE;
        private Duration timeout = Duration.ofSeconds(30);
        private ExecutorService executor;
        private int threads = 4;
        private MetricsRegistry metrics = MetricsRegistry.getInstance();
        private Tracer tracer = OpenTelemetry.noop().getTracer("noop");
        private SnapshotHasher hasher = new SnapshotHasher();

        private Builder(ReasonerClient client) {
            this.client = client;
        }

        public Builder cache(VerdictCache cache) {
            this.cache = Objects.requireNonNull(cache);
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Runs reasoner calls on a caller-owned executor, which {@link #close()} leaves
         * running.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder threads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("threads must be positive");
            }
            this.threads = threads;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = Objects.requireNonNull(metrics);
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer);
            return this;
        }

        public Builder hasher(SnapshotHasher hasher) {
            this.hasher = Objects.requireNonNull(hasher);
            return this;
        }

        public ReasonerDispatcher build() {
            return new ReasonerDispatcher(this);
        }
    }
}
