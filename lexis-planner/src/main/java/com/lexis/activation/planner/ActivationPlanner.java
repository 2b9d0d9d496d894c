/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.planner;

import com.lexis.activation.api.IActivationPlanner;
import com.lexis.activation.api.IRuleEvaluator;
import com.lexis.activation.api.ModuleCatalogProvider;
import com.lexis.activation.api.exceptions.MisconfiguredModuleException;
import com.lexis.activation.api.exceptions.RuleDepthExceededException;
import com.lexis.activation.api.model.ActivationPlan;
import com.lexis.activation.api.model.ContentModule;
import com.lexis.activation.api.model.DispatchMode;
import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.ModuleCatalog;
import com.lexis.activation.api.model.ModuleDecision;
import com.lexis.activation.api.model.ModuleDecision.Source;
import com.lexis.activation.api.model.PlanWarning;
import com.lexis.activation.api.model.VariableDependency;
import com.lexis.activation.api.model.VariableSnapshot;
import com.lexis.activation.compiler.CompiledCatalog;
import com.lexis.activation.compiler.InMemoryModuleCatalogProvider;
import com.lexis.activation.compiler.preprocessing.ConditionalVariablePreprocessor;
import com.lexis.activation.infra.config.EngineConfig;
import com.lexis.activation.infra.metrics.Counter;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.infra.metrics.Timer;
import com.lexis.activation.planner.dispatch.DispatchResult;
import com.lexis.activation.planner.dispatch.ReasonerDispatcher;
import com.lexis.activation.runtime.evaluation.RuleEvaluator;
import com.lexis.activation.runtime.normalization.VariableNormalizer;
import com.lexis.activation.runtime.operators.ConditionEvaluator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hybrid activation planner: local rules first, the reasoner only for what rules cannot
 * decide.
 *
 * <h2>Per-module evaluation</h2>
 * <ul>
 *   <li>{@code ALWAYS}: activated without evaluation.</li>
 *   <li>{@code DETERMINISTIC}: primary rule; the fallback rule only when the primary is
 *       indeterminate. Still indeterminate after both, the module goes to the reasoner.
 *       No primary rule, or a rule too deep to evaluate, makes the module misconfigured:
 *       it is excluded and reported, never fatal.</li>
 *   <li>{@code LLM}: always goes to the reasoner.</li>
 * </ul>
 *
 * <h2>Dispatch modes</h2>
 * <ul>
 *   <li>{@link DispatchMode#FAST_PATH}: nothing indeterminate, the dispatcher is not
 *       touched.</li>
 *   <li>{@link DispatchMode#LLM_ONLY}: the catalog has no deterministic modules and at
 *       least one module needs the reasoner.</li>
 *   <li>{@link DispatchMode#MIXED}: otherwise.</li>
 * </ul>
 *
 * <p>The ordered module list is the union of always, rule-activated and
 * reasoner-activated modules, stable-sorted by ordering key. It does not depend on which
 * path resolved a module.
 */
public final class ActivationPlanner implements IActivationPlanner {

    private static final Logger logger = Logger.getLogger(ActivationPlanner.class.getName());

    static final String PLANS_METRIC = "lexis_activation_plans_total";
    static final String MISCONFIGURED_METRIC = "lexis_misconfigured_modules_total";
    static final String PLAN_LATENCY_METRIC = "lexis_activation_plan_latency";

    private final ModuleCatalogProvider catalogProvider;
    private final IRuleEvaluator evaluator;
    private final ReasonerDispatcher dispatcher;
    private final ConditionalVariablePreprocessor preprocessor;
    private final Map<String, List<VariableDependency>> dependencies;
    private final MetricsRegistry metrics;
    private final Tracer tracer;
    private final Timer planLatency;

    private ActivationPlanner(Builder builder) {
        this.catalogProvider = builder.catalogProvider;
        this.evaluator = builder.evaluator;
        this.dispatcher = builder.dispatcher;
        this.preprocessor = builder.preprocessor;
        this.dependencies = new ConcurrentHashMap<>(builder.dependencies);
        this.metrics = builder.metrics;
        this.tracer = builder.tracer;
        this.planLatency = metrics.timer(PLAN_LATENCY_METRIC);
    }

    /**
     * Replaces the conditional variable declarations of a document type, e.g. after its
     * catalog was reloaded. Plans already running keep the previous list.
     */
    public void registerDependencies(String documentType, List<VariableDependency> declared) {
        dependencies.put(documentType, List.copyOf(declared));
    }

    @Override
    public ActivationPlan plan(String documentType, VariableSnapshot snapshot) {
        if (catalogProvider == null) {
            throw new IllegalStateException("No ModuleCatalogProvider configured");
        }
        return plan(catalogProvider.catalogFor(documentType), snapshot);
    }

    @Override
    public ActivationPlan plan(ModuleCatalog catalog, VariableSnapshot snapshot) {
        try {
            return planAsync(catalog, snapshot).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    @Override
    public CompletableFuture<ActivationPlan> planAsync(ModuleCatalog catalog, VariableSnapshot snapshot) {
        Span span = tracer.spanBuilder("plan-activation").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("documentType", catalog.documentType());
            span.setAttribute("moduleCount", catalog.modules().size());

            LocalPass local = evaluate(catalog, snapshot);
            span.setAttribute("indeterminateCount", local.pending.size());

            CompletableFuture<ActivationPlan> plan;
            if (local.pending.isEmpty() || dispatcher == null) {
                plan = CompletableFuture.completedFuture(assemble(local, null));
            } else {
                plan = dispatcher.resolve(catalog.documentType(), local.pending, local.snapshot)
                        .thenApply(result -> assemble(local, result));
            }

            return plan.whenComplete((result, error) -> {
                if (result != null) {
                    span.setAttribute("dispatchMode", result.dispatchMode().wireName());
                    span.setAttribute("activatedCount", result.orderedModules().size());
                    span.setAttribute("warningCount", result.warnings().size());
                    metrics.counter(PLANS_METRIC, "mode", result.dispatchMode().wireName()).increment();
                }
                if (error != null) {
                    span.recordException(error);
                }
                planLatency.record(Duration.ofNanos(System.nanoTime() - start));
                span.end();
            });
        } catch (RuntimeException e) {
            span.recordException(e);
            span.end();
            throw e;
        }
    }

    @Override
    public ActivationPlan evaluateLocally(ModuleCatalog catalog, VariableSnapshot snapshot) {
        return assemble(evaluate(catalog, snapshot), null);
    }

    private LocalPass evaluate(ModuleCatalog catalog, VariableSnapshot snapshot) {
        VariableSnapshot prepared = preprocessor.apply(snapshot,
                dependencies.getOrDefault(catalog.documentType(), List.of()));
        LocalPass local = new LocalPass(catalog, prepared);

        for (ContentModule module : catalog.modules()) {
            switch (module.activationMode()) {
                case ALWAYS -> local.decide(module, EvaluationOutcome.ACTIVATE, Source.ALWAYS);
                case LLM -> local.pending.add(module);
                case DETERMINISTIC -> evaluateDeterministic(module, local);
            }
        }
        return local;
    }

    private void evaluateDeterministic(ContentModule module, LocalPass local) {
        local.hasDeterministic = true;
        if (module.isMisconfigured()) {
            misconfigured(module, local, PlanWarning.Kind.MISCONFIGURED_MODULE,
                    "Deterministic module '" + module.id() + "' has no primary rule");
            return;
        }
        try {
            EvaluationOutcome outcome = evaluator.evaluate(module.primaryRule(), local.snapshot);
            Source source = Source.PRIMARY_RULE;
            if (outcome == EvaluationOutcome.INDETERMINATE && module.fallbackRule() != null) {
                outcome = evaluator.evaluate(module.fallbackRule(), local.snapshot);
                source = Source.FALLBACK_RULE;
            }
            if (outcome.isDefinite()) {
                local.decide(module, outcome, source);
            } else {
                local.pending.add(module);
            }
        } catch (RuleDepthExceededException e) {
            misconfigured(module, local, PlanWarning.Kind.RULE_DEPTH_EXCEEDED,
                    "Module '" + module.id() + "': " + e.getMessage());
        } catch (MisconfiguredModuleException e) {
            misconfigured(module, local, PlanWarning.Kind.MISCONFIGURED_MODULE,
                    "Module '" + module.id() + "': " + e.getMessage());
        }
    }

    private void misconfigured(ContentModule module, LocalPass local, PlanWarning.Kind kind, String message) {
        logger.warning(message + " - excluded from the plan");
        metrics.counter(MISCONFIGURED_METRIC, "module", module.id()).increment();
        local.warnings.add(PlanWarning.forModule(kind, module.id(), message));
        local.misconfigured.add(module.id());
        local.decisions.add(new ModuleDecision(module.id(), EvaluationOutcome.MISCONFIGURED_MODULE, Source.MISCONFIGURED));
    }

    private ActivationPlan assemble(LocalPass local, DispatchResult dispatched) {
        List<String> activatedAlways = new ArrayList<>();
        List<String> activatedDeterministic = new ArrayList<>();
        List<String> skippedDeterministic = new ArrayList<>();
        List<String> activatedLlm = new ArrayList<>();
        List<String> skippedLlm = new ArrayList<>();
        Set<String> included = new HashSet<>();
        List<ModuleDecision> decisions = new ArrayList<>(local.decisions);
        List<PlanWarning> warnings = new ArrayList<>(local.warnings);

        for (ModuleDecision decision : local.decisions) {
            ContentModule module = local.catalog.find(decision.moduleId()).orElseThrow();
            switch (decision.source()) {
                case ALWAYS -> {
                    activatedAlways.add(module.id());
                    included.add(module.id());
                }
                case PRIMARY_RULE, FALLBACK_RULE -> {
                    if (decision.outcome() == EvaluationOutcome.ACTIVATE) {
                        activatedDeterministic.add(module.id());
                        included.add(module.id());
                    } else {
                        skippedDeterministic.add(module.id());
                    }
                }
                default -> {
                    // misconfigured modules are already reported
                }
            }
        }

        List<String> indeterminate = local.pending.stream().map(ContentModule::id).toList();
        boolean fromCache = false;
        if (dispatched != null) {
            warnings.addAll(dispatched.warnings());
            fromCache = dispatched.fromCache();
            Source source = dispatched.failedClosed() ? Source.REASONER_FAIL_CLOSED : Source.REASONER;
            for (ContentModule module : local.pending) {
                EvaluationOutcome verdict = dispatched.verdictFor(module.id());
                decisions.add(new ModuleDecision(module.id(), verdict, source));
                if (verdict == EvaluationOutcome.ACTIVATE) {
                    activatedLlm.add(module.id());
                    included.add(module.id());
                } else {
                    skippedLlm.add(module.id());
                }
            }
        } else {
            for (ContentModule module : local.pending) {
                decisions.add(new ModuleDecision(module.id(), EvaluationOutcome.INDETERMINATE, Source.UNRESOLVED));
            }
        }

        // the catalog order breaks ties
        List<String> ordered = local.catalog.modules().stream()
                .filter(module -> included.contains(module.id()))
                .sorted(Comparator.comparingInt(ContentModule::orderingKey))
                .map(ContentModule::id)
                .toList();

        DispatchMode mode;
        if (local.pending.isEmpty()) {
            mode = DispatchMode.FAST_PATH;
        } else if (!local.hasDeterministic) {
            mode = DispatchMode.LLM_ONLY;
        } else {
            mode = DispatchMode.MIXED;
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Plan for '%s': mode=%s, activated=%s, indeterminate=%s",
                    local.catalog.documentType(), mode.wireName(), ordered, indeterminate));
        }

        return new ActivationPlan(
                local.catalog.documentType(),
                activatedAlways,
                activatedDeterministic,
                skippedDeterministic,
                indeterminate,
                activatedLlm,
                skippedLlm,
                local.misconfigured,
                ordered,
                mode,
                warnings,
                decisions,
                fromCache);
    }

    /**
     * Mutable state of one local evaluation pass. Confined to the planning thread.
     */
    private static final class LocalPass {
        final ModuleCatalog catalog;
        final VariableSnapshot snapshot;
        final List<ModuleDecision> decisions = new ArrayList<>();
        final List<ContentModule> pending = new ArrayList<>();
        final List<String> misconfigured = new ArrayList<>();
        final List<PlanWarning> warnings = new ArrayList<>();
        boolean hasDeterministic;

        LocalPass(ModuleCatalog catalog, VariableSnapshot snapshot) {
            this.catalog = catalog;
            this.snapshot = snapshot;
        }

        void decide(ContentModule module, EvaluationOutcome outcome, Source source) {
            decisions.add(new ModuleDecision(module.id(), outcome, source));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Planner wired from configuration: rule depth limit, cache and dispatcher settings.
     */
    public static ActivationPlanner fromConfig(EngineConfig config, ModuleCatalogProvider catalogs,
                                               ReasonerDispatcher dispatcher, MetricsRegistry metrics,
                                               Tracer tracer) {
        return builder()
                .catalogProvider(catalogs)
                .evaluator(RuleEvaluator.fromConfig(config, metrics))
                .dispatcher(dispatcher)
                .metrics(metrics)
                .tracer(tracer)
                .build();
    }

    public static final class Builder {
        private ModuleCatalogProvider catalogProvider;
        private InMemoryModuleCatalogProvider registeredCatalogs;
        private IRuleEvaluator evaluator;
        private ReasonerDispatcher dispatcher;
        private ConditionalVariablePreprocessor preprocessor;
        private final Map<String, List<VariableDependency>> dependencies = new ConcurrentHashMap<>();
        private MetricsRegistry metrics = MetricsRegistry.getInstance();
        private Tracer tracer = OpenTelemetry.noop().getTracer("noop");

        public Builder catalogProvider(ModuleCatalogProvider catalogProvider) {
            this.catalogProvider = catalogProvider;
            return this;
        }

        /**
         * Registers a loaded catalog and its conditional variables. Only used when no
         * explicit {@link #catalogProvider(ModuleCatalogProvider)} is set.
         */
        public Builder catalog(CompiledCatalog compiled) {
            if (registeredCatalogs == null) {
                registeredCatalogs = new InMemoryModuleCatalogProvider();
            }
            registeredCatalogs.register(compiled);
            return dependencies(compiled.catalog().documentType(), compiled.dependencies());
        }

        public Builder dependencies(String documentType, List<VariableDependency> declared) {
            dependencies.put(documentType, List.copyOf(declared));
            return this;
        }

        public Builder evaluator(IRuleEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        /**
         * Without a dispatcher, indeterminate modules are reported as unresolved.
         */
        public Builder dispatcher(ReasonerDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder preprocessor(ConditionalVariablePreprocessor preprocessor) {
            this.preprocessor = preprocessor;
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

        public ActivationPlanner build() {
            if (catalogProvider == null) {
                catalogProvider = registeredCatalogs;
            }
            if (evaluator == null) {
                evaluator = new RuleEvaluator(RuleEvaluator.DEFAULT_MAX_DEPTH, metrics);
            }
            if (preprocessor == null) {
                preprocessor = new ConditionalVariablePreprocessor(
                        new ConditionEvaluator(new VariableNormalizer(), metrics));
            }
            return new ActivationPlanner(this);
        }
    }
}
