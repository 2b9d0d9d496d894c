/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.runtime.evaluation;

import com.lexis.activation.api.IRuleEvaluator;
import com.lexis.activation.api.exceptions.RuleDepthExceededException;
import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.EvaluationTrace;
import com.lexis.activation.api.model.RuleNode;
import com.lexis.activation.api.model.VariableSnapshot;
import com.lexis.activation.infra.config.EngineConfig;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.runtime.normalization.VariableNormalizer;
import com.lexis.activation.runtime.operators.ConditionEvaluator;
import com.lexis.activation.runtime.operators.ConditionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.lexis.activation.api.model.EvaluationOutcome.ACTIVATE;
import static com.lexis.activation.api.model.EvaluationOutcome.SKIP;

/**
 * Three-valued (Kleene K3) evaluator for rule trees.
 *
 * <p>Composition:
 * <ul>
 *   <li>AND: SKIP if any child is SKIP, else INDETERMINATE if any child is, else ACTIVATE.
 *       An empty AND is ACTIVATE.</li>
 *   <li>OR: ACTIVATE if any child is ACTIVATE, else INDETERMINATE if any child is, else
 *       SKIP. An empty OR is SKIP.</li>
 *   <li>NOT: swaps ACTIVATE and SKIP, keeps INDETERMINATE.</li>
 * </ul>
 *
 * <p>The tree depth is checked before evaluation starts, so the outcome of a too-deep tree
 * never depends on short-circuiting: it always fails with
 * {@link RuleDepthExceededException}.
 *
 * <p><b>Thread Safety:</b> immutable; share one instance across requests.
 */
public final class RuleEvaluator implements IRuleEvaluator {

    public static final int DEFAULT_MAX_DEPTH = 32;

    private final ConditionEvaluator conditions;
    private final int maxDepth;

    public RuleEvaluator() {
        this(DEFAULT_MAX_DEPTH, MetricsRegistry.noop());
    }

    public RuleEvaluator(int maxDepth, MetricsRegistry metrics) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.conditions = new ConditionEvaluator(new VariableNormalizer(), metrics);
    }

    public static RuleEvaluator fromConfig(EngineConfig config, MetricsRegistry metrics) {
        return new RuleEvaluator(config.getMaxRuleDepth(), metrics);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    @Override
    public EvaluationOutcome evaluate(RuleNode rule, VariableSnapshot snapshot) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(snapshot, "snapshot");
        checkDepth(rule, 1);
        return rule.accept(new OutcomeVisitor(snapshot));
    }

    @Override
    public EvaluationTrace explain(RuleNode rule, VariableSnapshot snapshot) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(snapshot, "snapshot");
        checkDepth(rule, 1);
        return rule.accept(new TraceVisitor(snapshot));
    }

    private void checkDepth(RuleNode node, int depth) {
        if (depth > maxDepth) {
            throw new RuleDepthExceededException(maxDepth);
        }
        if (node instanceof RuleNode.And and) {
            and.children().forEach(child -> checkDepth(child, depth + 1));
        } else if (node instanceof RuleNode.Or or) {
            or.children().forEach(child -> checkDepth(child, depth + 1));
        } else if (node instanceof RuleNode.Not not) {
            checkDepth(not.child(), depth + 1);
        }
    }

    private final class OutcomeVisitor implements RuleNode.Visitor<EvaluationOutcome> {
        private final VariableSnapshot snapshot;

        OutcomeVisitor(VariableSnapshot snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public EvaluationOutcome visitCondition(RuleNode.Condition condition) {
            return conditions.evaluate(condition, snapshot).outcome();
        }

        @Override
        public EvaluationOutcome visitAnd(RuleNode.And and) {
            EvaluationOutcome result = ACTIVATE;
            for (RuleNode child : and.children()) {
                result = result.and(child.accept(this));
                if (result == SKIP) {
                    return SKIP;
                }
            }
            return result;
        }

        @Override
        public EvaluationOutcome visitOr(RuleNode.Or or) {
            EvaluationOutcome result = SKIP;
            for (RuleNode child : or.children()) {
                result = result.or(child.accept(this));
                if (result == ACTIVATE) {
                    return ACTIVATE;
                }
            }
            return result;
        }

        @Override
        public EvaluationOutcome visitNot(RuleNode.Not not) {
            return not.child().accept(this).negate();
        }
    }

    /**
     * Same semantics as {@link OutcomeVisitor} without short-circuiting, so every node
     * shows up in the trace.
     */
    private final class TraceVisitor implements RuleNode.Visitor<EvaluationTrace> {
        private final VariableSnapshot snapshot;

        TraceVisitor(VariableSnapshot snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public EvaluationTrace visitCondition(RuleNode.Condition condition) {
            ConditionResult result = conditions.evaluate(condition, snapshot);
            return new EvaluationTrace(condition.toString(), result.outcome(),
                    result.observedValue(), result.detail(), List.of());
        }

        @Override
        public EvaluationTrace visitAnd(RuleNode.And and) {
            List<EvaluationTrace> children = new ArrayList<>();
            EvaluationOutcome result = ACTIVATE;
            for (RuleNode child : and.children()) {
                EvaluationTrace trace = child.accept(this);
                children.add(trace);
                result = result.and(trace.outcome());
            }
            return new EvaluationTrace("and", result, null, null, children);
        }

        @Override
        public EvaluationTrace visitOr(RuleNode.Or or) {
            List<EvaluationTrace> children = new ArrayList<>();
            EvaluationOutcome result = SKIP;
            for (RuleNode child : or.children()) {
                EvaluationTrace trace = child.accept(this);
                children.add(trace);
                result = result.or(trace.outcome());
            }
            return new EvaluationTrace("or", result, null, null, children);
        }

        @Override
        public EvaluationTrace visitNot(RuleNode.Not not) {
            EvaluationTrace child = not.child().accept(this);
            return new EvaluationTrace("not", child.outcome().negate(), null, null, List.of(child));
        }
    }
}
