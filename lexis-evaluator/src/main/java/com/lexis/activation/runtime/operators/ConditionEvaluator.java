/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.runtime.operators;

import com.lexis.activation.api.exceptions.NormalizationException;
import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.Operator;
import com.lexis.activation.api.model.RuleNode.Condition;
import com.lexis.activation.api.model.Variable;
import com.lexis.activation.api.model.VariableSnapshot;
import com.lexis.activation.api.model.VariableType;
import com.lexis.activation.infra.metrics.Counter;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.runtime.normalization.NormalizedValue;
import com.lexis.activation.runtime.normalization.VariableNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Evaluates a single {@link Condition} against a snapshot.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>Presence operators answer from presence alone and are always definite.</li>
 *   <li>A variable marked not applicable makes every value operator SKIP.</li>
 *   <li>An absent variable, a null value or a value that fails normalization is
 *       INDETERMINATE.</li>
 *   <li>An operand that cannot be coerced to the variable's type is INDETERMINATE and
 *       logged as an authoring defect.</li>
 * </ol>
 *
 * <p>Stateless apart from metric counters; thread-safe.
 */
public final class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    private final VariableNormalizer normalizer;
    private final Counter valueFailures;
    private final Counter operandFailures;

    public ConditionEvaluator(VariableNormalizer normalizer, MetricsRegistry metrics) {
        this.normalizer = normalizer;
        this.valueFailures = metrics.counter("lexis_normalization_failures_total", "source", "value");
        this.operandFailures = metrics.counter("lexis_normalization_failures_total", "source", "operand");
    }

    public ConditionResult evaluate(Condition condition, VariableSnapshot snapshot) {
        Optional<Variable> found = snapshot.lookup(condition.variable());
        Operator operator = condition.operator();

        if (operator.isPresenceCheck()) {
            return evaluatePresence(operator, found.orElse(null));
        }
        if (found.isEmpty()) {
            return ConditionResult.indeterminate(null, "variable '" + condition.variable() + "' is absent");
        }

        Variable variable = found.get();
        if (variable.notApplicable()) {
            return new ConditionResult(EvaluationOutcome.SKIP, null,
                    "variable '" + variable.slug() + "' is not applicable");
        }
        if (variable.value() == null) {
            return ConditionResult.indeterminate(null, "variable '" + variable.slug() + "' has no value");
        }

        NormalizedValue actual;
        try {
            actual = normalizer.normalize(variable.value(), variable.type());
        } catch (NormalizationException e) {
            valueFailures.increment();
            logger.fine(() -> "Condition on '" + variable.slug() + "' is indeterminate: " + e.getMessage());
            return ConditionResult.indeterminate(variable.value(), e.getMessage());
        }

        try {
            return ConditionResult.of(apply(condition, actual), variable.value());
        } catch (NormalizationException e) {
            operandFailures.increment();
            logger.warning(String.format("Operand %s of '%s %s' cannot be read as %s: %s",
                    condition.operand(), variable.slug(), operator.wireName(),
                    variable.type().wireName(), e.getMessage()));
            return ConditionResult.indeterminate(variable.value(), "operand mismatch: " + e.getMessage());
        } catch (UnsupportedOperandException e) {
            logger.warning(e.getMessage());
            return ConditionResult.indeterminate(variable.value(), e.getMessage());
        }
    }

    private static ConditionResult evaluatePresence(Operator operator, Variable variable) {
        boolean exists = variable != null && variable.hasValue();
        boolean empty = variable == null
                || variable.notApplicable()
                || VariableNormalizer.isEmptyValue(variable.value());
        Object observed = variable != null ? variable.value() : null;
        return switch (operator) {
            case EXISTS -> ConditionResult.of(exists, observed);
            case NOT_EXISTS -> ConditionResult.of(!exists, observed);
            case IS_EMPTY -> ConditionResult.of(empty, observed);
            case IS_NOT_EMPTY -> ConditionResult.of(!empty, observed);
            default -> throw new IllegalStateException("Not a presence operator: " + operator);
        };
    }

    private boolean apply(Condition condition, NormalizedValue actual)
            throws NormalizationException, UnsupportedOperandException {
        VariableType type = actual.type();
        Object operand = condition.operand();

        return switch (condition.operator()) {
            case EQUALS -> actual.sameAs(normalizer.normalize(operand, type));
            case NOT_EQUALS -> !actual.sameAs(normalizer.normalize(operand, type));
            case CONTAINS -> contains(actual, operand);
            case NOT_CONTAINS -> !contains(actual, operand);
            case STARTS_WITH -> {
                String prefix = operandText(operand);
                yield anyText(actual, text -> text.startsWith(prefix));
            }
            case ENDS_WITH -> {
                String suffix = operandText(operand);
                yield anyText(actual, text -> text.endsWith(suffix));
            }
            case GREATER_THAN -> compare(condition, actual) > 0;
            case LESS_THAN -> compare(condition, actual) < 0;
            case GREATER_OR_EQUAL -> compare(condition, actual) >= 0;
            case LESS_OR_EQUAL -> compare(condition, actual) <= 0;
            case IN_LIST -> inList(actual, operand);
            case NOT_IN_LIST -> !inList(actual, operand);
            case MATCHES_REGEX -> anyText(actual, text -> condition.pattern().matcher(text).lookingAt());
            default -> throw new IllegalStateException("Unhandled operator: " + condition.operator());
        };
    }

    private boolean contains(NormalizedValue actual, Object operand) throws NormalizationException {
        String needle = operandText(operand);
        if (actual.type() == VariableType.LIST_OF_STRING) {
            return actual.asList().contains(needle);
        }
        return actual.text().contains(needle);
    }

    /**
     * Lists match when any element satisfies the predicate.
     */
    private static boolean anyText(NormalizedValue actual, Predicate<String> predicate) {
        if (actual.type() == VariableType.LIST_OF_STRING) {
            return actual.asList().stream().anyMatch(predicate);
        }
        return predicate.test(actual.text());
    }

    private int compare(Condition condition, NormalizedValue actual)
            throws NormalizationException, UnsupportedOperandException {
        Object operand = condition.operand();
        return switch (actual.type()) {
            case NUMBER -> actual.asNumber().compareTo(normalizer.normalize(operand, VariableType.NUMBER).asNumber());
            case DATE -> actual.asDate().compareTo(normalizer.normalize(operand, VariableType.DATE).asDate());
            // text holding a number, e.g. an amount extracted as free text
            case STRING -> normalizer.normalize(actual.value(), VariableType.NUMBER).asNumber()
                    .compareTo(normalizer.normalize(operand, VariableType.NUMBER).asNumber());
            default -> throw new UnsupportedOperandException(String.format(
                    "Operator '%s' cannot order %s variable '%s'",
                    condition.operator().wireName(), actual.type().wireName(), condition.variable()));
        };
    }

    /**
     * For list variables, true when the two lists share an element.
     */
    private boolean inList(NormalizedValue actual, Object operand) throws NormalizationException {
        Collection<?> candidates = operand instanceof Collection<?> c ? c : List.of(operand);
        if (actual.type() == VariableType.LIST_OF_STRING) {
            List<String> wanted = normalizer.normalize(new ArrayList<>(candidates), VariableType.LIST_OF_STRING).asList();
            return actual.asList().stream().anyMatch(wanted::contains);
        }
        for (Object candidate : candidates) {
            if (candidate != null && actual.sameAs(normalizer.normalize(candidate, actual.type()))) {
                return true;
            }
        }
        return false;
    }

    private String operandText(Object operand) throws NormalizationException {
        return normalizer.normalize(operand, VariableType.STRING).text();
    }

    /**
     * The operator is meaningless for the variable's type.
     */
    static final class UnsupportedOperandException extends Exception {
        UnsupportedOperandException(String message) {
            super(message);
        }
    }
}
