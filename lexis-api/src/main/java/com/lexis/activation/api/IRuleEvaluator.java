/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api;

import com.lexis.activation.api.exceptions.RuleDepthExceededException;
import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.EvaluationTrace;
import com.lexis.activation.api.model.RuleNode;
import com.lexis.activation.api.model.VariableSnapshot;

/**
 * Contract for evaluating a compiled rule tree against a variable snapshot.
 *
 * <p>Evaluation is pure: no I/O, no shared mutable state. The same instance can be used
 * concurrently from many threads and across every module of a catalog.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RuleNode rule = RuleNode.condition("pareceres_natureza_cirurgia", Operator.EQUALS, "eletiva");
 * EvaluationOutcome outcome = evaluator.evaluate(rule, snapshot);
 * }</pre>
 */
public interface IRuleEvaluator {

    /**
     * Evaluates a rule tree with three-valued logic.
     *
     * @param rule     the rule tree (must not be null)
     * @param snapshot the request's variables (must not be null)
     * @return {@link EvaluationOutcome#ACTIVATE}, {@link EvaluationOutcome#SKIP} or
     *         {@link EvaluationOutcome#INDETERMINATE}
     * @throws RuleDepthExceededException if the tree is deeper than the configured limit
     */
    EvaluationOutcome evaluate(RuleNode rule, VariableSnapshot snapshot);

    /**
     * Evaluates a rule tree and records the outcome of every node.
     *
     * <p>Intended for audit screens and rule debugging, not for the hot path.
     */
    default EvaluationTrace explain(RuleNode rule, VariableSnapshot snapshot) {
        EvaluationOutcome outcome = evaluate(rule, snapshot);
        return new EvaluationTrace(rule.toString(), outcome, null, null, null);
    }
}
