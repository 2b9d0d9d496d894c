package com.lexis.activation.compiler.preprocessing;

import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.Variable;
import com.lexis.activation.api.model.VariableDependency;
import com.lexis.activation.api.model.VariableSnapshot;
import com.lexis.activation.api.model.VariableType;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.runtime.normalization.VariableNormalizer;
import com.lexis.activation.runtime.operators.ConditionEvaluator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Marks conditional variables as not applicable when the variable they depend on does not
 * meet the declared condition.
 *
 * <p>Example: {@code valor_honorarios} depends on {@code houve_honorarios equals true}.
 * When the parent is false, absent or itself not applicable, {@code valor_honorarios} is
 * replaced by a not-applicable marker so rules read it as a definite "no" instead of a
 * missing value. Dependencies chain: the pass repeats until no further variable changes.
 */
public final class ConditionalVariablePreprocessor {

    private static final Logger logger = Logger.getLogger(ConditionalVariablePreprocessor.class.getName());

    private final ConditionEvaluator conditionEvaluator;

    public ConditionalVariablePreprocessor() {
        this(new ConditionEvaluator(new VariableNormalizer(), MetricsRegistry.getInstance()));
    }

    public ConditionalVariablePreprocessor(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public VariableSnapshot apply(VariableSnapshot snapshot, List<VariableDependency> dependencies) {
        if (dependencies == null || dependencies.isEmpty()) {
            return snapshot;
        }

        VariableSnapshot current = snapshot;
        Set<String> marked = new HashSet<>();
        // each pass marks at least one new slug or stops
        for (int pass = 0; pass <= dependencies.size(); pass++) {
            List<Variable> changes = new ArrayList<>();
            for (VariableDependency dependency : dependencies) {
                if (marked.contains(dependency.slug()) || isSatisfied(dependency, current)) {
                    continue;
                }
                VariableType type = current.lookup(dependency.slug())
                        .map(Variable::type)
                        .orElse(VariableType.STRING);
                changes.add(Variable.notApplicable(dependency.slug(), type));
                marked.add(dependency.slug());
            }
            if (changes.isEmpty()) {
                break;
            }
            current = current.with(changes);
        }

        if (!marked.isEmpty()) {
            logger.fine("Marked not applicable: " + marked);
        }
        return current;
    }

    private boolean isSatisfied(VariableDependency dependency, VariableSnapshot snapshot) {
        Optional<Variable> parent = snapshot.lookup(dependency.dependsOn());
        if (parent.isEmpty() || !parent.get().hasValue()) {
            return false;
        }
        return conditionEvaluator.evaluate(dependency.asCondition(), snapshot).outcome() == EvaluationOutcome.ACTIVATE;
    }
}
