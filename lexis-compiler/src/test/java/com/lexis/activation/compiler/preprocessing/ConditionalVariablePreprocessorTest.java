package com.lexis.activation.compiler.preprocessing;

import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.Operator;
import com.lexis.activation.api.model.RuleNode;
import com.lexis.activation.api.model.Variable;
import com.lexis.activation.api.model.VariableDependency;
import com.lexis.activation.api.model.VariableSnapshot;
import com.lexis.activation.api.model.VariableType;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.runtime.evaluation.RuleEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionalVariablePreprocessorTest {

    private static final VariableDependency HONORARIOS =
            new VariableDependency("valor_honorarios", "houve_honorarios", Operator.EQUALS, true);

    private final ConditionalVariablePreprocessor preprocessor = new ConditionalVariablePreprocessor();

    @Test
    @DisplayName("Should leave the child untouched when the parent condition holds")
    void shouldKeepChildWhenParentHolds() {
        VariableSnapshot snapshot = VariableSnapshot.builder()
                .put("houve_honorarios", VariableType.BOOLEAN, "true")
                .put("valor_honorarios", VariableType.NUMBER, "R$ 1.500,00")
                .build();

        VariableSnapshot result = preprocessor.apply(snapshot, List.of(HONORARIOS));

        assertThat(result).isEqualTo(snapshot);
    }

    @Test
    @DisplayName("Should mark the child not applicable when the parent condition fails")
    void shouldMarkChildWhenParentFails() {
        VariableSnapshot snapshot = VariableSnapshot.builder()
                .put("houve_honorarios", VariableType.BOOLEAN, false)
                .put("valor_honorarios", VariableType.NUMBER, "1500")
                .build();

        VariableSnapshot result = preprocessor.apply(snapshot, List.of(HONORARIOS));

        Variable child = result.lookup("valor_honorarios").orElseThrow();
        assertThat(child.notApplicable()).isTrue();
        assertThat(child.type()).isEqualTo(VariableType.NUMBER);
        assertThat(child.hasValue()).isFalse();
    }

    @Test
    @DisplayName("Should mark an absent child when the parent is missing")
    void shouldMarkAbsentChildWhenParentMissing() {
        VariableSnapshot result = preprocessor.apply(VariableSnapshot.empty(), List.of(HONORARIOS));

        assertThat(result.lookup("valor_honorarios"))
                .hasValueSatisfying(v -> assertThat(v.notApplicable()).isTrue());
    }

    @Test
    @DisplayName("Should propagate through chained dependencies")
    void shouldPropagateChains() {
        VariableDependency recurso = new VariableDependency("tipo_recurso", "houve_recurso", Operator.EQUALS, true);
        VariableDependency prazo = new VariableDependency("prazo_recurso", "tipo_recurso", Operator.EXISTS, null);
        VariableSnapshot snapshot = VariableSnapshot.builder()
                .put("houve_recurso", VariableType.BOOLEAN, "false")
                .put("tipo_recurso", VariableType.STRING, "apelacao")
                .put("prazo_recurso", VariableType.NUMBER, 15)
                .build();

        // listed child-first so a single pass is not enough
        VariableSnapshot result = preprocessor.apply(snapshot, List.of(prazo, recurso));

        assertThat(result.lookup("tipo_recurso").orElseThrow().notApplicable()).isTrue();
        assertThat(result.lookup("prazo_recurso").orElseThrow().notApplicable()).isTrue();
    }

    @Test
    @DisplayName("Rules should read not-applicable variables as definite answers")
    void rulesReadNotApplicableDefinitely() {
        VariableSnapshot snapshot = preprocessor.apply(
                VariableSnapshot.builder().put("houve_honorarios", VariableType.BOOLEAN, false).build(),
                List.of(HONORARIOS));
        RuleEvaluator evaluator = new RuleEvaluator(32, MetricsRegistry.noop());

        assertThat(evaluator.evaluate(
                RuleNode.condition("valor_honorarios", Operator.GREATER_THAN, 1000), snapshot))
                .isEqualTo(EvaluationOutcome.SKIP);
        assertThat(evaluator.evaluate(
                RuleNode.condition("valor_honorarios", Operator.EXISTS, null), snapshot))
                .isEqualTo(EvaluationOutcome.SKIP);
        assertThat(evaluator.evaluate(
                RuleNode.condition("valor_honorarios", Operator.IS_EMPTY, null), snapshot))
                .isEqualTo(EvaluationOutcome.ACTIVATE);
    }
}
