package com.lexis.activation.runtime.evaluation;

import com.lexis.activation.api.exceptions.RuleDepthExceededException;
import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.EvaluationTrace;
import com.lexis.activation.api.model.Operator;
import com.lexis.activation.api.model.RuleNode;
import com.lexis.activation.api.model.VariableSnapshot;
import com.lexis.activation.api.model.VariableType;
import com.lexis.activation.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.lexis.activation.api.model.EvaluationOutcome.ACTIVATE;
import static com.lexis.activation.api.model.EvaluationOutcome.INDETERMINATE;
import static com.lexis.activation.api.model.EvaluationOutcome.SKIP;
import static org.assertj.core.api.Assertions.*;

class RuleEvaluatorTest {

    private static final RuleNode ELETIVA =
            RuleNode.condition("pareceres_natureza_cirurgia", Operator.EQUALS, "eletiva");

    private final InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
    private final RuleEvaluator evaluator = new RuleEvaluator(32, metrics);

    private static VariableSnapshot snapshot(Object... slugTypeValue) {
        VariableSnapshot.Builder builder = VariableSnapshot.builder();
        for (int i = 0; i < slugTypeValue.length; i += 3) {
            builder.put((String) slugTypeValue[i], (VariableType) slugTypeValue[i + 1], slugTypeValue[i + 2]);
        }
        return builder.build();
    }

    /** Leaf that is ACTIVATE, SKIP or INDETERMINATE on {@link #fixture()}. */
    private static RuleNode leaf(EvaluationOutcome outcome) {
        return switch (outcome) {
            case ACTIVATE -> RuleNode.condition("flag", Operator.EQUALS, true);
            case SKIP -> RuleNode.condition("flag", Operator.EQUALS, false);
            default -> RuleNode.condition("missing", Operator.EQUALS, "x");
        };
    }

    private static VariableSnapshot fixture() {
        return snapshot("flag", VariableType.BOOLEAN, true);
    }

    @Test
    @DisplayName("Matching condition activates")
    void matchingConditionActivates() {
        VariableSnapshot s = snapshot("pareceres_natureza_cirurgia", VariableType.STRING, "Eletiva ");

        assertThat(evaluator.evaluate(ELETIVA, s)).isEqualTo(ACTIVATE);
    }

    @Test
    @DisplayName("Absent variable is indeterminate, never false")
    void absentVariableIsIndeterminate() {
        assertThat(evaluator.evaluate(ELETIVA, VariableSnapshot.empty())).isEqualTo(INDETERMINATE);
    }

    @Test
    @DisplayName("Failed normalization is indeterminate and counted")
    void normalizationFailureIsIndeterminate() {
        RuleNode rule = RuleNode.condition("valor_causa", Operator.GREATER_THAN, 1000);
        VariableSnapshot s = snapshot("valor_causa", VariableType.NUMBER, "não informado");

        assertThat(evaluator.evaluate(rule, s)).isEqualTo(INDETERMINATE);
        assertThat(metrics.getCounterValue("lexis_normalization_failures_total", "source", "value")).isEqualTo(1);
    }

    @Nested
    class Composition {

        @Test
        @DisplayName("Empty AND is ACTIVATE and empty OR is SKIP")
        void identityElements() {
            assertThat(evaluator.evaluate(RuleNode.and(), VariableSnapshot.empty())).isEqualTo(ACTIVATE);
            assertThat(evaluator.evaluate(RuleNode.or(), VariableSnapshot.empty())).isEqualTo(SKIP);
        }

        @Test
        void andTruthTable() {
            assertThat(eval(RuleNode.and(leaf(ACTIVATE), leaf(ACTIVATE)))).isEqualTo(ACTIVATE);
            assertThat(eval(RuleNode.and(leaf(ACTIVATE), leaf(INDETERMINATE)))).isEqualTo(INDETERMINATE);
            assertThat(eval(RuleNode.and(leaf(INDETERMINATE), leaf(SKIP)))).isEqualTo(SKIP);
            assertThat(eval(RuleNode.and(leaf(SKIP), leaf(INDETERMINATE)))).isEqualTo(SKIP);
        }

        @Test
        void orTruthTable() {
            assertThat(eval(RuleNode.or(leaf(SKIP), leaf(SKIP)))).isEqualTo(SKIP);
            assertThat(eval(RuleNode.or(leaf(SKIP), leaf(INDETERMINATE)))).isEqualTo(INDETERMINATE);
            assertThat(eval(RuleNode.or(leaf(INDETERMINATE), leaf(ACTIVATE)))).isEqualTo(ACTIVATE);
        }

        @Test
        void notKeepsIndeterminate() {
            assertThat(eval(RuleNode.not(leaf(ACTIVATE)))).isEqualTo(SKIP);
            assertThat(eval(RuleNode.not(leaf(SKIP)))).isEqualTo(ACTIVATE);
            assertThat(eval(RuleNode.not(leaf(INDETERMINATE)))).isEqualTo(INDETERMINATE);
        }

        @Test
        @DisplayName("Double negation returns the original outcome for every leaf kind")
        void doubleNegation() {
            for (EvaluationOutcome outcome : List.of(ACTIVATE, SKIP, INDETERMINATE)) {
                RuleNode rule = RuleNode.and(leaf(outcome), RuleNode.or(leaf(ACTIVATE), leaf(outcome)));
                assertThat(eval(RuleNode.not(RuleNode.not(rule)))).isEqualTo(eval(rule));
            }
        }

        @Test
        @DisplayName("Nested groups evaluate like parenthesized expressions")
        void nestedGroups() {
            // (natureza = eletiva AND NOT urgencia) OR valor > 100.000
            RuleNode rule = RuleNode.or(
                    RuleNode.and(ELETIVA, RuleNode.not(RuleNode.condition("urgencia", Operator.EQUALS, true))),
                    RuleNode.condition("valor", Operator.GREATER_THAN, "100.000,00"));

            VariableSnapshot s = snapshot(
                    "pareceres_natureza_cirurgia", VariableType.STRING, "eletiva",
                    "urgencia", VariableType.BOOLEAN, "false");

            // left branch activates even though valor is absent
            assertThat(evaluator.evaluate(rule, s)).isEqualTo(ACTIVATE);
        }

        private EvaluationOutcome eval(RuleNode rule) {
            return evaluator.evaluate(rule, fixture());
        }
    }

    @Nested
    class DepthGuard {

        @Test
        @DisplayName("Trees deeper than the limit are rejected")
        void rejectsDeepTrees() {
            RuleEvaluator shallow = new RuleEvaluator(3, metrics);
            RuleNode depth4 = RuleNode.not(RuleNode.not(RuleNode.not(leaf(ACTIVATE))));

            assertThatThrownBy(() -> shallow.evaluate(depth4, fixture()))
                    .isInstanceOf(RuleDepthExceededException.class)
                    .hasMessageContaining("3");
        }

        @Test
        void acceptsTreesAtTheLimit() {
            RuleEvaluator shallow = new RuleEvaluator(3, metrics);
            RuleNode depth3 = RuleNode.not(RuleNode.not(leaf(ACTIVATE)));

            assertThat(shallow.evaluate(depth3, fixture())).isEqualTo(ACTIVATE);
        }

        @Test
        @DisplayName("Depth is checked even when short-circuiting would skip the deep branch")
        void depthCheckedBeforeShortCircuit() {
            RuleEvaluator shallow = new RuleEvaluator(3, metrics);
            RuleNode rule = RuleNode.and(leaf(SKIP), RuleNode.not(RuleNode.not(RuleNode.not(leaf(ACTIVATE)))));

            assertThatThrownBy(() -> shallow.evaluate(rule, fixture()))
                    .isInstanceOf(RuleDepthExceededException.class);
        }

        @Test
        void defaultLimitIs32() {
            RuleEvaluator defaults = new RuleEvaluator();

            assertThat(defaults.evaluate(nest(31), fixture())).isEqualTo(ACTIVATE);
            assertThatThrownBy(() -> defaults.evaluate(nest(32), fixture()))
                    .isInstanceOf(RuleDepthExceededException.class);
        }

        private RuleNode nest(int levels) {
            RuleNode rule = leaf(ACTIVATE);
            for (int i = 0; i < levels; i++) {
                rule = RuleNode.and(rule);
            }
            return rule;
        }
    }

    @Test
    @DisplayName("explain records every node, including ones short-circuiting would skip")
    void explainBuildsFullTrace() {
        RuleNode rule = RuleNode.and(leaf(SKIP), leaf(INDETERMINATE));

        EvaluationTrace trace = evaluator.explain(rule, fixture());

        assertThat(trace.outcome()).isEqualTo(SKIP);
        assertThat(trace.node()).isEqualTo("and");
        assertThat(trace.children()).extracting(EvaluationTrace::outcome).containsExactly(SKIP, INDETERMINATE);
        assertThat(trace.children().get(0).observedValue()).isEqualTo(true);
        assertThat(trace.children().get(1).detail()).contains("absent");
    }
}
