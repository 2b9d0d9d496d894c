package com.lexis.activation.compiler;

import com.lexis.activation.api.exceptions.RuleValidationException;
import com.lexis.activation.api.model.Operator;
import com.lexis.activation.api.model.RuleNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTreeParserTest {

    private final RuleTreeParser parser = new RuleTreeParser();

    @Test
    @DisplayName("Should parse nested and/not tree with typed operands")
    void shouldParseNestedTree() {
        String json = """
                {"type": "and", "conditions": [
                    {"type": "condition", "variable": "pareceres_natureza_cirurgia", "operator": "equals", "value": "eletiva"},
                    {"type": "condition", "variable": "valor_causa", "operator": "greater_than", "value": 1500.50},
                    {"type": "condition", "variable": "dias_internacao", "operator": "less_or_equal", "value": 10},
                    {"type": "not", "condition":
                        {"type": "condition", "variable": "urgencia", "operator": "equals", "value": true}}
                ]}
                """;

        RuleNode node = parser.parse(json);

        assertThat(node).isInstanceOf(RuleNode.And.class);
        List<RuleNode> children = ((RuleNode.And) node).children();
        assertThat(children).hasSize(4);
        assertThat(((RuleNode.Condition) children.get(1)).operand()).isEqualTo(new BigDecimal("1500.50"));
        assertThat(((RuleNode.Condition) children.get(2)).operand()).isEqualTo(10L);
        RuleNode.Not not = (RuleNode.Not) children.get(3);
        assertThat(((RuleNode.Condition) not.child()).operand()).isEqualTo(true);
        assertThat(node.referencedVariables())
                .containsExactly("pareceres_natureza_cirurgia", "valor_causa", "dias_internacao", "urgencia");
    }

    @Test
    @DisplayName("Should read 'not' over several conditions as none of them")
    void shouldReadNotOverSeveralConditionsAsNoneOf() {
        String json = """
                {"type": "not", "conditions": [
                    {"type": "condition", "variable": "a", "operator": "exists"},
                    {"type": "condition", "variable": "b", "operator": "exists"}
                ]}
                """;

        RuleNode node = parser.parse(json);

        assertThat(node).isInstanceOf(RuleNode.Not.class);
        assertThat(((RuleNode.Not) node).child()).isInstanceOf(RuleNode.Or.class);
    }

    @Test
    @DisplayName("Should accept presence operators without a value and lists for in_list")
    void shouldAcceptPresenceAndListOperands() {
        String json = """
                {"type": "or", "conditions": [
                    {"type": "condition", "variable": "laudo", "operator": "is_not_empty"},
                    {"type": "condition", "variable": "tipo", "operator": "in_list", "value": ["a", "b"]}
                ]}
                """;

        RuleNode.Or or = (RuleNode.Or) parser.parse(json);

        RuleNode.Condition presence = (RuleNode.Condition) or.children().get(0);
        assertThat(presence.operator()).isEqualTo(Operator.IS_NOT_EMPTY);
        assertThat(presence.operand()).isNull();
        assertThat(((RuleNode.Condition) or.children().get(1)).operand()).isEqualTo(List.of("a", "b"));
    }

    @Test
    @DisplayName("Should report every problem in the document at once")
    void shouldAggregateErrors() {
        String json = """
                {"type": "and", "conditions": [
                    {"type": "condition", "operator": "equals", "value": 1},
                    {"type": "condition", "variable": "x", "operator": "roughly", "value": 1},
                    {"type": "condition", "variable": "y", "operator": "greater_than"},
                    {"type": "xor", "conditions": []},
                    {"variable": "z"}
                ]}
                """;

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(RuleValidationException.class)
                .satisfies(e -> assertThat(((RuleValidationException) e).getErrors()).containsExactly(
                        "$.conditions[0]: condition is missing 'variable'",
                        "$.conditions[1]: unknown operator 'roughly'",
                        "$.conditions[2]: operator 'greater_than' requires a 'value'",
                        "$.conditions[3]: unknown node type 'xor'",
                        "$.conditions[4]: missing 'type'"));
    }

    @Test
    @DisplayName("Should reject empty and/or groups")
    void shouldRejectEmptyGroups() {
        assertThatThrownBy(() -> parser.parse("{\"type\": \"and\", \"conditions\": []}"))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("requires at least one condition");
        assertThatThrownBy(() -> parser.parse("{\"type\": \"or\"}"))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("requires a 'conditions' array");
    }

    @Test
    @DisplayName("Should reject an invalid regex at parse time")
    void shouldRejectInvalidRegex() {
        String json = """
                {"type": "condition", "variable": "cid", "operator": "matches_regex", "value": "([a-z"}
                """;

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("$: Invalid regex '([a-z'");
    }

    @Test
    @DisplayName("Should reject trees nested beyond the configured depth")
    void shouldRejectTooDeepTrees() {
        RuleTreeParser shallow = new RuleTreeParser(2);
        String json = """
                {"type": "and", "conditions": [
                    {"type": "or", "conditions": [
                        {"type": "condition", "variable": "a", "operator": "exists"}
                    ]}
                ]}
                """;

        assertThatThrownBy(() -> shallow.parse(json))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("$.conditions[0].conditions[0]: nesting exceeds maximum depth of 2");
    }

    @Test
    @DisplayName("Should wrap malformed JSON as a validation error")
    void shouldWrapMalformedJson() {
        assertThatThrownBy(() -> parser.parse("{\"type\": \"and\", "))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("malformed JSON");
    }
}
