/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.api.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable node of a compiled activation rule.
 *
 * <p>The hierarchy is closed: every consumer dispatches through {@link Visitor}, so adding a
 * node kind breaks compilation of every visitor until it handles the new kind.
 */
public sealed interface RuleNode permits RuleNode.Condition, RuleNode.And, RuleNode.Or, RuleNode.Not {

    <R> R accept(Visitor<R> visitor);

    /**
     * Slugs read anywhere in this tree, in first-seen order.
     */
    default Set<String> referencedVariables() {
        Set<String> slugs = new LinkedHashSet<>();
        accept(new Visitor<Void>() {
            @Override
            public Void visitCondition(Condition condition) {
                slugs.add(condition.variable());
                return null;
            }

            @Override
            public Void visitAnd(And and) {
                and.children().forEach(c -> c.accept(this));
                return null;
            }

            @Override
            public Void visitOr(Or or) {
                or.children().forEach(c -> c.accept(this));
                return null;
            }

            @Override
            public Void visitNot(Not not) {
                not.child().accept(this);
                return null;
            }
        });
        return slugs;
    }

    interface Visitor<R> {
        R visitCondition(Condition condition);

        R visitAnd(And and);

        R visitOr(Or or);

        R visitNot(Not not);
    }

    static Condition condition(String variable, Operator operator, Object operand) {
        return new Condition(variable, operator, operand);
    }

    static And and(RuleNode... children) {
        return new And(List.of(children));
    }

    static Or or(RuleNode... children) {
        return new Or(List.of(children));
    }

    static Not not(RuleNode child) {
        return new Not(child);
    }

    /**
     * Leaf comparison. The regex of {@link Operator#MATCHES_REGEX} is compiled once, here.
     *
     * @param variable slug of the variable under test
     * @param operator comparison operator
     * @param operand  comparison value (null for presence operators)
     * @param pattern  pre-compiled pattern, null for other operators
     */
    record Condition(String variable, Operator operator, Object operand, Pattern pattern) implements RuleNode {

        public Condition {
            Objects.requireNonNull(variable, "Condition variable cannot be null");
            Objects.requireNonNull(operator, "Condition operator cannot be null");
            if (operator.requiresOperand() && operand == null) {
                throw new IllegalArgumentException("Operand cannot be null for operator " + operator.wireName());
            }
            if (operator == Operator.MATCHES_REGEX && pattern == null) {
                pattern = compile(String.valueOf(operand));
            }
        }

        public Condition(String variable, Operator operator, Object operand) {
            this(variable, operator, operand, null);
        }

        private static Pattern compile(String regex) {
            try {
                return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid regex '" + regex + "': " + e.getDescription(), e);
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCondition(this);
        }

        // Pattern has identity equality; compare on the source operand instead.
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Condition that)) return false;
            return variable.equals(that.variable)
                    && operator == that.operator
                    && Objects.equals(operand, that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(variable, operator, operand);
        }

        @Override
        public String toString() {
            return operator.requiresOperand()
                    ? variable + " " + operator.wireName() + " " + operand
                    : variable + " " + operator.wireName();
        }
    }

    record And(List<RuleNode> children) implements RuleNode {
        public And {
            children = List.copyOf(Objects.requireNonNull(children, "And children cannot be null"));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    record Or(List<RuleNode> children) implements RuleNode {
        public Or {
            children = List.copyOf(Objects.requireNonNull(children, "Or children cannot be null"));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Not(RuleNode child) implements RuleNode {
        public Not {
            Objects.requireNonNull(child, "Not child cannot be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }
}
