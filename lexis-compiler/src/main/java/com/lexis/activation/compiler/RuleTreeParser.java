/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexis.activation.api.exceptions.RuleValidationException;
import com.lexis.activation.api.model.Operator;
import com.lexis.activation.api.model.RuleNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the authoring JSON rule format into a validated {@link RuleNode} tree.
 *
 * <p>Accepted shape:
 * <pre>{@code
 * {"type": "and", "conditions": [
 *     {"type": "condition", "variable": "pareceres_natureza_cirurgia", "operator": "equals", "value": "eletiva"},
 *     {"type": "not", "condition": {"type": "condition", "variable": "urgencia", "operator": "equals", "value": true}}
 * ]}
 * }</pre>
 *
 * <p>{@code not} takes either {@code condition} or {@code conditions}; several conditions
 * under {@code not} mean "none of them", i.e. {@code Not(Or(...))}.
 *
 * <p>Every problem in the document is collected before failing, so an author sees the
 * whole list at once. Numbers are read as {@link BigDecimal} (fractional) or
 * {@link Long} (integral) to avoid binary floating point surprises.
 */
public final class RuleTreeParser {

    private final ObjectMapper objectMapper;
    private final int maxDepth;

    public RuleTreeParser() {
        this(32);
    }

    public RuleTreeParser(int maxDepth) {
        this(new ObjectMapper(), maxDepth);
    }

    public RuleTreeParser(ObjectMapper objectMapper, int maxDepth) {
        this.objectMapper = objectMapper;
        this.maxDepth = maxDepth;
    }

    public RuleNode parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuleValidationException(List.of("malformed JSON: " + e.getOriginalMessage()));
        }
        return parse(root);
    }

    /**
     * @throws RuleValidationException listing every structural problem found
     */
    public RuleNode parse(JsonNode root) {
        List<String> errors = new ArrayList<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new RuleValidationException(List.of("$: rule is empty"));
        }
        RuleNode node = parseNode(root, "$", 1, errors);
        if (!errors.isEmpty()) {
            throw new RuleValidationException(errors);
        }
        return node;
    }

    private RuleNode parseNode(JsonNode json, String path, int depth, List<String> errors) {
        if (depth > maxDepth) {
            errors.add(path + ": nesting exceeds maximum depth of " + maxDepth);
            return null;
        }
        if (!json.isObject()) {
            errors.add(path + ": expected an object, got " + json.getNodeType());
            return null;
        }
        String type = json.path("type").asText("");
        return switch (type.toLowerCase()) {
            case "condition" -> parseCondition(json, path, errors);
            case "and" -> {
                List<RuleNode> children = parseChildren(json, path, depth, errors);
                yield children == null ? null : new RuleNode.And(children);
            }
            case "or" -> {
                List<RuleNode> children = parseChildren(json, path, depth, errors);
                yield children == null ? null : new RuleNode.Or(children);
            }
            case "not" -> parseNot(json, path, depth, errors);
            case "" -> {
                errors.add(path + ": missing 'type'");
                yield null;
            }
            default -> {
                errors.add(path + ": unknown node type '" + type + "'");
                yield null;
            }
        };
    }

    private RuleNode parseNot(JsonNode json, String path, int depth, List<String> errors) {
        JsonNode single = json.get("condition");
        if (single != null && !single.isNull()) {
            RuleNode child = parseNode(single, path + ".condition", depth + 1, errors);
            return child == null ? null : new RuleNode.Not(child);
        }
        // Not(Or(...)) is one level deeper than the written JSON
        List<RuleNode> children = parseChildren(json, path, depth + 1, errors);
        if (children == null) {
            return null;
        }
        return new RuleNode.Not(children.size() == 1 ? children.get(0) : new RuleNode.Or(children));
    }

    /**
     * @return the parsed children, or null if any child failed
     */
    private List<RuleNode> parseChildren(JsonNode json, String path, int depth, List<String> errors) {
        JsonNode conditions = json.get("conditions");
        if (conditions == null || !conditions.isArray()) {
            errors.add(path + ": '" + json.path("type").asText() + "' requires a 'conditions' array");
            return null;
        }
        if (conditions.isEmpty()) {
            errors.add(path + ": '" + json.path("type").asText() + "' requires at least one condition");
            return null;
        }
        List<RuleNode> children = new ArrayList<>(conditions.size());
        boolean failed = false;
        for (int i = 0; i < conditions.size(); i++) {
            RuleNode child = parseNode(conditions.get(i), path + ".conditions[" + i + "]", depth + 1, errors);
            if (child == null) {
                failed = true;
            } else {
                children.add(child);
            }
        }
        return failed ? null : children;
    }

    private RuleNode parseCondition(JsonNode json, String path, List<String> errors) {
        int before = errors.size();

        String variable = json.path("variable").asText("").trim();
        if (variable.isEmpty()) {
            errors.add(path + ": condition is missing 'variable'");
        }
        String operatorName = json.path("operator").asText("");
        Operator operator = Operator.fromString(operatorName);
        if (operator == null) {
            errors.add(path + ": unknown operator '" + operatorName + "'");
        }
        Object operand = toJava(json.get("value"));
        if (operator != null && operator.requiresOperand() && operand == null) {
            errors.add(path + ": operator '" + operator.wireName() + "' requires a 'value'");
        }
        if (errors.size() > before) {
            return null;
        }

        try {
            return new RuleNode.Condition(variable, operator, operator.requiresOperand() ? operand : null);
        } catch (IllegalArgumentException e) {
            errors.add(path + ": " + e.getMessage());
            return null;
        }
    }

    private static Object toJava(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isArray()) {
            List<Object> items = new ArrayList<>(value.size());
            value.forEach(item -> items.add(toJava(item)));
            return items;
        }
        if (value.isObject()) {
            return value.toString();
        }
        return value.asText();
    }
}
