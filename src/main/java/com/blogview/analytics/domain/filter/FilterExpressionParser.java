package com.blogview.analytics.domain.filter;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import com.blogview.analytics.domain.exception.ExpressionTooDeepException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent decoder for JSON filter payloads.
 *
 * Supported structure:
 * <pre>
 * {
 *   "operator": "and" | "or" | "not",                           (default "and")
 *   "conditions": [
 *     { "field": "country.code", "op": "eq", "value": "US" },   leaf, op defaults to "eq"
 *     { "operator": "or", "conditions": [ ... ] }               nested group
 *   ]
 * }
 * </pre>
 * Any node carrying a {@code conditions} key is a group.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterExpressionParser {

    private final AnalyticsProperties properties;

    public FilterExpression parse(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new AnalyticsValidationException("Filter payload must not be empty.");
        }
        if (!payload.isObject()) {
            throw new AnalyticsValidationException("Filter payload must be a JSON object.");
        }
        FilterExpression expression = parseNode(payload, 1);
        log.debug("Parsed filter expression: {}", expression);
        return expression;
    }

    private FilterExpression parseNode(JsonNode node, int depth) {
        if (depth > properties.getMaxExpressionDepth()) {
            throw new ExpressionTooDeepException(properties.getMaxExpressionDepth());
        }
        if (!node.isObject()) {
            throw new AnalyticsValidationException("Each condition must be a JSON object.");
        }
        return node.has("conditions") ? parseGroup(node, depth) : parseLeaf(node);
    }

    private FilterGroup parseGroup(JsonNode node, int depth) {
        JsonNode operatorNode = node.get("operator");
        Combinator combinator = operatorNode == null || operatorNode.isNull()
                ? Combinator.AND
                : Combinator.fromCode(operatorNode.asText());

        JsonNode conditions = node.get("conditions");
        if (!conditions.isArray()) {
            throw new AnalyticsValidationException("Field 'conditions' must be a list.");
        }

        List<FilterExpression> children = new ArrayList<>(conditions.size());
        for (JsonNode condition : conditions) {
            children.add(parseNode(condition, depth + 1));
        }
        return new FilterGroup(combinator, children);
    }

    private FilterLeaf parseLeaf(JsonNode node) {
        JsonNode fieldNode = node.get("field");
        if (fieldNode == null || !fieldNode.isTextual() || fieldNode.asText().isBlank()) {
            throw new AnalyticsValidationException("Condition missing 'field'.");
        }

        JsonNode opNode = node.get("op");
        Operator operator = opNode == null || opNode.isNull()
                ? Operator.EQ
                : Operator.fromCode(opNode.asText());

        JsonNode valueNode = node.get("value");
        if (valueNode == null || valueNode.isNull()) {
            throw new AnalyticsValidationException("Condition on '" + fieldNode.asText() + "' missing 'value'.");
        }
        return new FilterLeaf(fieldNode.asText().trim(), operator, scalar(valueNode));
    }

    private Object scalar(JsonNode valueNode) {
        if (valueNode.isTextual()) {
            return valueNode.asText();
        }
        if (valueNode.isBoolean()) {
            return valueNode.booleanValue();
        }
        if (valueNode.isIntegralNumber() && valueNode.canConvertToLong()) {
            return valueNode.longValue();
        }
        if (valueNode.isNumber()) {
            return valueNode.doubleValue();
        }
        throw new AnalyticsValidationException("Condition 'value' must be a scalar.");
    }
}
