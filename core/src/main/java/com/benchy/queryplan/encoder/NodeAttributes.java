package com.benchy.queryplan.encoder;

import com.benchy.queryplan.exception.PlanEncodingException;
import com.benchy.queryplan.plan.PlanNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects the encoded attributes of a plan node.
 *
 * <p>Order: operator id, the operator's own attributes, estimated and exact
 * cardinality, provenance. Every value is a string, a number or a boolean:
 * absent values are left out, lists, maps and JSON containers become JSON
 * text, and anything else without a scalar form (NaN, infinities, arbitrary
 * objects) becomes its string form.
 */
final class NodeAttributes {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private NodeAttributes() {
    }

    static Map<String, Object> collect(PlanNode node) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        put(attrs, SerdesKeys.OPERATOR_ID, node.operator().operatorId());
        for (Map.Entry<String, Object> entry : node.operator().attributes().entrySet()) {
            put(attrs, entry.getKey(), entry.getValue());
        }
        put(attrs, SerdesKeys.ESTIMATED_CARDINALITY, node.estimatedCardinality());
        put(attrs, SerdesKeys.EXACT_CARDINALITY, node.exactCardinality());
        if (!node.provenance().isEmpty()) {
            put(attrs, SerdesKeys.SYSTEM_REPRESENTATION, node.provenance().fragments());
        }
        return attrs;
    }

    private static void put(Map<String, Object> attrs, String key, Object value) {
        Object scalar = toScalar(value);
        if (scalar != null) {
            attrs.put(key, scalar);
        }
    }

    static Object toScalar(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode json) {
            return jsonToScalar(json);
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return d.toString();
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return f.toString();
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            return writeJson(value);
        }
        return value.toString();
    }

    private static Object jsonToScalar(JsonNode json) {
        if (json.isNull() || json.isMissingNode()) {
            return null;
        }
        if (json.isContainerNode()) {
            return writeJson(json);
        }
        if (json.isTextual()) {
            return json.textValue();
        }
        if (json.isBoolean()) {
            return json.booleanValue();
        }
        if (json.isNumber()) {
            return toScalar(json.numberValue());
        }
        return json.asText();
    }

    private static String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PlanEncodingException("Failed to write attribute value as JSON", e);
        }
    }
}
