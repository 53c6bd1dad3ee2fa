package com.benchy.queryplan.encoder;

import com.benchy.queryplan.plan.PlanNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Encodes a plan tree as nested {@code {_label, _attrs, _children}} objects.
 */
public class JsonPlanEncoder implements PlanNodeEncoder<ObjectNode> {

    private static final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

    @Override
    public ObjectNode encode(PlanNode node) {
        ObjectNode encoded = nodeFactory.objectNode();
        encoded.put(SerdesKeys.LABEL, node.operator().operatorType().name());

        ObjectNode attrs = encoded.putObject(SerdesKeys.ATTRS);
        for (Map.Entry<String, Object> entry : NodeAttributes.collect(node).entrySet()) {
            putScalar(attrs, entry.getKey(), entry.getValue());
        }

        ArrayNode children = encoded.putArray(SerdesKeys.CHILDREN);
        for (PlanNode child : node.children()) {
            children.add(encode(child));
        }
        return encoded;
    }

    private static void putScalar(ObjectNode attrs, String key, Object value) {
        if (value instanceof Integer i) {
            attrs.put(key, i);
        } else if (value instanceof Long l) {
            attrs.put(key, l);
        } else if (value instanceof Double d) {
            attrs.put(key, d);
        } else if (value instanceof Number n) {
            attrs.put(key, new BigDecimal(n.toString()));
        } else if (value instanceof Boolean b) {
            attrs.put(key, b);
        } else {
            attrs.put(key, String.valueOf(value));
        }
    }
}
