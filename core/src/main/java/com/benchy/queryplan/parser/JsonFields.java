package com.benchy.queryplan.parser;

import com.benchy.queryplan.exception.MalformedPlanException;
import com.benchy.queryplan.operator.DBMSType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed access to fields of a vendor explain document.
 *
 * <p>The {@code require*} methods throw {@link MalformedPlanException} when a
 * field the vendor schema mandates is absent or has the wrong shape. The
 * {@code optional*} methods return null instead.
 */
public final class JsonFields {

    private JsonFields() {}

    public static JsonNode require(JsonNode node, String field, DBMSType dbms) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new MalformedPlanException(
                "Missing required field '" + field + "' in " + dbms + " plan node", field, dbms);
        }
        return value;
    }

    public static String requireText(JsonNode node, String field, DBMSType dbms) {
        JsonNode value = require(node, field, dbms);
        if (!value.isValueNode()) {
            throw new MalformedPlanException(
                "Field '" + field + "' must be a scalar in " + dbms + " plan node", field, dbms);
        }
        return value.asText();
    }

    public static int requireInt(JsonNode node, String field, DBMSType dbms) {
        JsonNode value = require(node, field, dbms);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new MalformedPlanException(
                "Field '" + field + "' must be an integer in " + dbms + " plan node", field, dbms);
        }
        return value.intValue();
    }

    public static Number requireNumber(JsonNode node, String field, DBMSType dbms) {
        Number value = toNumber(require(node, field, dbms));
        if (value == null) {
            throw new MalformedPlanException(
                "Field '" + field + "' must be numeric in " + dbms + " plan node", field, dbms);
        }
        return value;
    }

    public static Number optionalNumber(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null ? null : toNumber(value);
    }

    public static String optionalText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Returns the value node of a field, or null when absent or JSON null.
     */
    public static JsonNode optional(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    /**
     * Converts a numeric (or numeric string) node to a Long when integral, a Double otherwise.
     *
     * @return the number, or null if the node holds no number
     */
    public static Number toNumber(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            double d = value.doubleValue();
            if (!Double.isNaN(d) && !Double.isInfinite(d) && d == Math.rint(d)
                    && Math.abs(d) < Long.MAX_VALUE) {
                return (long) d;
            }
            return d;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                try {
                    return Double.parseDouble(text);
                } catch (NumberFormatException ignored) {
                    return null;
                }
            }
        }
        return null;
    }
}
