package com.benchy.queryplan.operator;

import java.util.Map;
import java.util.Objects;

/**
 * Vendor operator without a canonical counterpart, identified by name
 * (e.g. "Projection", "TopN", "Limit", "Hash", "AssertSingle").
 */
public class CustomOperator extends QueryOperator {

    private final String name;

    public CustomOperator(String name, int operatorId) {
        super(OperatorType.CustomOperator, operatorId);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    /**
     * Returns true if this is a custom operator with one of the given names.
     */
    public static boolean isNamed(QueryOperator operator, String... names) {
        if (!(operator instanceof CustomOperator custom)) {
            return false;
        }
        for (String candidate : names) {
            if (candidate.equals(custom.name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("name", name);
    }
}
