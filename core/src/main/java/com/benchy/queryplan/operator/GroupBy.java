package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Grouping and aggregation.
 */
public class GroupBy extends QueryOperator {

    private String method;

    public GroupBy(int operatorId) {
        super(OperatorType.GroupBy, operatorId);
    }

    public String method() {
        return method;
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        switch (dbms) {
            case UMBRA, HYPER -> method = "hash";
            case DUCKDB -> {
                String name = JsonFields.requireText(plan, "operator_type", dbms);
                if (name.equals("HASH_GROUP_BY") || name.equals("PERFECT_HASH_GROUP_BY")) {
                    method = "hash";
                }
            }
            case POSTGRES -> {
                String nodeType = JsonFields.requireText(plan, "Node Type", dbms);
                method = nodeType.equals("Unique") || nodeType.equals("Group")
                    ? nodeType
                    : JsonFields.requireText(plan, "Strategy", dbms);
            }
        }
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("method", method);
    }
}
