package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import java.util.Map;

/**
 * Union, intersect or except, with or without duplicate elimination.
 */
public class SetOperation extends QueryOperator {

    private String type;

    public SetOperation(int operatorId) {
        super(OperatorType.SetOperation, operatorId);
    }

    public String type() {
        return type;
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        switch (dbms) {
            case UMBRA -> type = JsonFields.requireText(plan, "operation", dbms);
            case HYPER -> type = JsonFields.requireText(plan, "operator", dbms);
            case DUCKDB -> {
                if ("UNION".equals(JsonFields.requireText(plan, "operator_type", dbms))) {
                    type = "unionall";
                }
            }
            case POSTGRES -> {
                String command = JsonFields.optionalText(plan, "Command");
                if (command != null) {
                    type = command.toLowerCase(Locale.ROOT).replace(" ", "");
                }
            }
        }
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("type", type);
    }
}
