package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Join fused with a subsequent aggregation on the join key.
 */
public class GroupJoin extends QueryOperator {

    private String type;
    private String method;

    public GroupJoin(int operatorId) {
        super(OperatorType.GroupJoin, operatorId);
    }

    /**
     * Returns the vendor's semantic tag (Umbra "behavior", Hyper "semantic").
     */
    public String type() {
        return type;
    }

    public String method() {
        return method;
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        if (dbms == DBMSType.UMBRA) {
            type = JsonFields.requireText(plan, "behavior", dbms);
            method = JsonFields.requireText(plan, "physicalOperator", dbms).replace("groupjoin", "");
        } else if (dbms == DBMSType.HYPER) {
            type = JsonFields.requireText(plan, "semantic", dbms);
        }
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("type", type);
        attrs.put("method", method);
    }
}
