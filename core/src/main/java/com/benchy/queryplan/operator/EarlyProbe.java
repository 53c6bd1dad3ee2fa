package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Early filtering of probe-side tuples against a join's build side.
 */
public class EarlyProbe extends QueryOperator {

    private JsonNode source;

    public EarlyProbe(int operatorId) {
        super(OperatorType.EarlyProbe, operatorId);
    }

    /**
     * Returns a copy of the reference to the join whose build side is probed.
     */
    public JsonNode source() {
        return source == null ? null : source.deepCopy();
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        if (dbms == DBMSType.UMBRA) {
            source = JsonFields.require(plan, "source", dbms).deepCopy();
        } else if (dbms == DBMSType.HYPER) {
            source = JsonFields.require(plan, "builder", dbms).deepCopy();
        }
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("source", source());
    }
}
