package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Sort, optionally limited to the first {@code limit} rows.
 */
public class Sort extends QueryOperator {

    private Number limit;

    public Sort(int operatorId) {
        super(OperatorType.Sort, operatorId);
    }

    public Sort(int operatorId, Number limit) {
        this(operatorId);
        this.limit = limit;
    }

    public Number limit() {
        return limit;
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        if (dbms == DBMSType.UMBRA || dbms == DBMSType.HYPER) {
            limit = JsonFields.optionalNumber(plan, "limit");
        }
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("limit", limit);
    }
}
