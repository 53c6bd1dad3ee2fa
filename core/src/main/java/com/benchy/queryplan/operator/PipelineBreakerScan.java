package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Scan of a shared, materialized pipeline (CTE scan, temp scan, explicit scan).
 *
 * <p>The scanned id is the native id of the shared subtree; parsers use it to
 * resolve the reference against the shared-pipeline table.
 */
public class PipelineBreakerScan extends QueryOperator {

    private Integer scannedId;

    public PipelineBreakerScan(int operatorId) {
        super(OperatorType.PipelineBreakerScan, operatorId);
    }

    public Integer scannedId() {
        return scannedId;
    }

    /**
     * Sets the scanned id for vendors that identify shared subtrees by name and
     * let the parser assign the id.
     *
     * @param scannedId the id of the shared subtree
     */
    public void setScannedId(int scannedId) {
        this.scannedId = scannedId;
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        if (dbms == DBMSType.UMBRA) {
            scannedId = JsonFields.requireInt(plan, "scannedOperator", dbms);
        } else if (dbms == DBMSType.HYPER) {
            JsonNode input = JsonFields.require(plan, "input", dbms);
            scannedId = input.isInt() ? input.intValue() : JsonFields.requireInt(input, "operatorId", dbms);
        }
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("scanned_id", scannedId);
    }
}
