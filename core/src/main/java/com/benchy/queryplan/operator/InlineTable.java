package com.benchy.queryplan.operator;

/**
 * Scan of a constant table embedded in the plan, e.g. a VALUES list.
 */
public class InlineTable extends QueryOperator {

    public InlineTable(int operatorId) {
        super(OperatorType.InlineTable, operatorId);
    }
}
