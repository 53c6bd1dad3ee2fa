package com.benchy.queryplan.operator;

/**
 * Computes new columns from existing ones (projection with expressions).
 */
public class MapOperator extends QueryOperator {

    public MapOperator(int operatorId) {
        super(OperatorType.Map, operatorId);
    }
}
