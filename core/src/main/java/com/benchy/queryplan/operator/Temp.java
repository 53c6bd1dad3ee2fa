package com.benchy.queryplan.operator;

/**
 * Materialization of an intermediate result, typically a CTE.
 */
public class Temp extends QueryOperator {

    public Temp(int operatorId) {
        super(OperatorType.Temp, operatorId);
    }
}
