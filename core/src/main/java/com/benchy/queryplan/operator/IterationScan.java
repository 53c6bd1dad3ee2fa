package com.benchy.queryplan.operator;

/**
 * Scan of the working table of a recursive query.
 */
public class IterationScan extends QueryOperator {

    public IterationScan(int operatorId) {
        super(OperatorType.IterationScan, operatorId);
    }
}
