package com.benchy.queryplan.operator;

/**
 * Recursive query driver (recursive CTE / recursive union).
 */
public class Iteration extends QueryOperator {

    public Iteration(int operatorId) {
        super(OperatorType.Iteration, operatorId);
    }
}
