package com.benchy.queryplan.operator;

/**
 * Filter.
 */
public class Select extends QueryOperator {

    public Select(int operatorId) {
        super(OperatorType.Select, operatorId);
    }
}
