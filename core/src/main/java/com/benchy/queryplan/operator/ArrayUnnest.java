package com.benchy.queryplan.operator;

public class ArrayUnnest extends QueryOperator {

    public ArrayUnnest(int operatorId) {
        super(OperatorType.ArrayUnnest, operatorId);
    }
}
