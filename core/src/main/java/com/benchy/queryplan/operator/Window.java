package com.benchy.queryplan.operator;

/**
 * Window function evaluation.
 */
public class Window extends QueryOperator {

    public Window(int operatorId) {
        super(OperatorType.Window, operatorId);
    }
}
