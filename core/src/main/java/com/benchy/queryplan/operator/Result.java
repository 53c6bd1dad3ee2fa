package com.benchy.queryplan.operator;

/**
 * Synthetic root of every canonical plan.
 */
public class Result extends QueryOperator {

    /** Id of the synthetic root. */
    public static final int ROOT_ID = -1;

    public Result() {
        super(OperatorType.Result, ROOT_ID);
    }
}
