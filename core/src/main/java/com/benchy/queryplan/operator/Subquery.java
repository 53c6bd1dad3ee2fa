package com.benchy.queryplan.operator;

/**
 * Scan over the output of a (possibly correlated) subquery.
 */
public class Subquery extends QueryOperator {

    public Subquery(int operatorId) {
        super(OperatorType.Subquery, operatorId);
    }
}
