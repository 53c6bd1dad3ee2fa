package com.benchy.queryplan.operator;

public class RegexSplit extends QueryOperator {

    public RegexSplit(int operatorId) {
        super(OperatorType.RegexSplit, operatorId);
    }
}
