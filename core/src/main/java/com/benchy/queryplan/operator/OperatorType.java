package com.benchy.queryplan.operator;

/**
 * Closed vocabulary of canonical relational operators.
 *
 * <p>The name of each constant is the label used by the encoders.
 */
public enum OperatorType {
    // Synthetic top-level operator
    Result,
    // Scans
    TableScan,
    InlineTable,
    Temp,
    PipelineBreakerScan,
    // Basic operators
    Select,
    Map,
    Sort,
    GroupBy,
    Join,
    // Advanced operators
    GroupJoin,
    EarlyProbe,
    SetOperation,
    Window,
    // Recursion
    Iteration,
    IterationScan,
    // Table functions
    ArrayUnnest,
    RegexSplit,
    // Correlation
    Subquery,
    // Everything a vendor has that the vocabulary does not
    CustomOperator
}
