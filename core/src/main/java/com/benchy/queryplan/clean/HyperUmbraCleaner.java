package com.benchy.queryplan.clean;

import com.benchy.queryplan.operator.OperatorType;
import java.util.List;

/**
 * Cleaner for Hyper and Umbra plans, which share their operator vocabulary.
 *
 * <ul>
 *   <li>folds maps, early executions and single-row assertions</li>
 *   <li>folds filters into joins and table scans</li>
 *   <li>zeroes the counts of shared pipelines below their scans</li>
 * </ul>
 */
public class HyperUmbraCleaner extends Cleaner {

    public HyperUmbraCleaner() {
        super(List.of(
            FoldThroughRule.ofTypes(OperatorType.Map).andCustom("EarlyExecution", "AssertSingle"),
            new FilterAbsorptionRule(),
            new RescanZeroingRule()));
    }
}
