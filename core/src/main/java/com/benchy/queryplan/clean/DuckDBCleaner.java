package com.benchy.queryplan.clean;

import java.util.List;

/**
 * Cleaner for DuckDB plans.
 *
 * <ul>
 *   <li>puts the build side of joins first</li>
 *   <li>folds projections</li>
 *   <li>folds filters into joins and table scans</li>
 *   <li>renames TopN and Limit to Sort</li>
 * </ul>
 */
public class DuckDBCleaner extends Cleaner {

    public DuckDBCleaner() {
        super(List.of(
            new ChildOrderNormalizationRule(),
            FoldThroughRule.ofCustom("Projection"),
            new FilterAbsorptionRule(),
            new RenameToSortRule()));
    }
}
