package com.benchy.queryplan.clean;

import java.util.List;

/**
 * Cleaner for PostgreSQL plans: folds the build-side {@code Hash} and the
 * parallel {@code Gather} nodes and renames {@code Limit} to Sort.
 */
public class PostgresCleaner extends Cleaner {

    public PostgresCleaner() {
        super(List.of(
            FoldThroughRule.ofCustom("Hash", "Gather"),
            new RenameToSortRule()));
    }
}
