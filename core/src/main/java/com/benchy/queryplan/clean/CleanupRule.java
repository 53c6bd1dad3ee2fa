package com.benchy.queryplan.clean;

import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;

/**
 * Structural rewrite applied by a {@link Cleaner} to one inner node whose
 * children are already clean.
 *
 * <p>A rule returns the node that takes the inspected node's place in its
 * parent, or the inspected node itself when its pattern does not match. Rules
 * must be idempotent: a node produced by a rule is never rewritten again by the
 * same rule.
 *
 * <p>Rules only merge or rename bookkeeping nodes. A node performing a distinct
 * relational operation (join, scan, sort, aggregation) is never removed.
 */
public interface CleanupRule {

    /**
     * Applies this rule to an inner node.
     *
     * @param node the node to inspect, with cleaned children
     * @return the replacement node, or {@code node} if the rule does not apply
     */
    PlanNode apply(InnerNode node);

    /**
     * Returns the name of this rule.
     *
     * <p>Used for logging and debugging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
