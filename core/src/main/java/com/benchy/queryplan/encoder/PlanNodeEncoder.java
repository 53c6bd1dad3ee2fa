package com.benchy.queryplan.encoder;

import com.benchy.queryplan.plan.PlanNode;

/**
 * Serializes a canonical plan tree.
 *
 * @param <T> the encoded form
 */
public interface PlanNodeEncoder<T> {

    /**
     * Encodes the subtree rooted at a node.
     *
     * @param node the root of the subtree
     * @return the encoded subtree
     */
    T encode(PlanNode node);
}
