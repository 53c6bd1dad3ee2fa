package com.benchy.queryplan.plan;

import com.benchy.queryplan.operator.QueryOperator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Plan node with an ordered list of children.
 *
 * <p>An inner node may have no children at all: a shared-pipeline scan whose
 * subtree is attached elsewhere, or not yet attached, is still an inner node.
 */
public final class InnerNode extends PlanNode {

    private final List<PlanNode> children;

    public InnerNode(QueryOperator operator, Cardinality cardinality,
                     List<? extends PlanNode> children, Provenance provenance) {
        super(operator, cardinality, provenance);
        this.children = new ArrayList<>(Objects.requireNonNull(children, "children must not be null"));
    }

    @Override
    public List<PlanNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the single child of a unary node.
     *
     * @throws IllegalStateException if this node does not have exactly one child
     */
    public PlanNode onlyChild() {
        if (children.size() != 1) {
            throw new IllegalStateException(
                operator().operatorType() + " has " + children.size() + " children, expected one");
        }
        return children.get(0);
    }

    /**
     * Appends a shared subtree to this node.
     *
     * <p>Only the shared-pipeline attachment pass of a parser calls this; it
     * fills reference slots of scans after the rest of the tree is built.
     *
     * @param child the subtree to attach
     */
    public void attach(PlanNode child) {
        children.add(Objects.requireNonNull(child, "child must not be null"));
    }

    public InnerNode withChildren(List<? extends PlanNode> newChildren) {
        return new InnerNode(operator(), cardinality(), newChildren, provenance());
    }

    @Override
    public InnerNode withOperator(QueryOperator operator) {
        return new InnerNode(operator, cardinality(), children, provenance());
    }

    @Override
    public InnerNode withCardinality(Cardinality cardinality) {
        return new InnerNode(operator(), cardinality, children, provenance());
    }

    @Override
    public InnerNode withProvenance(Provenance provenance) {
        return new InnerNode(operator(), cardinality(), children, provenance);
    }

    @Override
    public InnerNode deepCopy() {
        List<PlanNode> copies = new ArrayList<>(children.size());
        for (PlanNode child : children) {
            copies.add(child.deepCopy());
        }
        return new InnerNode(operator(), cardinality(), copies, provenance());
    }
}
