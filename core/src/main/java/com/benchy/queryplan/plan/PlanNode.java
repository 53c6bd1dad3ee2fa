package com.benchy.queryplan.plan;

import com.benchy.queryplan.operator.QueryOperator;
import java.util.List;
import java.util.Objects;

/**
 * A node of a canonical query plan.
 *
 * <p>A plan node is either a {@link LeafNode} or an {@link InnerNode}. Both
 * carry an operator, a {@link Cardinality} and a {@link Provenance}; inner nodes
 * additionally hold an ordered list of children whose order is meaningful
 * (join build/probe side, left/right input of a binary operator).
 *
 * <p>The payload of a node is immutable. Rewrites produce new nodes through the
 * {@code with*} methods and replace the old node in its parent.
 */
public abstract sealed class PlanNode permits LeafNode, InnerNode {

    private final QueryOperator operator;
    private final Cardinality cardinality;
    private final Provenance provenance;

    protected PlanNode(QueryOperator operator, Cardinality cardinality, Provenance provenance) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.cardinality = Objects.requireNonNull(cardinality, "cardinality must not be null");
        this.provenance = Objects.requireNonNull(provenance, "provenance must not be null");
    }

    public QueryOperator operator() {
        return operator;
    }

    public Cardinality cardinality() {
        return cardinality;
    }

    public Number estimatedCardinality() {
        return cardinality.estimated();
    }

    public Number exactCardinality() {
        return cardinality.exact();
    }

    public Provenance provenance() {
        return provenance;
    }

    /**
     * Returns the children of this node.
     *
     * @return an unmodifiable list, empty for leaves
     */
    public abstract List<PlanNode> children();

    public abstract PlanNode withOperator(QueryOperator operator);

    public abstract PlanNode withCardinality(Cardinality cardinality);

    public abstract PlanNode withProvenance(Provenance provenance);

    /**
     * Returns a structurally equal copy of this subtree that shares no node
     * instance with it. Operators and provenance fragments are immutable and shared.
     *
     * @return the copy
     */
    public abstract PlanNode deepCopy();

    /**
     * Returns the number of nodes in this subtree, this node included.
     */
    public int nodeCount() {
        int count = 1;
        for (PlanNode child : children()) {
            count += child.nodeCount();
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlanNode other = (PlanNode) o;
        return operator.equals(other.operator)
            && cardinality.equals(other.cardinality)
            && provenance.equals(other.provenance)
            && children().equals(other.children());
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, cardinality, provenance, children());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        toString(sb, 0);
        return sb.toString();
    }

    private void toString(StringBuilder sb, int depth) {
        sb.append(" ".repeat(depth));
        sb.append("- ").append(operator).append(" (").append(cardinality).append(")\n");
        for (PlanNode child : children()) {
            child.toString(sb, depth + 2);
        }
    }
}
