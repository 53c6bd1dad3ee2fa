package com.benchy.queryplan.plan;

import com.benchy.queryplan.operator.QueryOperator;
import java.util.Collections;
import java.util.List;

/**
 * Plan node without children.
 */
public final class LeafNode extends PlanNode {

    public LeafNode(QueryOperator operator, Cardinality cardinality, Provenance provenance) {
        super(operator, cardinality, provenance);
    }

    @Override
    public List<PlanNode> children() {
        return Collections.emptyList();
    }

    @Override
    public LeafNode withOperator(QueryOperator operator) {
        return new LeafNode(operator, cardinality(), provenance());
    }

    @Override
    public LeafNode withCardinality(Cardinality cardinality) {
        return new LeafNode(operator(), cardinality, provenance());
    }

    @Override
    public LeafNode withProvenance(Provenance provenance) {
        return new LeafNode(operator(), cardinality(), provenance);
    }

    @Override
    public LeafNode deepCopy() {
        return new LeafNode(operator(), cardinality(), provenance());
    }
}
