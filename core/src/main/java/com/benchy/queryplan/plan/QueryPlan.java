package com.benchy.queryplan.plan;

import com.benchy.queryplan.operator.OperatorType;
import java.util.Objects;

/**
 * A canonical query plan together with the text of the query it belongs to.
 *
 * <p>The plan is always rooted at a synthetic {@link OperatorType#Result} node
 * whose single child is the vendor's real plan root.
 */
public record QueryPlan(String text, PlanNode plan) {

    public QueryPlan {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
    }

    /**
     * Returns the vendor's real plan root, below the synthetic Result node.
     */
    public PlanNode realRoot() {
        if (plan instanceof InnerNode root
                && root.operator().operatorType() == OperatorType.Result
                && root.children().size() == 1) {
            return root.children().get(0);
        }
        return plan;
    }

    public QueryPlan withPlan(PlanNode newPlan) {
        return new QueryPlan(text, newPlan);
    }
}
