package com.benchy.queryplan.clean;

import com.benchy.queryplan.operator.Join;
import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Swaps the inputs of joins the parser attached probe side first, so that the
 * build side comes first. The rewritten join is marked canonical and is left
 * alone by later runs.
 */
public class ChildOrderNormalizationRule implements CleanupRule {

    private static final Logger logger = LoggerFactory.getLogger(ChildOrderNormalizationRule.class);

    @Override
    public PlanNode apply(InnerNode node) {
        if (!(node.operator() instanceof Join join)
                || join.childOrder() != Join.ChildOrder.PROBE_FIRST
                || node.children().size() != 2) {
            return node;
        }
        logger.debug("Switch build and probe side of join {}", join.operatorId());
        List<PlanNode> children = node.children();
        return node
            .withOperator(join.withChildOrder(Join.ChildOrder.CANONICAL))
            .withChildren(List.of(children.get(1), children.get(0)));
    }
}
