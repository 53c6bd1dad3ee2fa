package com.benchy.queryplan.clean;

import com.benchy.queryplan.operator.OperatorType;
import com.benchy.queryplan.plan.Cardinality;
import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zeroes the cardinalities of the shared subtree below a pipeline-breaker scan.
 * Its rows are already counted where the pipeline is materialized.
 */
public class RescanZeroingRule implements CleanupRule {

    private static final Logger logger = LoggerFactory.getLogger(RescanZeroingRule.class);

    @Override
    public PlanNode apply(InnerNode node) {
        if (node.operator().operatorType() != OperatorType.PipelineBreakerScan
                || node.children().size() != 1) {
            return node;
        }
        PlanNode child = node.onlyChild();
        if (!child.cardinality().isPositive()) {
            return node;
        }
        logger.debug("Reduce cardinality of {} below PipelineBreakerScan {} to zero",
            child.operator().operatorType(), node.operator().operatorId());
        return node.withChildren(List.of(child.withCardinality(Cardinality.ZERO)));
    }
}
