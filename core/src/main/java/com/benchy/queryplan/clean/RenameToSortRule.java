package com.benchy.queryplan.clean;

import com.benchy.queryplan.operator.CustomOperator;
import com.benchy.queryplan.operator.Sort;
import com.benchy.queryplan.operator.TopN;
import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the row-limiting custom operators {@code TopN} and {@code Limit} to
 * a canonical Sort.
 *
 * <p>A TopN keeps the limit its parser read. Limit nodes carry no usable limit.
 */
public class RenameToSortRule implements CleanupRule {

    private static final Logger logger = LoggerFactory.getLogger(RenameToSortRule.class);

    static final String LIMIT = "Limit";

    @Override
    public PlanNode apply(InnerNode node) {
        if (node.operator() instanceof TopN topN) {
            if (topN.limit() == null) {
                logger.warn("TopN {} has no readable limit, renaming it to a Sort without one",
                    topN.operatorId());
            }
            return rename(node, topN, topN.limit());
        }
        if (CustomOperator.isNamed(node.operator(), LIMIT)) {
            return rename(node, (CustomOperator) node.operator(), null);
        }
        return node;
    }

    private static PlanNode rename(InnerNode node, CustomOperator operator, Number limit) {
        logger.debug("Rename {} to Sort (limit {})", operator.name(), limit);
        return node.withOperator(new Sort(operator.operatorId(), limit));
    }
}
