package com.benchy.queryplan.clean;

import com.benchy.queryplan.operator.OperatorType;
import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds a Select into a child that already filters as part of its own
 * operation.
 *
 * <pre>
 *   Select(Join(a, b))   -> Join(a, b)
 *   Select(TableScan)    -> TableScan
 *   Select(GroupBy(..))  -> unchanged
 * </pre>
 */
public class FilterAbsorptionRule implements CleanupRule {

    private static final Logger logger = LoggerFactory.getLogger(FilterAbsorptionRule.class);

    private static final Set<OperatorType> FILTERING_OPERATORS =
        EnumSet.of(OperatorType.Join, OperatorType.TableScan);

    @Override
    public PlanNode apply(InnerNode node) {
        if (node.operator().operatorType() != OperatorType.Select || node.children().size() != 1) {
            return node;
        }
        PlanNode child = node.onlyChild();
        if (!FILTERING_OPERATORS.contains(child.operator().operatorType())) {
            return node;
        }
        logger.debug("Fold Select into {}", child.operator().operatorType());
        return Cleaner.replaceNode(node, child);
    }
}
