package com.benchy.queryplan.clean;

import com.benchy.queryplan.operator.CustomOperator;
import com.benchy.queryplan.operator.OperatorType;
import com.benchy.queryplan.operator.QueryOperator;
import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes unary bookkeeping operators and splices their only child into their
 * place.
 *
 * <pre>
 *   Map(Join(a, b))          -> Join(a, b)
 *   Projection(TableScan)    -> TableScan
 * </pre>
 *
 * <p>The child inherits the removed node's cardinalities and provenance, see
 * {@link Cleaner#replaceNode}.
 */
public class FoldThroughRule implements CleanupRule {

    private static final Logger logger = LoggerFactory.getLogger(FoldThroughRule.class);

    private final Set<OperatorType> types;
    private final Set<String> customNames;

    private FoldThroughRule(Set<OperatorType> types, Set<String> customNames) {
        this.types = types;
        this.customNames = customNames;
    }

    /**
     * Folds canonical operators of the given types.
     */
    public static FoldThroughRule ofTypes(OperatorType first, OperatorType... rest) {
        return new FoldThroughRule(EnumSet.of(first, rest), Set.of());
    }

    /**
     * Folds custom operators with the given names.
     */
    public static FoldThroughRule ofCustom(String... names) {
        return new FoldThroughRule(EnumSet.noneOf(OperatorType.class), Set.of(names));
    }

    /**
     * Returns a rule that also folds custom operators with the given names.
     */
    public FoldThroughRule andCustom(String... names) {
        Set<String> merged = new HashSet<>(customNames);
        merged.addAll(List.of(names));
        return new FoldThroughRule(types, Set.copyOf(merged));
    }

    @Override
    public PlanNode apply(InnerNode node) {
        if (!matches(node.operator()) || node.children().size() != 1) {
            return node;
        }
        PlanNode child = node.onlyChild();
        logger.debug("Fold {} into {}", describe(node.operator()), describe(child.operator()));
        return Cleaner.replaceNode(node, child);
    }

    /**
     * Returns the rule name with the folded operators, e.g. {@code FoldThrough[Map, EarlyExecution]}.
     */
    @Override
    public String name() {
        List<String> folded = new ArrayList<>();
        types.forEach(type -> folded.add(type.name()));
        folded.addAll(new TreeSet<>(customNames));
        return "FoldThrough" + folded;
    }

    private boolean matches(QueryOperator operator) {
        if (types.contains(operator.operatorType())) {
            return true;
        }
        return operator instanceof CustomOperator custom && customNames.contains(custom.name());
    }

    static String describe(QueryOperator operator) {
        if (operator instanceof CustomOperator custom) {
            return custom.name();
        }
        return operator.operatorType().name();
    }
}
