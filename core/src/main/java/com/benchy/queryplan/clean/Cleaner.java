package com.benchy.queryplan.clean;

import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;
import com.benchy.queryplan.plan.QueryPlan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a canonical plan so that plans of different vendors become
 * comparable.
 *
 * <p>The tree is cleaned bottom-up: the children of a node are cleaned before
 * the node itself is offered to the rules. The rules are tried in order and the
 * first one that rewrites the node wins. Rewrites replace nodes; the payload of
 * an existing node is never changed.
 *
 * <p>Example usage:
 * <pre>
 *   Cleaner cleaner = Cleaners.forDbms(DBMSType.DUCKDB);
 *   QueryPlan cleaned = cleaner.clean(plan);
 * </pre>
 */
public class Cleaner {

    private static final Logger logger = LoggerFactory.getLogger(Cleaner.class);

    private final List<CleanupRule> rules;

    /**
     * Creates a cleaner applying the given rules.
     *
     * @param rules the rules, in priority order
     */
    public Cleaner(List<CleanupRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * Cleans the tree of a query plan.
     *
     * @param plan the plan to clean
     * @return a plan with the same text and the cleaned tree
     */
    public QueryPlan clean(QueryPlan plan) {
        return plan.withPlan(clean(plan.plan()));
    }

    /**
     * Cleans a subtree.
     *
     * @param node the root of the subtree
     * @return the node taking its place
     */
    public PlanNode clean(PlanNode node) {
        if (!(node instanceof InnerNode inner)) {
            return node;
        }

        List<PlanNode> children = new ArrayList<>(inner.children().size());
        boolean changed = false;
        for (PlanNode child : inner.children()) {
            PlanNode cleaned = clean(child);
            changed |= cleaned != child;
            children.add(cleaned);
        }
        InnerNode current = changed ? inner.withChildren(children) : inner;

        for (CleanupRule rule : rules) {
            PlanNode rewritten = rule.apply(current);
            if (rewritten != current) {
                logger.debug("{} rewrote {} {}", rule.name(),
                    current.operator().operatorType(), current.operator().operatorId());
                return rewritten;
            }
        }
        return current;
    }

    /**
     * Folds {@code removed} into {@code survivor}: the survivor takes the removed
     * node's cardinalities, and its provenance becomes the removed node's
     * fragments followed by its own.
     *
     * @param removed the node taken out of the tree
     * @param survivor the node taking its place
     * @return the updated survivor
     */
    public static PlanNode replaceNode(PlanNode removed, PlanNode survivor) {
        return survivor
            .withProvenance(survivor.provenance().prependedWith(removed.provenance()))
            .withCardinality(removed.cardinality());
    }
}
