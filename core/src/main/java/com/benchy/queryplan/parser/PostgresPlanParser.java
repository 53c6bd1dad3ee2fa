package com.benchy.queryplan.parser;

import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.exception.MalformedPlanException;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.operator.GroupBy;
import com.benchy.queryplan.operator.Iteration;
import com.benchy.queryplan.operator.IterationScan;
import com.benchy.queryplan.operator.Join;
import com.benchy.queryplan.operator.MapOperator;
import com.benchy.queryplan.operator.OperatorRegistry;
import com.benchy.queryplan.operator.PipelineBreakerScan;
import com.benchy.queryplan.operator.QueryOperator;
import com.benchy.queryplan.operator.SetOperation;
import com.benchy.queryplan.operator.Sort;
import com.benchy.queryplan.operator.Subquery;
import com.benchy.queryplan.operator.TableScan;
import com.benchy.queryplan.operator.Temp;
import com.benchy.queryplan.operator.Window;
import com.benchy.queryplan.plan.Cardinality;
import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.LeafNode;
import com.benchy.queryplan.plan.PlanNode;
import com.benchy.queryplan.plan.Provenance;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for PostgreSQL's {@code EXPLAIN (ANALYZE, FORMAT JSON)} output.
 *
 * <p>PostgreSQL does not number its plan nodes, so ids are assigned in
 * pre-order. CTEs appear as {@code InitPlan} children named {@code CTE <name>};
 * each is wrapped in a synthetic Temp node and hung below the CTE scans that
 * read it.
 */
public class PostgresPlanParser extends AbstractPlanParser {

    private static final Logger logger = LoggerFactory.getLogger(PostgresPlanParser.class);

    static final List<String> CHILD_KEYS = List.of("Plans");

    private static final String CTE_PREFIX = "CTE ";

    static final OperatorRegistry OPERATORS = OperatorRegistry.builder(DBMSType.POSTGRES)
        .register(GroupBy::new, "Aggregate", "Unique", "Group")
        .register(OperatorRegistry.custom("Gather"), "Gather", "Gather Merge")
        .register(OperatorRegistry.custom("Append"), "Append", "Merge Append")
        .register(TableScan::new, "Seq Scan", "Index Scan", "Index Only Scan",
            "Bitmap Heap Scan", "Bitmap Index Scan")
        .register("Limit", OperatorRegistry.custom("Limit"))
        .register("Hash", OperatorRegistry.custom("Hash"))
        .register("Nested Loop", Join::new)
        .register("Materialize", OperatorRegistry.custom("Materialize"))
        .register("WindowAgg", Window::new)
        .register("Result", MapOperator::new)
        .register("Recursive Union", Iteration::new)
        .register("WorkTable Scan", IterationScan::new)
        .register("Subquery Scan", Subquery::new)
        .register("CTE Scan", PipelineBreakerScan::new)
        .register("Memoize", OperatorRegistry.custom("Memoize"))
        .register("SetOp", SetOperation::new)
        .register("ProjectSet", OperatorRegistry.custom("ProjectSet"))
        .register("Function Scan", OperatorRegistry.custom("Function Scan"))
        .register("Values Scan", OperatorRegistry.custom("Values Scan"))
        .register("BitmapOr", OperatorRegistry.custom("BitmapOr"))
        .registerSuffix("Sort", Sort::new)
        .registerSuffix("Join", Join::new)
        .build();

    public PostgresPlanParser() {
        this(ParserOptions.defaults());
    }

    public PostgresPlanParser(ParserOptions options) {
        super(DBMSType.POSTGRES, OPERATORS, options);
    }

    @Override
    protected JsonNode unwrap(JsonNode document) {
        JsonNode explain = document;
        if (explain.isArray()) {
            if (explain.isEmpty()) {
                throw new MalformedPlanException("Empty explain result array", "Plan", DBMSType.POSTGRES);
            }
            explain = explain.get(0);
        }
        return JsonFields.require(explain, "Plan", DBMSType.POSTGRES);
    }

    @Override
    protected PlanNode buildNode(ParseContext context, JsonNode plan) {
        String nodeType = JsonFields.requireText(plan, "Node Type", DBMSType.POSTGRES);
        int operatorId = context.nextOperatorId();
        QueryOperator operator = createOperator(nodeType, operatorId, plan);
        Provenance provenance = systemRepresentation(plan, CHILD_KEYS);
        Cardinality cardinality = cardinality(
            JsonFields.requireNumber(plan, "Plan Rows", DBMSType.POSTGRES),
            JsonFields.requireNumber(plan, "Actual Rows", DBMSType.POSTGRES));

        JsonNode plans = JsonFields.optional(plan, "Plans");
        if (plans != null) {
            for (JsonNode entry : plans) {
                if (isCommonTableExpression(entry)) {
                    registerCommonTableExpression(context, entry);
                }
            }
        }

        if (operator instanceof PipelineBreakerScan scan) {
            PlanNode temp = resolveCommonTableExpression(context, plan, scan);
            if (temp != null) {
                return new InnerNode(operator, cardinality, List.of(temp), provenance);
            }
        }

        if (plans == null) {
            return new LeafNode(operator, cardinality, provenance);
        }

        List<PlanNode> children = new ArrayList<>();
        for (JsonNode entry : plans) {
            if (!isCommonTableExpression(entry)) {
                children.add(buildNode(context, entry));
            }
        }
        return new InnerNode(operator, cardinality, children, provenance);
    }

    private void registerCommonTableExpression(ParseContext context, JsonNode entry) {
        PlanNode definition = buildNode(context, entry);
        int tempId = context.nextOperatorId();
        PlanNode temp = new InnerNode(new Temp(tempId), definition.cardinality(),
            List.of(definition), Provenance.synthetic());
        String name = entry.get("Subplan Name").asText().substring(CTE_PREFIX.length());
        context.registerSharedPipeline(name, tempId, temp);
        logger.debug("Registered CTE '{}' as shared pipeline {}", name, tempId);
    }

    /**
     * Returns the Temp subtree to hang below a CTE scan, or null if the scan
     * only references a subtree attached elsewhere.
     */
    private PlanNode resolveCommonTableExpression(ParseContext context, JsonNode plan,
                                                  PipelineBreakerScan scan) {
        String name = JsonFields.requireText(plan, "CTE Name", DBMSType.POSTGRES);
        Integer id = context.sharedPipelineId(name);
        if (id == null) {
            throw new MalformedPlanException(
                "CTE Scan references unknown CTE '" + name + "'", "CTE Name", DBMSType.POSTGRES);
        }
        scan.setScannedId(id);

        if (duplicateSharedPipelines()) {
            context.markAttached(id);
            return context.sharedPipeline(id).deepCopy();
        }
        if (context.isAttached(id)) {
            return null;
        }
        context.markAttached(id);
        return context.sharedPipeline(id);
    }

    private static boolean isCommonTableExpression(JsonNode entry) {
        return "InitPlan".equals(JsonFields.optionalText(entry, "Parent Relationship"))
            && String.valueOf(JsonFields.optionalText(entry, "Subplan Name")).startsWith(CTE_PREFIX);
    }
}
