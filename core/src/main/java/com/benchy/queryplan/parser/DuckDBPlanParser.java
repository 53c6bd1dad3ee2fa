package com.benchy.queryplan.parser;

import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.exception.MalformedPlanException;
import com.benchy.queryplan.operator.ArrayUnnest;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.operator.GroupBy;
import com.benchy.queryplan.operator.InlineTable;
import com.benchy.queryplan.operator.Iteration;
import com.benchy.queryplan.operator.IterationScan;
import com.benchy.queryplan.operator.Join;
import com.benchy.queryplan.operator.OperatorRegistry;
import com.benchy.queryplan.operator.PipelineBreakerScan;
import com.benchy.queryplan.operator.QueryOperator;
import com.benchy.queryplan.operator.Select;
import com.benchy.queryplan.operator.SetOperation;
import com.benchy.queryplan.operator.Sort;
import com.benchy.queryplan.operator.TableScan;
import com.benchy.queryplan.operator.Temp;
import com.benchy.queryplan.operator.TopN;
import com.benchy.queryplan.operator.Window;
import com.benchy.queryplan.plan.Cardinality;
import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.LeafNode;
import com.benchy.queryplan.plan.PlanNode;
import com.benchy.queryplan.plan.Provenance;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for DuckDB's JSON profiling output ({@code EXPLAIN ANALYZE} with
 * {@code enable_profiling = 'json'}).
 *
 * <p>The profile root has a single {@code EXPLAIN_ANALYZE} child whose single
 * child is the plan. Ids are assigned in pre-order. DuckDB lists the probe side
 * of a join first; the joins are marked so that the cleaner can swap them.
 */
public class DuckDBPlanParser extends AbstractPlanParser {

    static final List<String> CHILD_KEYS = List.of("children");

    static final OperatorRegistry OPERATORS = OperatorRegistry.builder(DBMSType.DUCKDB)
        .register("ORDER_BY", Sort::new)
        .register(GroupBy::new, "HASH_GROUP_BY", "PERFECT_HASH_GROUP_BY",
            "SIMPLE_AGGREGATE", "UNGROUPED_AGGREGATE")
        .register("PROJECTION", OperatorRegistry.custom("Projection"))
        .register(InlineTable::new, "COLUMN_DATA_SCAN", "DUMMY_SCAN")
        .register(TableScan::new, "TABLE_SCAN", "DELIM_SCAN")
        .register("TOP_N", TopN::new)
        .register("FILTER", Select::new)
        .register(OperatorRegistry.custom("Limit"), "LIMIT", "STREAMING_LIMIT")
        .register("EMPTY_RESULT", OperatorRegistry.custom("EmptyResult"))
        .register("UNION", SetOperation::new)
        .register("CROSS_PRODUCT", OperatorRegistry.custom("CrossProduct"))
        .register(Window::new, "WINDOW", "STREAMING_WINDOW")
        .register("CTE", Temp::new)
        .register("CTE_SCAN", PipelineBreakerScan::new)
        .register("RECURSIVE_CTE", Iteration::new)
        .register("RECURSIVE_CTE_SCAN", IterationScan::new)
        .register("UNNEST", ArrayUnnest::new)
        .register("INOUT_FUNCTION", OperatorRegistry.custom("INOUT_FUNCTION"))
        .registerSuffix("JOIN", Join::new)
        .build();

    public DuckDBPlanParser() {
        this(ParserOptions.defaults());
    }

    public DuckDBPlanParser(ParserOptions options) {
        super(DBMSType.DUCKDB, OPERATORS, options);
    }

    @Override
    protected JsonNode unwrap(JsonNode document) {
        JsonNode explain = onlyChild(document);
        String type = JsonFields.requireText(explain, "operator_type", DBMSType.DUCKDB);
        if (!"EXPLAIN_ANALYZE".equals(type)) {
            throw new MalformedPlanException(
                "Expected EXPLAIN_ANALYZE below the profile root, found " + type,
                "operator_type", DBMSType.DUCKDB);
        }
        return onlyChild(explain);
    }

    private static JsonNode onlyChild(JsonNode node) {
        JsonNode children = JsonFields.require(node, "children", DBMSType.DUCKDB);
        if (!children.isArray() || children.size() != 1) {
            throw new MalformedPlanException(
                "Expected exactly one child, found " + children.size(), "children", DBMSType.DUCKDB);
        }
        return children.get(0);
    }

    @Override
    protected PlanNode buildNode(ParseContext context, JsonNode plan) {
        String operatorType = JsonFields.requireText(plan, "operator_type", DBMSType.DUCKDB);
        QueryOperator operator = createOperator(operatorType, context.nextOperatorId(), plan);
        Provenance provenance = systemRepresentation(plan, CHILD_KEYS);

        JsonNode extraInfo = JsonFields.optional(plan, "extra_info");
        Number estimated = extraInfo == null ? null
            : JsonFields.toNumber(extraInfo.get("Estimated Cardinality"));
        Cardinality cardinality = cardinality(estimated,
            JsonFields.requireNumber(plan, "operator_cardinality", DBMSType.DUCKDB));

        JsonNode children = JsonFields.require(plan, "children", DBMSType.DUCKDB);
        if (children.isEmpty()) {
            return new LeafNode(operator, cardinality, provenance);
        }
        List<PlanNode> nodes = new ArrayList<>(children.size());
        for (JsonNode child : children) {
            nodes.add(buildNode(context, child));
        }
        return new InnerNode(operator, cardinality, nodes, provenance);
    }
}
