package com.benchy.queryplan.parser;

import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.operator.EarlyProbe;
import com.benchy.queryplan.operator.GroupBy;
import com.benchy.queryplan.operator.GroupJoin;
import com.benchy.queryplan.operator.Join;
import com.benchy.queryplan.operator.MapOperator;
import com.benchy.queryplan.operator.OperatorRegistry;
import com.benchy.queryplan.operator.OperatorType;
import com.benchy.queryplan.operator.PipelineBreakerScan;
import com.benchy.queryplan.operator.QueryOperator;
import com.benchy.queryplan.operator.Select;
import com.benchy.queryplan.operator.SetOperation;
import com.benchy.queryplan.operator.Sort;
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
 * Parser for Tableau Hyper's {@code EXPLAIN (FORMAT JSON, ANALYZE)} output.
 *
 * <p>Hyper encodes the join kind and set operation in the operator name
 * ({@code leftsemijoin}, {@code unionall}). An {@code explicitscan} carries
 * either the definition of the shared pipeline it reads (an object
 * {@code input}) or a plain reference to it (an integer {@code input}).
 */
public class HyperPlanParser extends AbstractPlanParser {

    private static final Logger logger = LoggerFactory.getLogger(HyperPlanParser.class);

    static final List<String> CHILD_KEYS = List.of("input", "left", "right");

    private static final List<String> INNER_NODE_KEYS = List.of("input", "left", "right", "source");

    static final OperatorRegistry OPERATORS = OperatorRegistry.builder(DBMSType.HYPER)
        .register("tablescan", TableScan::new)
        .register("sort", Sort::new)
        .register(Join::new, "join", "fullouterjoin",
            "leftsemijoin", "leftouterjoin", "leftantijoin", "leftmarkjoin",
            "rightsemijoin", "rightouterjoin", "rightantijoin", "rightmarkjoin")
        .register("groupjoin", GroupJoin::new)
        .register("groupby", GroupBy::new)
        .register("map", MapOperator::new)
        .register("earlyprobe", EarlyProbe::new)
        .register(SetOperation::new, "union", "intersect", "except",
            "unionall", "intersectall", "exceptall")
        .register("window", Window::new)
        .register("explicitscan", PipelineBreakerScan::new)
        .register("select", Select::new)
        .register("assertsingle", OperatorRegistry.custom("AssertSingle"))
        .register("temp", Temp::new)
        .build();

    public HyperPlanParser() {
        this(ParserOptions.defaults());
    }

    public HyperPlanParser(ParserOptions options) {
        super(DBMSType.HYPER, OPERATORS, options);
    }

    @Override
    protected JsonNode unwrap(JsonNode document) {
        if (!document.has("operator") && document.has("input")) {
            return document.get("input");
        }
        return document;
    }

    @Override
    protected PlanNode buildNode(ParseContext context, JsonNode plan) {
        String operatorName = JsonFields.requireText(plan, "operator", DBMSType.HYPER);
        int operatorId = JsonFields.requireInt(plan, "operatorId", DBMSType.HYPER);
        QueryOperator operator = createOperator(operatorName, operatorId, plan);
        Provenance provenance = systemRepresentation(plan, CHILD_KEYS);

        Number estimated = JsonFields.optionalNumber(plan, "cardinality");
        if (estimated == null) {
            estimated = 0L;
        }
        JsonNode analyze = JsonFields.require(plan, "analyze", DBMSType.HYPER);
        Number exact = JsonFields.requireNumber(analyze, "tuple-count", DBMSType.HYPER);
        Cardinality cardinality = cardinality(estimated, exact);

        if (hasNoneOf(plan, INNER_NODE_KEYS)) {
            return new LeafNode(operator, cardinality, provenance);
        }

        List<PlanNode> children = new ArrayList<>();
        if (operator instanceof PipelineBreakerScan scan) {
            JsonNode input = plan.get("input");
            if (input != null && input.isObject()) {
                PlanNode shared = buildNode(context, input);
                context.registerSharedPipeline(scan.scannedId(), shared);
                logger.debug("Registered shared pipeline {}", scan.scannedId());
                if (!duplicateSharedPipelines()) {
                    context.markAttached(scan.scannedId());
                    children.add(shared);
                }
            }
            if (duplicateSharedPipelines()) {
                context.deferReference();
            }
        } else if (plan.has("input")) {
            JsonNode input = plan.get("input");
            if (input.isArray()) {
                for (JsonNode item : input) {
                    children.add(buildNode(context, item));
                }
            } else {
                children.add(buildNode(context, input));
            }
        } else if (plan.has("left") && plan.has("right")) {
            children.add(buildNode(context, plan.get("left")));
            children.add(buildNode(context, plan.get("right")));
        }

        // Hyper does not count the tuples of the probed table of an index nested-loop join;
        // the estimate is the closest substitute available
        if (operator instanceof Join join && join.isIndexNestedLoop() && children.size() == 2
                && children.get(1).operator().operatorType() == OperatorType.TableScan) {
            PlanNode inner = children.get(1);
            children.set(1, overrideIndexLookupCardinality(inner, inner.estimatedCardinality()));
        }

        return new InnerNode(operator, cardinality, children, provenance);
    }
}
