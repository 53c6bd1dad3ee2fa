package com.benchy.queryplan.parser;

import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.operator.ArrayUnnest;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.operator.EarlyProbe;
import com.benchy.queryplan.operator.GroupBy;
import com.benchy.queryplan.operator.GroupJoin;
import com.benchy.queryplan.operator.InlineTable;
import com.benchy.queryplan.operator.Iteration;
import com.benchy.queryplan.operator.IterationScan;
import com.benchy.queryplan.operator.Join;
import com.benchy.queryplan.operator.MapOperator;
import com.benchy.queryplan.operator.OperatorRegistry;
import com.benchy.queryplan.operator.PipelineBreakerScan;
import com.benchy.queryplan.operator.QueryOperator;
import com.benchy.queryplan.operator.RegexSplit;
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
 * Parser for Umbra's {@code EXPLAIN (FORMAT JSON, ANALYZE)} output.
 *
 * <p>The plan sits in the {@code plan} field of the document. Operator ids are
 * assigned by Umbra. Children hang off several keys:
 * <ul>
 *   <li>{@code magic} - a shared subtree, registered under its operator id and
 *       kept as the first child</li>
 *   <li>{@code pipelineBreaker} - the definition of the pipeline a
 *       temp/pipeline-breaker scan reads</li>
 *   <li>{@code input}, {@code left}/{@code right} - unary and binary inputs</li>
 *   <li>{@code arguments[].input} - set operation inputs</li>
 *   <li>{@code inputs[].op} - multiway join inputs</li>
 * </ul>
 */
public class UmbraPlanParser extends AbstractPlanParser {

    private static final Logger logger = LoggerFactory.getLogger(UmbraPlanParser.class);

    static final List<String> CHILD_KEYS = List.of(
        "magic", "pipelineBreaker", "input", "left", "right", "arguments", "inputs");

    private static final List<String> INNER_NODE_KEYS = List.of(
        "input", "left", "right", "arguments", "magic", "scannedOperator", "inputs");

    static final OperatorRegistry OPERATORS = OperatorRegistry.builder(DBMSType.UMBRA)
        .register("tablescan", TableScan::new)
        .register("inlinetable", InlineTable::new)
        .register("sort", Sort::new)
        .register("join", Join::new)
        .register("groupjoin", GroupJoin::new)
        .register("groupby", GroupBy::new)
        .register("map", MapOperator::new)
        .register("select", Select::new)
        .register(PipelineBreakerScan::new, "pipelinebreakerscan", "tempscan")
        .register("temp", Temp::new)
        .register("earlyprobe", EarlyProbe::new)
        .register("setoperation", SetOperation::new)
        .register("assertsingle", OperatorRegistry.custom("AssertSingle"))
        .register("window", Window::new)
        .register("multiwayjoin", OperatorRegistry.custom("MultiwayJoin"))
        .register("earlyexecution", OperatorRegistry.custom("EarlyExecution"))
        .register("iteration", Iteration::new)
        .register("iterationincrementscan", IterationScan::new)
        .register("arrayunnest", ArrayUnnest::new)
        .register("regexsplit", RegexSplit::new)
        .build();

    public UmbraPlanParser() {
        this(ParserOptions.defaults());
    }

    public UmbraPlanParser(ParserOptions options) {
        super(DBMSType.UMBRA, OPERATORS, options);
    }

    @Override
    protected JsonNode unwrap(JsonNode document) {
        return JsonFields.require(document, "plan", DBMSType.UMBRA);
    }

    @Override
    protected PlanNode buildNode(ParseContext context, JsonNode plan) {
        String operatorName = JsonFields.requireText(plan, "operator", DBMSType.UMBRA);
        int operatorId = JsonFields.requireInt(plan, "operatorId", DBMSType.UMBRA);
        QueryOperator operator = createOperator(operatorName, operatorId, plan);
        Provenance provenance = systemRepresentation(plan, CHILD_KEYS);

        Number estimated = JsonFields.optionalNumber(plan, "cardinality");
        if (estimated == null) {
            estimated = 0L;
        }
        Number exact = JsonFields.optionalNumber(plan, "analyzePlanCardinality");
        if (exact == null) {
            exact = estimated;
        }
        Cardinality cardinality = cardinality(estimated, exact);

        if (hasNoneOf(plan, INNER_NODE_KEYS)) {
            return new LeafNode(operator, cardinality, provenance);
        }

        List<PlanNode> children = new ArrayList<>();
        JsonNode magic = JsonFields.optional(plan, "magic");
        if (magic != null) {
            PlanNode child = buildNode(context, magic);
            context.registerSharedPipeline(child.operator().operatorId(), child);
            logger.debug("Registered magic subtree {}", child.operator().operatorId());
            children.add(child);
        }

        if (operator instanceof PipelineBreakerScan scan) {
            JsonNode definition = JsonFields.optional(plan, "pipelineBreaker");
            if (definition != null) {
                PlanNode shared = buildNode(context, definition);
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
            children.add(buildNode(context, plan.get("input")));
        } else if (plan.has("left") && plan.has("right")) {
            children.add(buildNode(context, plan.get("left")));
            children.add(buildNode(context, plan.get("right")));

            // Umbra does not execute the full inner relation of an index nested-loop join
            if ("indexnljoin".equals(JsonFields.optionalText(plan, "physicalOperator"))) {
                children.set(1, overrideIndexLookupCardinality(children.get(1), 0L));
            }
        } else if (plan.has("arguments")) {
            for (JsonNode argument : plan.get("arguments")) {
                children.add(buildNode(context, JsonFields.require(argument, "input", DBMSType.UMBRA)));
            }
        } else if (plan.has("inputs")) {
            for (JsonNode input : plan.get("inputs")) {
                children.add(buildNode(context, JsonFields.require(input, "op", DBMSType.UMBRA)));
            }
        }

        return new InnerNode(operator, cardinality, children, provenance);
    }
}
