package com.benchy.queryplan.parser;

import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.exception.MalformedPlanException;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.operator.OperatorRegistry;
import com.benchy.queryplan.operator.PipelineBreakerScan;
import com.benchy.queryplan.operator.QueryOperator;
import com.benchy.queryplan.operator.Result;
import com.benchy.queryplan.plan.Cardinality;
import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;
import com.benchy.queryplan.plan.Provenance;
import com.benchy.queryplan.plan.QueryPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Skeleton shared by the vendor parsers.
 *
 * <p>A parse call unwraps the vendor envelope, builds the tree recursively,
 * runs the shared-pipeline attachment pass when references were deferred, and
 * finally wraps the real root in the synthetic Result node.
 */
public abstract class AbstractPlanParser implements PlanParser {

    private static final Logger logger = LoggerFactory.getLogger(AbstractPlanParser.class);

    /** Umbra emits NaN for unknown estimates. */
    protected static final ObjectMapper objectMapper = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .build();

    private final DBMSType dbms;
    private final OperatorRegistry operators;
    private final ParserOptions options;

    protected AbstractPlanParser(DBMSType dbms, OperatorRegistry operators, ParserOptions options) {
        this.dbms = Objects.requireNonNull(dbms, "dbms must not be null");
        this.operators = Objects.requireNonNull(operators, "operators must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    @Override
    public DBMSType dbmsType() {
        return dbms;
    }

    public ParserOptions options() {
        return options;
    }

    public OperatorRegistry operators() {
        return operators;
    }

    @Override
    public QueryPlan parse(String query, String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode document;
        try {
            document = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedPlanException("Failed to read " + dbms + " explain output: "
                + e.getOriginalMessage(), e, dbms);
        }
        return parse(query, document);
    }

    @Override
    public QueryPlan parse(String query, JsonNode document) {
        Objects.requireNonNull(query, "query must not be null");
        if (document == null || document.isNull() || document.isMissingNode()) {
            throw new MalformedPlanException("Empty " + dbms + " explain output", (String) null, dbms);
        }

        ParseContext context = new ParseContext();
        PlanNode root = buildNode(context, unwrap(document));

        if (context.hasDeferredReferences()) {
            attachSharedPipelines(context, root, new ArrayDeque<>());
            logger.debug("Attached {} shared pipeline copies for {} deferred references",
                context.attachments(), context.deferredReferences());
        }

        PlanNode result = new InnerNode(new Result(), root.cardinality(), List.of(root), Provenance.synthetic());
        logger.debug("Parsed {} plan: {} nodes, {} shared pipelines",
            dbms, result.nodeCount(), context.sharedPipelineCount());
        return new QueryPlan(query, result);
    }

    /**
     * Strips the vendor envelope and returns the object describing the real plan root.
     */
    protected abstract JsonNode unwrap(JsonNode document);

    /**
     * Builds the subtree rooted at the given native plan object.
     */
    protected abstract PlanNode buildNode(ParseContext context, JsonNode plan);

    /**
     * Creates and fills the canonical operator for a native operator name.
     */
    protected QueryOperator createOperator(String nativeName, int operatorId, JsonNode plan) {
        QueryOperator operator = operators.create(nativeName, operatorId);
        operator.fill(plan, dbms);
        return operator;
    }

    /**
     * Returns the provenance of a node: a copy of its native object without the
     * child-reference keys, or nothing when provenance is disabled.
     */
    protected Provenance systemRepresentation(JsonNode plan, Collection<String> childKeys) {
        if (!options.includeSystemRepresentation()) {
            return Provenance.empty();
        }
        JsonNode copy = plan.deepCopy();
        if (copy instanceof ObjectNode object) {
            object.remove(childKeys);
        }
        return Provenance.of(copy);
    }

    /**
     * Returns true if the native object has none of the given child-reference keys.
     */
    protected static boolean hasNoneOf(JsonNode plan, Collection<String> keys) {
        for (String key : keys) {
            if (plan.has(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Replaces the exact cardinality of the inner side of an index nested-loop
     * join. The vendor never scans that relation in full and cannot report its
     * true row count.
     */
    protected PlanNode overrideIndexLookupCardinality(PlanNode inner, Number exact) {
        logger.debug("Index nested-loop join: exact cardinality of {} set from {} to {}",
            inner.operator().operatorType(), inner.exactCardinality(), exact);
        return inner.withCardinality(inner.cardinality().withExact(exact));
    }

    protected boolean duplicateSharedPipelines() {
        return options.duplicateSharedPipelines();
    }

    /**
     * Attaches a fresh copy of the referenced shared pipeline to every scan left
     * without children, including scans inside copies attached on the way.
     */
    private void attachSharedPipelines(ParseContext context, PlanNode node, Deque<Integer> expanding) {
        if (!(node instanceof InnerNode inner)) {
            return;
        }
        if (inner.operator() instanceof PipelineBreakerScan scan && inner.children().isEmpty()) {
            Integer id = scan.scannedId();
            PlanNode shared = context.sharedPipeline(id);
            if (shared == null) {
                throw new MalformedPlanException(
                    "Shared pipeline " + id + " is referenced but never defined", "scannedId", dbms);
            }
            if (expanding.contains(id)) {
                throw new MalformedPlanException(
                    "Shared pipeline " + id + " references itself", "scannedId", dbms);
            }
            PlanNode copy = shared.deepCopy();
            inner.attach(copy);
            context.markAttached(id);

            expanding.push(id);
            attachSharedPipelines(context, copy, expanding);
            expanding.pop();
            return;
        }
        for (PlanNode child : inner.children()) {
            attachSharedPipelines(context, child, expanding);
        }
    }

    protected static Cardinality cardinality(Number estimated, Number exact) {
        return new Cardinality(estimated, exact);
    }
}
