package com.benchy.queryplan;

import com.benchy.queryplan.clean.Cleaners;
import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.config.PlanFormat;
import com.benchy.queryplan.encoder.QueryPlanEncoder;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.parser.PlanParsers;
import com.benchy.queryplan.plan.QueryPlan;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the plan translation engine: parses a vendor's explain
 * output, cleans the canonical tree and encodes it as an interchange document.
 *
 * <p>Translators hold no per-call state; one instance may serve concurrent
 * calls.
 *
 * <p>Example usage:
 * <pre>
 *   PlanTranslator translator = new PlanTranslator();
 *   String document = translator.translate(DBMSType.POSTGRES, sql, explainJson);
 * </pre>
 */
public class PlanTranslator {

    private static final Logger logger = LoggerFactory.getLogger(PlanTranslator.class);

    private final ParserOptions options;
    private final PlanFormat format;
    private final boolean clean;
    private final QueryPlanEncoder encoder = new QueryPlanEncoder();

    /**
     * Creates a translator configured from system properties, writing JSON and
     * cleaning plans.
     */
    public PlanTranslator() {
        this(ParserOptions.fromSystemProperties(), PlanFormat.JSON, true);
    }

    /**
     * Creates a translator.
     *
     * @param options the parser options
     * @param format the format of the encoded tree
     * @param clean whether to clean plans before encoding
     */
    public PlanTranslator(ParserOptions options, PlanFormat format, boolean clean) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.clean = clean;
    }

    /**
     * Parses and, unless disabled, cleans a vendor plan.
     *
     * @param dbms the vendor that produced the explain output
     * @param query the query text
     * @param explainJson the explain output
     * @return the canonical plan
     */
    public QueryPlan toCanonicalPlan(DBMSType dbms, String query, String explainJson) {
        QueryPlan plan = PlanParsers.forDbms(dbms, options).parse(query, explainJson);
        return clean ? Cleaners.forDbms(dbms).clean(plan) : plan;
    }

    /**
     * Translates a vendor plan into an interchange document.
     *
     * @param dbms the vendor that produced the explain output
     * @param query the query text
     * @param explainJson the explain output
     * @return the encoded document
     */
    public String translate(DBMSType dbms, String query, String explainJson) {
        long start = System.nanoTime();
        QueryPlan plan = toCanonicalPlan(dbms, query, explainJson);
        String document = encoder.encode(plan, format);
        logger.info("Translated {} plan: {} nodes, {} format, cleaned={}, {} ms",
            dbms, plan.plan().nodeCount(), format, clean, (System.nanoTime() - start) / 1_000_000);
        return document;
    }

    public ParserOptions options() {
        return options;
    }

    public PlanFormat format() {
        return format;
    }

    public boolean isCleaning() {
        return clean;
    }
}
