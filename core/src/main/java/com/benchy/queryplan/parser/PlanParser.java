package com.benchy.queryplan.parser;

import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.plan.QueryPlan;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Translates one vendor's "explain analyze" JSON output into a canonical plan.
 *
 * <p>Implementations keep no state between calls: every call owns its own
 * shared-pipeline table, so one parser may be used from several threads.
 *
 * <p>A call either returns a complete plan or throws a
 * {@link com.benchy.queryplan.exception.PlanTranslationException}; partial
 * trees are never returned.
 */
public interface PlanParser {

    /**
     * Returns the vendor whose explain format this parser reads.
     */
    DBMSType dbmsType();

    /**
     * Parses an explain document.
     *
     * @param query the text of the explained query
     * @param document the vendor explain document, envelope included
     * @return the canonical plan
     */
    QueryPlan parse(String query, JsonNode document);

    /**
     * Parses an explain document given as JSON text.
     *
     * @param query the text of the explained query
     * @param json the vendor explain document, envelope included
     * @return the canonical plan
     */
    QueryPlan parse(String query, String json);
}
