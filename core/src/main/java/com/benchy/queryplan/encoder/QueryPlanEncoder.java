package com.benchy.queryplan.encoder;

import com.benchy.queryplan.config.PlanFormat;
import com.benchy.queryplan.exception.PlanEncodingException;
import com.benchy.queryplan.plan.QueryPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes a query plan as an interchange document
 * {@code {"queryText": ..., "queryPlan": ...}}.
 *
 * <p>In JSON format {@code queryPlan} is the nested node object; in XML format
 * it is the XML text of the tree. The query text is normalized so that the
 * document does not depend on the formatting of the original query.
 */
public class QueryPlanEncoder {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final JsonPlanEncoder jsonEncoder = new JsonPlanEncoder();
    private final XmlPlanEncoder xmlEncoder = new XmlPlanEncoder();

    /**
     * Encodes a query plan as JSON text.
     *
     * @param plan the plan
     * @param format the format of the {@code queryPlan} field
     * @return the interchange document
     */
    public String encode(QueryPlan plan, PlanFormat format) {
        try {
            return objectMapper.writeValueAsString(toDocument(plan, format));
        } catch (JsonProcessingException e) {
            throw new PlanEncodingException("Failed to write query plan document", e);
        }
    }

    /**
     * Builds the interchange document of a query plan.
     *
     * @param plan the plan
     * @param format the format of the {@code queryPlan} field
     * @return the document
     */
    public ObjectNode toDocument(QueryPlan plan, PlanFormat format) {
        Objects.requireNonNull(plan, "plan must not be null");
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put(SerdesKeys.QUERY_TEXT, normalizeText(plan.text()));
        switch (format == null ? PlanFormat.JSON : format) {
            case JSON -> document.set(SerdesKeys.QUERY_PLAN, jsonEncoder.encode(plan.plan()));
            case XML -> document.put(SerdesKeys.QUERY_PLAN, xmlEncoder.encode(plan.plan()));
        }
        return document;
    }

    /**
     * Strips every line of a query, joins the lines with spaces and trims the result.
     *
     * @param text the query text
     * @return the normalized text
     */
    public static String normalizeText(String text) {
        return Arrays.stream(text.split("\n", -1))
            .map(String::strip)
            .collect(Collectors.joining(" "))
            .strip();
    }
}
