package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * DuckDB's {@code TOP_N}: an ordered limit with no canonical counterpart until
 * the cleaner renames it to a Sort.
 *
 * <p>The limit comes from {@code extra_info}: either its {@code Top} field, or
 * the first line of a textual annotation of the form {@code Top 10}. It is null
 * when neither is present.
 */
public class TopN extends CustomOperator {

    public static final String NAME = "TopN";

    private Number limit;

    public TopN(int operatorId) {
        super(NAME, operatorId);
    }

    public Number limit() {
        return limit;
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        JsonNode extraInfo = JsonFields.optional(plan, "extra_info");
        if (extraInfo == null) {
            return;
        }
        limit = extraInfo.isObject()
            ? JsonFields.optionalNumber(extraInfo, "Top")
            : parseTopLine(extraInfo.asText());
    }

    private static Number parseTopLine(String text) {
        String firstLine = text.strip().split("\n", 2)[0].strip();
        String[] words = firstLine.split("\\s+");
        if (words.length < 2 || !"Top".equalsIgnoreCase(words[0]) || !words[1].matches("\\d{1,18}")) {
            return null;
        }
        return Long.parseLong(words[1]);
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        super.collectAttributes(attrs);
        attrs.put("limit", limit);
    }
}
