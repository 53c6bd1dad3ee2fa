package com.benchy.queryplan.encoder;

/**
 * Interchange document read back by {@link QueryPlanDecoder}.
 *
 * @param queryText the normalized query text
 * @param plan the root of the encoded tree
 */
public record EncodedQueryPlan(String queryText, EncodedPlanNode plan) {
}
