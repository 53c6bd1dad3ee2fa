package com.benchy.queryplan.encoder;

/**
 * Keys of the interchange document.
 */
public final class SerdesKeys {

    // node keys, mirroring the XML form
    public static final String LABEL = "_label";
    public static final String ATTRS = "_attrs";
    public static final String CHILDREN = "_children";

    // attributes every node may carry
    public static final String OPERATOR_ID = "operator_id";
    public static final String ESTIMATED_CARDINALITY = "estimated_cardinality";
    public static final String EXACT_CARDINALITY = "exact_cardinality";
    public static final String SYSTEM_REPRESENTATION = "system_representation";

    // document keys
    public static final String QUERY_TEXT = "queryText";
    public static final String QUERY_PLAN = "queryPlan";

    private SerdesKeys() {
    }
}
