package com.benchy.queryplan.operator;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for all canonical operators.
 *
 * <p>An operator is the typed payload of one plan node. It carries the
 * operator id (vendor-assigned or synthesized by the parser) and whatever
 * type-specific fields its subclass declares. Vendor-specific fields are
 * populated once, right after construction, by {@link #fill(JsonNode, DBMSType)};
 * operators are not modified after parsing completes. Cleaners that need a
 * different operator build a new one and replace the node.
 *
 * <p>Two operators are equal when they have the same type, id and attributes.
 */
public abstract class QueryOperator {

    private final OperatorType operatorType;
    private final int operatorId;

    protected QueryOperator(OperatorType operatorType, int operatorId) {
        this.operatorType = Objects.requireNonNull(operatorType, "operatorType must not be null");
        this.operatorId = operatorId;
    }

    public OperatorType operatorType() {
        return operatorType;
    }

    public int operatorId() {
        return operatorId;
    }

    /**
     * Populates vendor-specific fields from the native plan fragment.
     *
     * <p>Branches that do not apply to the given vendor are no-ops.
     *
     * @param plan the native plan fragment of this operator
     * @param dbms the vendor the fragment comes from
     */
    public void fill(JsonNode plan, DBMSType dbms) {
    }

    /**
     * Returns the encodable attributes of this operator in a stable order.
     *
     * <p>Keys are the interchange attribute names; values may be null, in which
     * case encoders omit them.
     *
     * @return an unmodifiable attribute map
     */
    public final Map<String, Object> attributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        collectAttributes(attrs);
        return Collections.unmodifiableMap(attrs);
    }

    /**
     * Adds the subclass fields to the attribute map.
     *
     * @param attrs the map to add to
     */
    protected void collectAttributes(Map<String, Object> attrs) {
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryOperator other = (QueryOperator) o;
        return operatorType == other.operatorType
            && operatorId == other.operatorId
            && attributes().equals(other.attributes());
    }

    @Override
    public int hashCode() {
        return Objects.hash(operatorType, operatorId, attributes());
    }

    @Override
    public String toString() {
        return operatorType.name() + "#" + operatorId + attributes();
    }
}
