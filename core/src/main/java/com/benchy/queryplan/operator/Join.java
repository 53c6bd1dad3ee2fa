package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Binary join with a canonical logical kind and a physical method.
 *
 * <p>Children are ordered left (build) then right (probe). Vendors that report
 * them the other way round mark the join {@link ChildOrder#PROBE_FIRST}; the
 * cleaner swaps the children and replaces the operator with a
 * {@link ChildOrder#CANONICAL} copy, so normalization happens exactly once.
 */
public class Join extends QueryOperator {

    /**
     * Order in which the parser attached the two inputs.
     */
    public enum ChildOrder {
        CANONICAL,
        PROBE_FIRST
    }

    private JoinType type;
    private String method;
    private ChildOrder childOrder = ChildOrder.CANONICAL;

    public Join(int operatorId) {
        super(OperatorType.Join, operatorId);
    }

    public JoinType type() {
        return type;
    }

    /**
     * Returns the physical method, e.g. "hash", "merge", "nl" or "index".
     */
    public String method() {
        return method;
    }

    public ChildOrder childOrder() {
        return childOrder;
    }

    /**
     * Returns true if this join is physically an index nested-loop join.
     */
    public boolean isIndexNestedLoop() {
        return "index".equals(method) || "indexnl".equals(method);
    }

    /**
     * Returns a copy of this join with the given child order.
     *
     * @param order the child order of the copy
     * @return the copy
     */
    public Join withChildOrder(ChildOrder order) {
        Join copy = new Join(operatorId());
        copy.type = type;
        copy.method = method;
        copy.childOrder = Objects.requireNonNull(order, "order must not be null");
        return copy;
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        switch (dbms) {
            case UMBRA -> {
                type = JoinType.fromNative(dbms, JsonFields.requireText(plan, "type", dbms));
                String op = JsonFields.requireText(plan, "physicalOperator", dbms);
                method = switch (op) {
                    case "hashjoin" -> "hash";
                    case "indexnljoin" -> "index";
                    case "bnljoin" -> "nl";
                    default -> op.replace("join", "");
                };
            }
            case DUCKDB -> {
                JsonNode extraInfo = JsonFields.require(plan, "extra_info", dbms);
                type = JoinType.fromNative(dbms, JsonFields.requireText(extraInfo, "Join Type", dbms));
                String name = JsonFields.requireText(plan, "operator_type", dbms)
                    .replace("_JOIN", "")
                    .toLowerCase(Locale.ROOT);
                method = switch (name) {
                    case "piecewise_merge" -> "merge";
                    case "nested_loop", "blockwise_nl" -> "nl";
                    default -> name;
                };
                childOrder = ChildOrder.PROBE_FIRST;
            }
            case HYPER -> {
                method = JsonFields.requireText(plan, "method", dbms);
                String operator = JsonFields.requireText(plan, "operator", dbms);
                type = JoinType.fromNative(dbms, operator.replace("join", ""));
            }
            case POSTGRES -> {
                type = JoinType.fromNative(dbms, JsonFields.requireText(plan, "Join Type", dbms));
                method = switch (JsonFields.requireText(plan, "Node Type", dbms)) {
                    case "Merge Join" -> "merge";
                    case "Hash Join" -> "hash";
                    case "Nested Loop" -> "nl";
                    default -> null;
                };
            }
        }
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("type", type == null ? null : type.wireName());
        attrs.put("method", method);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && childOrder == ((Join) o).childOrder;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + childOrder.hashCode();
    }
}
