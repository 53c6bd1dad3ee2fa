package com.benchy.queryplan.operator;

import com.benchy.queryplan.parser.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scan of a base table.
 */
public class TableScan extends QueryOperator {

    private static final Logger logger = LoggerFactory.getLogger(TableScan.class);

    private String tableName;
    private Number tableSize;
    private String type;

    public TableScan(int operatorId) {
        super(OperatorType.TableScan, operatorId);
    }

    public String tableName() {
        return tableName;
    }

    public Number tableSize() {
        return tableSize;
    }

    /**
     * Returns the access path, e.g. "sequential" or "index", when the vendor reports one.
     */
    public String type() {
        return type;
    }

    @Override
    public void fill(JsonNode plan, DBMSType dbms) {
        switch (dbms) {
            case UMBRA -> {
                tableName = JsonFields.requireText(plan, "tablename", dbms);
                tableSize = JsonFields.requireNumber(plan, "tableSize", dbms);
            }
            case HYPER -> tableName = JsonFields.requireText(JsonFields.require(plan, "debugName", dbms), "value", dbms);
            case POSTGRES -> {
                String nodeType = JsonFields.requireText(plan, "Node Type", dbms);
                tableName = JsonFields.optionalText(plan, "Relation Name");
                switch (nodeType) {
                    case "Seq Scan" -> type = "sequential";
                    case "Index Scan", "Index Only Scan" -> type = "index";
                    case "Bitmap Heap Scan", "Bitmap Index Scan" -> type = "bitmap";
                    default -> logger.warn("Unknown table scan type: {}", nodeType);
                }
                if (tableName == null) {
                    logger.debug("Postgres {} has no relation name", nodeType);
                }
            }
            case DUCKDB -> {
                JsonNode extraInfo = JsonFields.optional(plan, "extra_info");
                if (extraInfo != null && extraInfo.isObject()) {
                    tableName = JsonFields.optionalText(extraInfo, "Table");
                    if (tableName == null) {
                        tableName = JsonFields.optionalText(extraInfo, "Text");
                    }
                }
            }
        }
    }

    @Override
    protected void collectAttributes(Map<String, Object> attrs) {
        attrs.put("table_name", tableName);
        attrs.put("table_size", tableSize);
        attrs.put("type", type);
    }
}
