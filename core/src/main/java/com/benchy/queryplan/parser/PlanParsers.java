package com.benchy.queryplan.parser;

import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.operator.DBMSType;
import java.util.Objects;

/**
 * Factory for the parser of a vendor.
 */
public final class PlanParsers {

    private PlanParsers() {
    }

    public static PlanParser forDbms(DBMSType dbms) {
        return forDbms(dbms, ParserOptions.defaults());
    }

    public static PlanParser forDbms(DBMSType dbms, ParserOptions options) {
        Objects.requireNonNull(dbms, "dbms must not be null");
        return switch (dbms) {
            case UMBRA -> new UmbraPlanParser(options);
            case HYPER -> new HyperPlanParser(options);
            case POSTGRES -> new PostgresPlanParser(options);
            case DUCKDB -> new DuckDBPlanParser(options);
        };
    }
}
