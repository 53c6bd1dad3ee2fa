package com.benchy.queryplan.clean;

import com.benchy.queryplan.operator.DBMSType;
import java.util.Objects;

/**
 * Factory for the cleaner of a vendor.
 */
public final class Cleaners {

    private Cleaners() {
    }

    public static Cleaner forDbms(DBMSType dbms) {
        Objects.requireNonNull(dbms, "dbms must not be null");
        return switch (dbms) {
            case DUCKDB -> new DuckDBCleaner();
            case HYPER, UMBRA -> new HyperUmbraCleaner();
            case POSTGRES -> new PostgresCleaner();
        };
    }
}
