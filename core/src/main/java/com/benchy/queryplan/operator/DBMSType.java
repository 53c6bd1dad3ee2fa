package com.benchy.queryplan.operator;

import java.util.Locale;

/**
 * Database systems whose explain output can be translated.
 */
public enum DBMSType {
    UMBRA,
    POSTGRES,
    HYPER,
    DUCKDB;

    /**
     * Parse a system name (case-insensitive).
     *
     * @param value e.g. "umbra", "postgres", "hyper" or "duckdb"
     * @return the parsed DBMSType
     * @throws IllegalArgumentException if value is not recognized
     */
    public static DBMSType parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("DBMS name must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "umbra", "cedardb" -> UMBRA;
            case "postgres", "postgresql" -> POSTGRES;
            case "hyper" -> HYPER;
            case "duckdb" -> DUCKDB;
            default -> throw new IllegalArgumentException(
                "Unknown DBMS: '" + value + "'. Expected umbra, postgres, hyper or duckdb");
        };
    }
}
