package com.benchy.queryplan.operator;

import com.benchy.queryplan.exception.UnrecognizedOperatorException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical logical join kinds.
 *
 * <p>Each vendor spells join kinds differently, and DuckDB reports build and
 * probe inputs in reverse, so the left/right prefix of its semi, anti and mark
 * joins is inverted here. Every vendor table is exhaustive: a native kind that
 * is not listed fails with {@link UnrecognizedOperatorException}.
 */
public enum JoinType {
    INNER("inner"),
    FULL_OUTER("fullouter"),
    LEFT_OUTER("leftouter"),
    RIGHT_OUTER("rightouter"),
    LEFT_SEMI("leftsemi"),
    RIGHT_SEMI("rightsemi"),
    LEFT_ANTI("leftanti"),
    RIGHT_ANTI("rightanti"),
    LEFT_MARK("leftmark"),
    RIGHT_MARK("rightmark"),
    // DuckDB only: at most one match per probe row
    SINGLE("single");

    private static final Map<DBMSType, Map<String, JoinType>> NATIVE_KINDS = new EnumMap<>(DBMSType.class);

    static {
        Map<String, JoinType> canonical = new HashMap<>();
        for (JoinType type : values()) {
            canonical.put(type.wireName, type);
        }
        NATIVE_KINDS.put(DBMSType.UMBRA, Collections.unmodifiableMap(canonical));

        // Hyper encodes the kind in the operator name; "join" alone is an inner join
        Map<String, JoinType> hyper = new HashMap<>();
        for (JoinType type : values()) {
            if (type != SINGLE) {
                hyper.put(type == INNER ? "" : type.wireName, type);
            }
        }
        hyper.put("inner", INNER);
        NATIVE_KINDS.put(DBMSType.HYPER, Collections.unmodifiableMap(hyper));

        Map<String, JoinType> postgres = new HashMap<>();
        postgres.put("inner", INNER);
        postgres.put("left", LEFT_OUTER);
        postgres.put("right", RIGHT_OUTER);
        postgres.put("full", FULL_OUTER);
        postgres.put("semi", LEFT_SEMI);
        postgres.put("anti", LEFT_ANTI);
        postgres.put("right semi", RIGHT_SEMI);
        postgres.put("right anti", RIGHT_ANTI);
        NATIVE_KINDS.put(DBMSType.POSTGRES, Collections.unmodifiableMap(postgres));

        // DuckDB swaps join inputs: its "left" side is our right side
        Map<String, JoinType> duckdb = new HashMap<>();
        duckdb.put("inner", INNER);
        duckdb.put("single", SINGLE);
        duckdb.put("right", LEFT_OUTER);
        duckdb.put("left", RIGHT_OUTER);
        duckdb.put("outer", FULL_OUTER);
        duckdb.put("full", FULL_OUTER);
        duckdb.put("right_semi", LEFT_SEMI);
        duckdb.put("left_semi", RIGHT_SEMI);
        duckdb.put("right_anti", LEFT_ANTI);
        duckdb.put("left_anti", RIGHT_ANTI);
        // No side given; assumed to refer to DuckDB's left input, which is our right one
        duckdb.put("semi", RIGHT_SEMI);
        duckdb.put("anti", RIGHT_ANTI);
        duckdb.put("mark", RIGHT_MARK);
        NATIVE_KINDS.put(DBMSType.DUCKDB, Collections.unmodifiableMap(duckdb));
    }

    private final String wireName;

    JoinType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the interchange spelling, e.g. "leftsemi".
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Maps a vendor-native join kind to its canonical kind.
     *
     * @param dbms the vendor
     * @param nativeKind the native spelling (matched case-insensitively)
     * @return the canonical join kind
     * @throws UnrecognizedOperatorException if the vendor table has no entry
     */
    public static JoinType fromNative(DBMSType dbms, String nativeKind) {
        JoinType type = nativeKind == null
            ? null
            : NATIVE_KINDS.get(dbms).get(nativeKind.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new UnrecognizedOperatorException(
                "Unknown join type for " + dbms + ": " + nativeKind, nativeKind, dbms);
        }
        return type;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
