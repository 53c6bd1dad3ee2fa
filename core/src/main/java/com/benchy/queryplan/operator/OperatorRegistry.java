package com.benchy.queryplan.operator;

import com.benchy.queryplan.exception.UnrecognizedOperatorException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Dispatch table from one vendor's native operator names to canonical operator
 * constructors.
 *
 * <p>Lookups first try an exact name, then the registered name suffixes in
 * registration order (e.g. every Postgres node type ending in "Join"). A name
 * with neither is rejected; there is no default classification.
 *
 * <p>Registries are immutable once built and safe to share between threads.
 *
 * <p>Example:
 * <pre>
 *   OperatorRegistry registry = OperatorRegistry.builder(DBMSType.HYPER)
 *       .register("tablescan", TableScan::new)
 *       .register("assertsingle", OperatorRegistry.custom("AssertSingle"))
 *       .build();
 *   QueryOperator op = registry.create("tablescan", 7);
 * </pre>
 */
public final class OperatorRegistry {

    /**
     * Creates an empty canonical operator for a given id.
     */
    @FunctionalInterface
    public interface OperatorFactory {
        QueryOperator create(int operatorId);
    }

    private final DBMSType dbms;
    private final Map<String, OperatorFactory> exactNames;
    private final Map<String, OperatorFactory> suffixes;

    private OperatorRegistry(Builder builder) {
        this.dbms = builder.dbms;
        this.exactNames = Collections.unmodifiableMap(new LinkedHashMap<>(builder.exactNames));
        this.suffixes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.suffixes));
    }

    public static Builder builder(DBMSType dbms) {
        return new Builder(dbms);
    }

    /**
     * Returns a factory for a named {@link CustomOperator}.
     */
    public static OperatorFactory custom(String name) {
        return id -> new CustomOperator(name, id);
    }

    public DBMSType dbms() {
        return dbms;
    }

    /**
     * Creates the canonical operator for a native operator name.
     *
     * @param nativeName the vendor's operator name
     * @param operatorId the operator id
     * @return a new, not yet filled operator
     * @throws UnrecognizedOperatorException if the name is not in this table
     */
    public QueryOperator create(String nativeName, int operatorId) {
        OperatorFactory factory = lookup(nativeName);
        if (factory == null) {
            throw new UnrecognizedOperatorException(nativeName, dbms);
        }
        return factory.create(operatorId);
    }

    /**
     * Checks if a native operator name is supported.
     *
     * @param nativeName the vendor's operator name
     * @return true if supported, false otherwise
     */
    public boolean isSupported(String nativeName) {
        return lookup(nativeName) != null;
    }

    /**
     * Returns the exact names in this table, without suffix rules.
     */
    public Set<String> exactNames() {
        return exactNames.keySet();
    }

    private OperatorFactory lookup(String nativeName) {
        if (nativeName == null) {
            return null;
        }
        OperatorFactory factory = exactNames.get(nativeName);
        if (factory != null) {
            return factory;
        }
        for (Map.Entry<String, OperatorFactory> entry : suffixes.entrySet()) {
            if (nativeName.endsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static final class Builder {

        private final DBMSType dbms;
        private final Map<String, OperatorFactory> exactNames = new LinkedHashMap<>();
        private final Map<String, OperatorFactory> suffixes = new LinkedHashMap<>();

        private Builder(DBMSType dbms) {
            this.dbms = Objects.requireNonNull(dbms, "dbms must not be null");
        }

        public Builder register(String nativeName, OperatorFactory factory) {
            if (exactNames.put(nativeName, Objects.requireNonNull(factory)) != null) {
                throw new IllegalStateException(
                    "Duplicate " + dbms + " operator registration: " + nativeName);
            }
            return this;
        }

        public Builder register(OperatorFactory factory, String... nativeNames) {
            for (String name : nativeNames) {
                register(name, factory);
            }
            return this;
        }

        public Builder registerSuffix(String suffix, OperatorFactory factory) {
            suffixes.put(suffix, Objects.requireNonNull(factory));
            return this;
        }

        public OperatorRegistry build() {
            return new OperatorRegistry(this);
        }
    }
}
