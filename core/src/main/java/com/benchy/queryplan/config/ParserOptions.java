package com.benchy.queryplan.config;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options controlling how vendor plans are parsed.
 *
 * <ul>
 *   <li>{@code includeSystemRepresentation} (default {@code true}) - keep the
 *       vendor-native fragment of every node as its provenance</li>
 *   <li>{@code duplicateSharedPipelines} (default {@code false}) - attach a fresh
 *       copy of a shared pipeline to every scan referencing it, instead of
 *       keeping the single subtree below its first reference</li>
 * </ul>
 *
 * <p>Instances are immutable. {@link #fromSystemProperties()} reads the defaults
 * from {@value #PROP_INCLUDE_SYSTEM_REPRESENTATION} and
 * {@value #PROP_DUPLICATE_SHARED_PIPELINES}.
 */
public final class ParserOptions {

    private static final Logger logger = LoggerFactory.getLogger(ParserOptions.class);

    public static final String PROP_INCLUDE_SYSTEM_REPRESENTATION = "benchy.plan.includeSystemRepresentation";
    public static final String PROP_DUPLICATE_SHARED_PIPELINES = "benchy.plan.duplicateSharedPipelines";

    public static final boolean DEFAULT_INCLUDE_SYSTEM_REPRESENTATION = true;
    public static final boolean DEFAULT_DUPLICATE_SHARED_PIPELINES = false;

    private static final ParserOptions DEFAULTS = builder().build();

    private final boolean includeSystemRepresentation;
    private final boolean duplicateSharedPipelines;

    private ParserOptions(Builder builder) {
        this.includeSystemRepresentation = builder.includeSystemRepresentation;
        this.duplicateSharedPipelines = builder.duplicateSharedPipelines;
    }

    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates options from system properties, falling back to the defaults for
     * absent or invalid values.
     *
     * @return the configured options
     */
    public static ParserOptions fromSystemProperties() {
        return builder()
            .includeSystemRepresentation(getConfiguredFlag(
                PROP_INCLUDE_SYSTEM_REPRESENTATION, DEFAULT_INCLUDE_SYSTEM_REPRESENTATION))
            .duplicateSharedPipelines(getConfiguredFlag(
                PROP_DUPLICATE_SHARED_PIPELINES, DEFAULT_DUPLICATE_SHARED_PIPELINES))
            .build();
    }

    public boolean includeSystemRepresentation() {
        return includeSystemRepresentation;
    }

    public boolean duplicateSharedPipelines() {
        return duplicateSharedPipelines;
    }

    public Builder toBuilder() {
        return builder()
            .includeSystemRepresentation(includeSystemRepresentation)
            .duplicateSharedPipelines(duplicateSharedPipelines);
    }

    private static boolean getConfiguredFlag(String property, boolean defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                logger.warn("Invalid value '{}' for {}, using default {}", value, property, defaultValue);
                return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "ParserOptions{includeSystemRepresentation=" + includeSystemRepresentation +
               ", duplicateSharedPipelines=" + duplicateSharedPipelines + "}";
    }

    public static final class Builder {

        private boolean includeSystemRepresentation = DEFAULT_INCLUDE_SYSTEM_REPRESENTATION;
        private boolean duplicateSharedPipelines = DEFAULT_DUPLICATE_SHARED_PIPELINES;

        private Builder() {}

        public Builder includeSystemRepresentation(boolean value) {
            this.includeSystemRepresentation = value;
            return this;
        }

        public Builder duplicateSharedPipelines(boolean value) {
            this.duplicateSharedPipelines = value;
            return this;
        }

        public ParserOptions build() {
            return new ParserOptions(this);
        }
    }
}
