package com.benchy.queryplan.config;

import java.util.Locale;

/**
 * Interchange form of an encoded plan.
 *
 * <ul>
 *   <li>{@code JSON} (default) - nested {@code {_label, _attrs, _children}} objects</li>
 *   <li>{@code XML} - one element per node, same attributes and children</li>
 * </ul>
 */
public enum PlanFormat {
    JSON,
    XML;

    /**
     * Parse a format string (case-insensitive).
     *
     * @param value "json" or "xml"; null selects JSON
     * @return the parsed PlanFormat
     * @throws IllegalArgumentException if value is not recognized
     */
    public static PlanFormat parse(String value) {
        if (value == null) {
            return JSON;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "xml" -> XML;
            default -> throw new IllegalArgumentException(
                "Unknown plan format: '" + value + "'. Expected json or xml");
        };
    }
}
