package com.querycraft.config;

import java.util.Properties;

/**
 * Limits applied while compiling a request.
 *
 * <p>Instances are immutable and shared freely across compilations.
 * {@link #defaults()} matches what the reporting front end expects; a host
 * can override individual values from a {@link Properties} source:
 * <pre>
 *   querycraft.alias.max-length=50
 *   querycraft.in-list.max-size=999
 *   querycraft.limit.max=100000
 * </pre>
 */
public final class CompilerSettings {

    /** Maximum length of a sanitized aggregation alias */
    public static final int DEFAULT_MAX_ALIAS_LENGTH = 50;

    /** Maximum number of bind values in one IN list */
    public static final int DEFAULT_MAX_IN_LIST_SIZE = 999;

    /** Maximum page size a request may ask for */
    public static final int DEFAULT_MAX_LIMIT = 100_000;

    /** Alias used when sanitizing leaves nothing */
    public static final String DEFAULT_FALLBACK_ALIAS = "unnamed_metric";

    private static final CompilerSettings DEFAULTS = new CompilerSettings(
        DEFAULT_MAX_ALIAS_LENGTH, DEFAULT_MAX_IN_LIST_SIZE, DEFAULT_MAX_LIMIT, DEFAULT_FALLBACK_ALIAS);

    private final int maxAliasLength;
    private final int maxInListSize;
    private final int maxLimit;
    private final String fallbackAlias;

    public CompilerSettings(int maxAliasLength, int maxInListSize, int maxLimit, String fallbackAlias) {
        if (maxAliasLength <= 0 || maxInListSize <= 0 || maxLimit <= 0) {
            throw new IllegalArgumentException(String.format(
                "Limits must be positive: maxAliasLength=%d, maxInListSize=%d, maxLimit=%d",
                maxAliasLength, maxInListSize, maxLimit));
        }
        if (fallbackAlias == null || !fallbackAlias.matches("[A-Za-z][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid fallback alias: " + fallbackAlias);
        }
        this.maxAliasLength = maxAliasLength;
        this.maxInListSize = maxInListSize;
        this.maxLimit = maxLimit;
        this.fallbackAlias = fallbackAlias;
    }

    public static CompilerSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Builds settings from properties, falling back to defaults for missing keys.
     *
     * @param properties the property source
     * @return the settings
     * @throws IllegalArgumentException if a value is not a positive integer
     */
    public static CompilerSettings fromProperties(Properties properties) {
        return new CompilerSettings(
            intProperty(properties, "querycraft.alias.max-length", DEFAULT_MAX_ALIAS_LENGTH),
            intProperty(properties, "querycraft.in-list.max-size", DEFAULT_MAX_IN_LIST_SIZE),
            intProperty(properties, "querycraft.limit.max", DEFAULT_MAX_LIMIT),
            properties.getProperty("querycraft.alias.fallback", DEFAULT_FALLBACK_ALIAS));
    }

    public int maxAliasLength() {
        return maxAliasLength;
    }

    public int maxInListSize() {
        return maxInListSize;
    }

    public int maxLimit() {
        return maxLimit;
    }

    public String fallbackAlias() {
        return fallbackAlias;
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer: " + value, e);
        }
    }

    @Override
    public String toString() {
        return String.format("CompilerSettings(maxAliasLength=%d, maxInListSize=%d, maxLimit=%d, fallbackAlias=%s)",
            maxAliasLength, maxInListSize, maxLimit, fallbackAlias);
    }
}
