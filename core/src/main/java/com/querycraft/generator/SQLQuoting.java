package com.querycraft.generator;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utilities for safely quoting SQL identifiers and sanitizing output aliases.
 *
 * <p>Identifiers are upper-cased and double-quoted so they match the
 * database's stored (upper-case) names regardless of the characters they
 * contain. Embedded double quotes are doubled. At most two dot-separated parts
 * are emitted ({@code alias.column}); anything before the last dot becomes the
 * first part.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("orders.amount");     // "ORDERS"."AMOUNT"
 *   SQLQuoting.quoteIdentifier("my \"col\"");        // "MY ""COL"""
 *   SQLQuoting.quoteAlias("orders.Amount");          // "orders.Amount"
 *   SQLQuoting.sanitizeAlias("Revenue (€) - Q1", 50, "unnamed_metric");  // Revenue_______Q1
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private static final Pattern UNSAFE_ALIAS_CHARS = Pattern.compile("[^a-zA-Z0-9_]");
    private static final Pattern NON_WORD = Pattern.compile("\\W");

    private SQLQuoting() {
    }

    /**
     * Quotes a table, column or {@code alias.column} reference.
     *
     * <p>Empty input quotes to {@code ""} rather than failing, so a half-typed
     * column reference never breaks statement assembly.
     *
     * @param identifier the identifier to quote
     * @return the quoted identifier, upper-cased
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.trim().isEmpty()) {
            return "\"\"";
        }
        int dot = identifier.lastIndexOf('.');
        if (dot < 0) {
            return quotePart(identifier);
        }
        String qualifier = identifier.substring(0, dot);
        String name = identifier.substring(dot + 1);
        boolean hasQualifier = !qualifier.trim().isEmpty();
        boolean hasName = !name.trim().isEmpty();
        if (hasQualifier && hasName) {
            return quotePart(qualifier) + "." + quotePart(name);
        }
        if (hasQualifier) {
            return quotePart(qualifier);
        }
        if (hasName) {
            return quotePart(name);
        }
        return "\"\"";
    }

    /**
     * Quotes a qualifier and a name as a two-part reference.
     *
     * @param qualifier the table alias
     * @param name the column name
     * @return e.g. {@code "ORDERS_1"."AMOUNT"}
     */
    public static String quoteQualified(String qualifier, String name) {
        return quotePart(qualifier) + "." + quotePart(name);
    }

    /**
     * Quotes an output alias, keeping its case and any dots.
     *
     * @param alias the alias as the caller should see it
     * @return the quoted alias
     */
    public static String quoteAlias(String alias) {
        return "\"" + (alias == null ? "" : alias.replace("\"", "\"\"")) + "\"";
    }

    /**
     * Sanitizes a user-supplied output alias into a safe token.
     *
     * <p>Every character outside {@code [A-Za-z0-9_]} becomes an underscore,
     * leading and trailing underscores are removed, and the result is truncated
     * to {@code maxLength}. No quote, semicolon or comment delimiter survives.
     *
     * @param alias the requested alias
     * @param maxLength the maximum length of the result
     * @param fallback the token used when nothing is left
     * @return the sanitized alias
     */
    public static String sanitizeAlias(String alias, int maxLength, String fallback) {
        String sanitized = UNSAFE_ALIAS_CHARS.matcher(alias == null ? "" : alias).replaceAll("_");
        sanitized = stripUnderscores(sanitized);
        if (sanitized.length() > maxLength) {
            sanitized = sanitized.substring(0, maxLength);
        }
        return sanitized.isEmpty() ? fallback : sanitized;
    }

    /**
     * Turns a dataset name into a token usable inside a bind parameter name.
     *
     * @param dataset the dataset, e.g. "HR.EMPLOYEES"
     * @return e.g. "HR_EMPLOYEES"
     */
    public static String parameterToken(String dataset) {
        return NON_WORD.matcher(dataset).replaceAll("_");
    }

    private static String quotePart(String part) {
        return "\"" + part.toUpperCase(Locale.ROOT).replace("\"", "\"\"") + "\"";
    }

    private static String stripUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
