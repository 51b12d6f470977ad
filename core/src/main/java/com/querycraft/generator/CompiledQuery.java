package com.querycraft.generator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A parameterized SQL statement and its bind values.
 *
 * @param sql the statement, with {@code :name} placeholders
 * @param params placeholder name (without colon) to bound value, in order of appearance
 */
public record CompiledQuery(String sql, Map<String, Object> params) {

    public CompiledQuery {
        Objects.requireNonNull(sql, "sql must not be null");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
