package com.querycraft.generator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Issues bind parameter names for one compilation and collects their values.
 *
 * <p>A single counter is shared by every prefix, so names never repeat within
 * a compilation, including across derived sources and the outer statement:
 * <pre>
 *   ParamGenerator params = new ParamGenerator();
 *   params.add("part_EMP", 202601);   // :part_EMP_1
 *   params.add("p", "%JO%");          // :p_2
 * </pre>
 *
 * <p>Not thread-safe; create one per compilation.
 */
public class ParamGenerator {

    /** Prefix for filter values */
    public static final String DEFAULT_PREFIX = "p";

    private final Map<String, Object> params = new LinkedHashMap<>();
    private int counter;

    public ParamGenerator() {
        this(1);
    }

    public ParamGenerator(int startCounter) {
        this.counter = startCounter;
    }

    /**
     * A generated parameter.
     *
     * @param name the parameter name, e.g. "p_3"
     * @param placeholder the placeholder to put in SQL text, e.g. ":p_3"
     */
    public record Param(String name, String placeholder) {
    }

    /**
     * Reserves the next parameter name without binding a value.
     *
     * @param prefix the name prefix
     * @return the parameter
     */
    public Param next(String prefix) {
        String name = prefix + "_" + counter;
        counter++;
        return new Param(name, ":" + name);
    }

    /**
     * Reserves the next parameter name and binds a value to it.
     *
     * @param prefix the name prefix
     * @param value the bound value
     * @return the placeholder to put in SQL text
     */
    public String add(String prefix, Object value) {
        Param param = next(prefix);
        params.put(param.name(), value);
        return param.placeholder();
    }

    /**
     * Binds a filter value under the default prefix.
     *
     * @param value the bound value
     * @return the placeholder
     */
    public String add(Object value) {
        return add(DEFAULT_PREFIX, value);
    }

    /**
     * Returns the bound values in generation order.
     *
     * @return an unmodifiable view of name to value
     */
    public Map<String, Object> params() {
        return Collections.unmodifiableMap(params);
    }

    public int size() {
        return params.size();
    }
}
