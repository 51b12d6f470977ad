package com.querycraft.planner;

import com.querycraft.filter.LogicalGroup;
import com.querycraft.planner.DatasetAliases.Occurrence;

import java.util.Collections;
import java.util.Map;

/**
 * A filter tree split into per-occurrence pushed filters and the remaining global filter.
 *
 * @param pushed filters to apply inside each occurrence's derived source
 * @param remaining the filter left for the outer WHERE/HAVING (null if everything was pushed)
 */
public record PushdownPlan(Map<Occurrence, LogicalGroup> pushed, LogicalGroup remaining) {

    public static final PushdownPlan NONE = new PushdownPlan(Map.of(), null);

    public PushdownPlan {
        pushed = Collections.unmodifiableMap(pushed);
    }

    /**
     * Returns the filter pushed into an occurrence.
     *
     * @param occurrence the occurrence
     * @return the pushed group, or null if nothing was pushed
     */
    public LogicalGroup pushedTo(Occurrence occurrence) {
        return pushed.get(occurrence);
    }

    /**
     * Returns how many conditions were pushed into an occurrence.
     *
     * @param occurrence the occurrence
     * @return the pushed leaf count
     */
    public int weightOf(Occurrence occurrence) {
        LogicalGroup group = pushed.get(occurrence);
        return group == null ? 0 : group.leafCount();
    }
}
