package dev.aparikh.semanticmail.filter;

import dev.aparikh.semanticmail.model.FilterReason;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate of filter decisions for a batch. Duplicates are not counted.
 */
public record FilterStats(
        int total,
        int filtered,
        int kept,
        Map<FilterReason, Integer> reasons
) {
    public static FilterStats of(Collection<FilterDecision> decisions) {
        int total = 0;
        int filtered = 0;
        Map<FilterReason, Integer> reasons = new EnumMap<>(FilterReason.class);
        for (FilterDecision d : decisions) {
            if (d.isDuplicate()) continue;
            total++;
            if (d.isFiltered()) {
                filtered++;
                reasons.merge(d.filterReason(), 1, Integer::sum);
            }
        }
        return new FilterStats(total, filtered, total - filtered, Map.copyOf(reasons));
    }

    public double filterRate() {
        return total == 0 ? 0 : (filtered * 100.0) / total;
    }
}
