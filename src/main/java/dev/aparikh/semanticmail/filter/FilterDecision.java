package dev.aparikh.semanticmail.filter;

import dev.aparikh.semanticmail.model.FilterReason;

/**
 * Result of classifying one fetched message. {@code detail} is a human-readable note for
 * logs and is never used for branching.
 */
public record FilterDecision(
        boolean isDuplicate,
        boolean isFiltered,
        FilterReason filterReason,
        String detail
) {
    public static FilterDecision duplicate() {
        return new FilterDecision(true, false, FilterReason.NONE, "duplicate");
    }

    public static FilterDecision kept(String detail) {
        return new FilterDecision(false, false, FilterReason.NONE, detail);
    }

    public static FilterDecision filtered(FilterReason reason, String detail) {
        return new FilterDecision(false, true, reason, detail);
    }

    /** True when the message should go on to chunking and embedding. */
    public boolean isIndexable() {
        return !isDuplicate && !isFiltered;
    }
}
