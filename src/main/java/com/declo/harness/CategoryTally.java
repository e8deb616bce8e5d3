package com.declo.harness;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Totals for one check category.
 *
 * @param failures 1-based indices of failing examples, ascending
 */
public record CategoryTally(Category category, int total, ImmutableList<Integer> failures) {

    public int successes() {
        return total - failures.size();
    }

    /** Percentage of passing examples rounded to one decimal place; 0.0 for an empty corpus. */
    public double successRate() {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(successes() * 1000.0 / total) / 10.0;
    }
}
