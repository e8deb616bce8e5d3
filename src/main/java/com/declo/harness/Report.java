package com.declo.harness;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Per-category tallies over a corpus run, plus the individual example results.
 */
public record Report(ImmutableList<ExampleResult> results, ImmutableMap<Category, CategoryTally> tallies) {

    /** Tallies results that are already in corpus order. */
    public static Report of(ImmutableList<ExampleResult> results) {
        MutableMap<Category, CategoryTally> tallies = Maps.mutable.empty();
        for (Category category : Category.values()) {
            ImmutableList<Integer> failures = results
                    .reject(result -> result.passed(category))
                    .collect(ExampleResult::index);
            tallies.put(category, new CategoryTally(category, results.size(), failures));
        }
        return new Report(results, tallies.toImmutable());
    }

    public CategoryTally tally(Category category) {
        return tallies.get(category);
    }

    public int total() {
        return results.size();
    }

    public boolean allPassed() {
        return results.allSatisfy(ExampleResult::allPassed);
    }
}
