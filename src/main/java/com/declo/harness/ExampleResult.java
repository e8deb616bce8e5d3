package com.declo.harness;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Every check run against one example.
 *
 * @param index      1-based position in the corpus
 * @param compiled   comprehension text produced from the chain, or null if compilation failed
 * @param decompiled chain text produced from the comprehension, or null if decompilation failed
 */
public record ExampleResult(int index, String title, String compiled, String decompiled,
                            ImmutableList<CheckResult> checks) {

    public CheckResult check(Category category) {
        CheckResult result = checks.detect(check -> check.category() == category);
        if (result == null) {
            throw new IllegalArgumentException("No " + category.label() + " check recorded for example " + index);
        }
        return result;
    }

    public boolean passed(Category category) {
        return check(category).passed();
    }

    public boolean allPassed() {
        return checks.allSatisfy(CheckResult::passed);
    }
}
