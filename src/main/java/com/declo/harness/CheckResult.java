package com.declo.harness;

/**
 * Outcome of one check on one example.
 *
 * @param reason why the check failed, or null when it passed
 */
public record CheckResult(Category category, boolean passed, String reason) {

    public static CheckResult pass(Category category) {
        return new CheckResult(category, true, null);
    }

    public static CheckResult fail(Category category, String reason) {
        return new CheckResult(category, false, reason);
    }
}
