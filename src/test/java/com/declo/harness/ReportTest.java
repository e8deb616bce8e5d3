package com.declo.harness;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ReportTest {

    private static ExampleResult result(int index, boolean compiles, boolean decompiles, boolean roundtrips) {
        ImmutableList<CheckResult> checks = Lists.immutable.of(
                compiles ? CheckResult.pass(Category.COMPILATION) : CheckResult.fail(Category.COMPILATION, "c"),
                decompiles ? CheckResult.pass(Category.DECOMPILATION) : CheckResult.fail(Category.DECOMPILATION, "d"),
                roundtrips ? CheckResult.pass(Category.ROUNDTRIP) : CheckResult.fail(Category.ROUNDTRIP, "r"));
        return new ExampleResult(index, "Example " + index, "[x for x in xs]", "xs", checks);
    }

    @Test
    public void testTalliesKeepFailingIndicesInOrder() {
        Report report = Report.of(Lists.immutable.of(
                result(1, true, true, true),
                result(2, false, true, false),
                result(3, true, true, true),
                result(4, false, true, true)));

        CategoryTally compilation = report.tally(Category.COMPILATION);
        assertEquals(4, compilation.total());
        assertEquals(2, compilation.successes());
        assertEquals(Lists.immutable.of(2, 4), compilation.failures());
        assertEquals(50.0, compilation.successRate());
        assertEquals(75.0, report.tally(Category.ROUNDTRIP).successRate());
        assertEquals(100.0, report.tally(Category.DECOMPILATION).successRate());
    }

    @Test
    public void testRateRoundsToOneDecimal() {
        assertEquals(85.7, new CategoryTally(Category.ROUNDTRIP, 7, Lists.immutable.of(3)).successRate());
        assertEquals(0.0, new CategoryTally(Category.ROUNDTRIP, 0, Lists.immutable.empty()).successRate());
        assertEquals(0.0, new CategoryTally(Category.ROUNDTRIP, 1, Lists.immutable.of(1)).successRate());
    }

    @Test
    public void testMissingCheckIsAnError() {
        ExampleResult partial = new ExampleResult(1, "t", null, null,
                Lists.immutable.of(CheckResult.pass(Category.COMPILATION)));
        assertThrows(IllegalArgumentException.class, () -> partial.check(Category.ROUNDTRIP));
    }
}
