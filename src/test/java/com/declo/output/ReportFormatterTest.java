package com.declo.output;

import com.declo.harness.Category;
import com.declo.harness.CheckResult;
import com.declo.harness.ExampleResult;
import com.declo.harness.Report;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ReportFormatterTest {

    private static ExampleResult result(int index, boolean compiles, boolean decompiles, boolean roundtrips) {
        ImmutableList<CheckResult> checks = Lists.immutable.of(
                compiles ? CheckResult.pass(Category.COMPILATION) : CheckResult.fail(Category.COMPILATION, "c"),
                decompiles ? CheckResult.pass(Category.DECOMPILATION) : CheckResult.fail(Category.DECOMPILATION, "d"),
                roundtrips ? CheckResult.pass(Category.ROUNDTRIP) : CheckResult.fail(Category.ROUNDTRIP, "r"));
        return new ExampleResult(index, "Example " + index, "[x for x in xs]", "xs", checks);
    }

    @Test
    public void testSummaryTable() {
        Report report = Report.of(Lists.immutable.of(result(1, true, true, true), result(2, true, true, false)));
        String summary = new ReportFormatter(false).formatSummary(report);

        String[] lines = summary.split("\\R");
        assertEquals(5, lines.length);
        assertTrue(lines[0].startsWith("Check"));
        assertTrue(lines[1].startsWith("Total examples"));
        assertTrue(lines[1].contains(" 2"));
        assertTrue(lines[2].startsWith("Compilation"));
        assertTrue(lines[2].contains("100.0%"));
        assertTrue(lines[4].startsWith("Roundtrip"));
        assertTrue(lines[4].contains("50.0%"));
        assertTrue(lines[4].endsWith("2"));
        assertFalse(summary.contains("\u001B["));
    }

    @Test
    public void testExampleDetailsAndColor() {
        String plain = new ReportFormatter(false).formatExample(result(3, true, true, false));
        assertTrue(plain.startsWith("Example 3: Example 3\n"));
        assertTrue(plain.contains("  compiled:   [x for x in xs]\n"));
        assertTrue(plain.contains("  PASS Compilation\n"));
        assertTrue(plain.contains("  FAIL Roundtrip: r\n"));

        String colored = new ReportFormatter(true).formatExample(result(3, true, true, false));
        assertTrue(colored.contains("\u001B[31mFAIL\u001B[0m"));
    }

    @Test
    public void testTitles() {
        assertEquals("  1  a\n  2  b\n", new ReportFormatter(false).formatTitles(Lists.immutable.of("a", "b"))
                .replace(System.lineSeparator(), "\n"));
    }
}
