package com.declo.output;

import com.declo.harness.Category;
import com.declo.harness.CategoryTally;
import com.declo.harness.CheckResult;
import com.declo.harness.ExampleResult;
import com.declo.harness.Report;

import java.util.Locale;

/**
 * Plain-text projection of a {@link Report}.
 */
public class ReportFormatter {
    private final boolean colorOutput;

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    public ReportFormatter(boolean colorOutput) {
        this.colorOutput = colorOutput;
    }

    public String formatSummary(Report report) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-16s %7s %11s  %s%n", "Check", "Passed", "Success", "Failing examples"));
        sb.append(String.format(Locale.ROOT, "%-16s %7d %11s%n", "Total examples", report.total(), ""));
        for (Category category : Category.values()) {
            CategoryTally tally = report.tally(category);
            String rate = String.format(Locale.ROOT, "%.1f%%", tally.successRate());
            String failing = tally.failures().isEmpty() ? "-" : tally.failures().makeString(", ");
            sb.append(String.format(Locale.ROOT, "%-16s %7d %11s  %s%n",
                    category.label(), tally.successes(), paint(rate, tally.failures().isEmpty()), failing));
        }
        return sb.toString();
    }

    public String formatExample(ExampleResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Example ").append(result.index()).append(": ").append(result.title()).append('\n');
        if (result.compiled() != null) {
            sb.append("  compiled:   ").append(result.compiled()).append('\n');
        }
        if (result.decompiled() != null) {
            sb.append("  decompiled: ").append(result.decompiled()).append('\n');
        }
        for (CheckResult check : result.checks()) {
            sb.append("  ")
              .append(paint(check.passed() ? "PASS" : "FAIL", check.passed()))
              .append(' ')
              .append(check.category().label());
            if (!check.passed()) {
                sb.append(": ").append(check.reason());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String formatTitles(Iterable<String> titles) {
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (String title : titles) {
            sb.append(String.format(Locale.ROOT, "%3d  %s%n", index++, title));
        }
        return sb.toString();
    }

    private String paint(String text, boolean good) {
        if (!colorOutput) {
            return text;
        }
        return (good ? GREEN : RED) + text + RESET;
    }
}
