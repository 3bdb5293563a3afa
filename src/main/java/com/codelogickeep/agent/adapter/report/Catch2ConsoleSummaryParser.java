package com.codelogickeep.agent.adapter.report;

import com.codelogickeep.agent.adapter.model.RunResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the plain-text totals Catch2 prints when no JUnit report was written.
 * Only counts are recovered; there are no per-case entries.
 */
public class Catch2ConsoleSummaryParser implements ReportParser {
    private static final Pattern ALL_PASSED = Pattern.compile(
            "All tests passed \\(\\d+ assertions? in (?<cases>\\d+) test cases?\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUMMARY = Pattern.compile(
            "test cases:\\s*(?<total>\\d+)\\s*\\|\\s*(?<passed>\\d+)\\s*passed\\s*\\|\\s*"
                    + "(?<failed>\\d+)\\s*failed(?:\\s*\\|\\s*(?<skipped>\\d+)\\s*skipped)?",
            Pattern.CASE_INSENSITIVE);

    @Override
    public RunResult parse(String reportText, String transcript) {
        RunResult result = new RunResult(transcript);
        if (reportText == null || reportText.isEmpty()) {
            return result;
        }
        Matcher allPassed = ALL_PASSED.matcher(reportText);
        if (allPassed.find()) {
            result.addCounts(parseCount(allPassed.group("cases")), 0, 0, 0);
            return result;
        }
        Matcher summary = SUMMARY.matcher(reportText);
        if (!summary.find()) {
            return result;
        }
        int passed = parseCount(summary.group("passed"));
        int failed = parseCount(summary.group("failed"));
        int skipped = summary.group("skipped") != null ? parseCount(summary.group("skipped")) : 0;
        int total = parseCount(summary.group("total"));
        // Cases Catch2 counted but did not classify, e.g. aborted ones.
        int unaccounted = Math.max(0, total - passed - failed - skipped);
        result.addCounts(passed, failed, skipped, unaccounted);
        return result;
    }

    private static int parseCount(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
