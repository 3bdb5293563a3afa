package com.codelogickeep.agent.adapter.aggregate;

import com.codelogickeep.agent.adapter.model.CaseResult;
import com.codelogickeep.agent.adapter.model.RunResult;

import java.util.List;

/**
 * Combines partial results from several binaries or report files into one.
 * Counts and durations are summed, cases appended in merge order. Success is never
 * stored, so it is recomputed from the merged counters.
 */
public final class ResultAggregator {

    private ResultAggregator() {
    }

    /**
     * Folds {@code source} into {@code target}. Counts that {@code source} only knows as totals,
     * such as a console summary without case entries, are carried over as totals.
     */
    public static void merge(RunResult target, RunResult source) {
        // Snapshot first: target and source may be the same result.
        List<CaseResult> cases = List.copyOf(source.getTestCases());
        int passed = source.getPassed();
        int failed = source.getFailed();
        int skipped = source.getSkipped();
        int errors = source.getErrors();
        double durationMs = source.getDurationMs();

        int casePassed = 0;
        int caseFailed = 0;
        int caseSkipped = 0;
        int caseErrors = 0;
        double caseDuration = 0.0;
        for (CaseResult testCase : cases) {
            target.record(testCase);
            caseDuration += testCase.durationMs();
            switch (testCase.status()) {
                case PASSED -> casePassed++;
                case FAILED -> caseFailed++;
                case SKIPPED -> caseSkipped++;
                case ERROR -> caseErrors++;
            }
        }
        target.addCounts(
                Math.max(0, passed - casePassed),
                Math.max(0, failed - caseFailed),
                Math.max(0, skipped - caseSkipped),
                Math.max(0, errors - caseErrors));
        target.addDuration(durationMs - caseDuration);
    }

    /**
     * Merges every part into a fresh result carrying {@code rawOutput}.
     */
    public static RunResult mergeAll(List<RunResult> parts, String rawOutput) {
        RunResult merged = new RunResult(rawOutput);
        for (RunResult part : parts) {
            merge(merged, part);
        }
        return merged;
    }
}
