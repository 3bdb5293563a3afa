package com.codelogickeep.agent.adapter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated result of one test run, or of a merge of several partial runs.
 * <p>
 * Counters only move through {@link #record(CaseResult)}, {@link #addCounts} and
 * {@link #addErrors(int)}, so {@code total == passed + failed + skipped + errors}
 * holds by construction. {@link #isSuccess()} is always computed from the counters.
 * Adapters {@link #freeze()} the result before handing it to a caller.
 */
@JsonPropertyOrder({"success", "total", "passed", "failed", "skipped", "errors", "durationMs", "testCases", "coverage", "rawOutput"})
public class RunResult {
    private int passed;
    private int failed;
    private int skipped;
    private int errors;
    private double durationMs;
    private String rawOutput;
    private final List<CaseResult> testCases = new ArrayList<>();
    private CoverageReport coverage;
    private boolean frozen;

    public RunResult() {
        this("");
    }

    public RunResult(String rawOutput) {
        this.rawOutput = rawOutput != null ? rawOutput : "";
    }

    /**
     * An empty result carrying only the diagnostic transcript. Always unsuccessful.
     */
    public static RunResult failure(String rawOutput) {
        return new RunResult(rawOutput);
    }

    public void record(CaseResult testCase) {
        checkMutable();
        switch (testCase.status()) {
            case PASSED -> passed++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
            case ERROR -> errors++;
        }
        durationMs += testCase.durationMs();
        testCases.add(testCase);
    }

    /**
     * Adds counts that are known only as totals, e.g. from a console summary line.
     */
    public void addCounts(int passed, int failed, int skipped, int errors) {
        checkMutable();
        if (passed < 0 || failed < 0 || skipped < 0 || errors < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        this.passed += passed;
        this.failed += failed;
        this.skipped += skipped;
        this.errors += errors;
    }

    public void addErrors(int count) {
        addCounts(0, 0, 0, count);
    }

    public void addDuration(double millis) {
        checkMutable();
        this.durationMs += millis;
    }

    public void setDurationMs(double durationMs) {
        checkMutable();
        this.durationMs = durationMs;
    }

    public void setRawOutput(String rawOutput) {
        checkMutable();
        this.rawOutput = rawOutput != null ? rawOutput : "";
    }

    public void setCoverage(CoverageReport coverage) {
        checkMutable();
        this.coverage = coverage;
    }

    /**
     * Makes this result read-only. Idempotent.
     */
    public RunResult freeze() {
        this.frozen = true;
        return this;
    }

    @JsonIgnore
    public boolean isFrozen() {
        return frozen;
    }

    public int getPassed() {
        return passed;
    }

    public int getFailed() {
        return failed;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getErrors() {
        return errors;
    }

    public int getTotal() {
        return passed + failed + skipped + errors;
    }

    public double getDurationMs() {
        return durationMs;
    }

    public String getRawOutput() {
        return rawOutput;
    }

    public List<CaseResult> getTestCases() {
        return Collections.unmodifiableList(testCases);
    }

    public CoverageReport getCoverage() {
        return coverage;
    }

    /**
     * Zero executed cases is a failure regardless of the other counters.
     */
    public boolean isSuccess() {
        return failed == 0 && errors == 0 && getTotal() > 0;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("RunResult is frozen and can no longer be modified");
        }
    }

    @Override
    public String toString() {
        return String.format("RunResult[success=%s, total=%d, passed=%d, failed=%d, skipped=%d, errors=%d, duration=%.1fms]",
                isSuccess(), getTotal(), passed, failed, skipped, errors, durationMs);
    }
}
