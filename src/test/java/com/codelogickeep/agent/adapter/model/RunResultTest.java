package com.codelogickeep.agent.adapter.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunResult Tests")
class RunResultTest {

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("record should count each status and sum durations")
        void record_shouldCountStatuses() {
            RunResult result = new RunResult();
            result.record(CaseResult.passed("a", 10));
            result.record(CaseResult.failed("b", 5, "boom"));
            result.record(new CaseResult("c", CaseStatus.SKIPPED, 0, null, null));
            result.record(new CaseResult("d", CaseStatus.ERROR, 1, "crash", null));

            assertEquals(1, result.getPassed());
            assertEquals(1, result.getFailed());
            assertEquals(1, result.getSkipped());
            assertEquals(1, result.getErrors());
            assertEquals(4, result.getTotal());
            assertEquals(16.0, result.getDurationMs(), 0.001);
            assertEquals(4, result.getTestCases().size());
        }

        @Test
        @DisplayName("negative counts should be rejected")
        void addCounts_shouldRejectNegative() {
            RunResult result = new RunResult();
            assertThrows(IllegalArgumentException.class, () -> result.addCounts(-1, 0, 0, 0));
        }
    }

    @Nested
    @DisplayName("Success")
    class Success {

        @Test
        @DisplayName("empty result is never successful")
        void emptyResult_shouldNotBeSuccessful() {
            assertFalse(new RunResult().isSuccess());
            assertFalse(RunResult.failure("nothing ran").isSuccess());
        }

        @Test
        @DisplayName("only skipped cases count as success")
        void skippedOnly_shouldBeSuccessful() {
            RunResult result = new RunResult();
            result.addCounts(0, 0, 2, 0);
            assertTrue(result.isSuccess());
        }

        @Test
        @DisplayName("any error makes the run unsuccessful")
        void error_shouldFailRun() {
            RunResult result = new RunResult();
            result.addCounts(3, 0, 0, 0);
            result.addErrors(1);
            assertFalse(result.isSuccess());
        }
    }

    @Nested
    @DisplayName("Freezing")
    class Freezing {

        @Test
        @DisplayName("frozen result should reject mutation")
        void frozen_shouldRejectMutation() {
            RunResult result = new RunResult().freeze();

            assertTrue(result.isFrozen());
            assertThrows(IllegalStateException.class, () -> result.addErrors(1));
            assertThrows(IllegalStateException.class, () -> result.record(CaseResult.passed("a", 1)));
            assertThrows(IllegalStateException.class, () -> result.setRawOutput("x"));
        }

        @Test
        @DisplayName("test case list should be read-only")
        void testCases_shouldBeUnmodifiable() {
            RunResult result = new RunResult();
            result.record(CaseResult.passed("a", 1));
            assertThrows(UnsupportedOperationException.class,
                    () -> result.getTestCases().add(CaseResult.passed("b", 1)));
        }
    }

    @Test
    @DisplayName("CaseResult should normalize nulls")
    void caseResult_shouldNormalizeNulls() {
        CaseResult testCase = new CaseResult(null, null, 0, null, null);

        assertEquals("unknown", testCase.name());
        assertEquals(CaseStatus.ERROR, testCase.status());
        assertEquals("", testCase.failureMessage());
        assertEquals("", testCase.filePath());
        assertTrue(testCase.isFailure());
    }

    @Test
    @DisplayName("coverage report should merge files and compute percentages")
    void coverageReport_shouldComputePercentages() {
        CoverageReport report = new CoverageReport();
        assertEquals(100.0, report.getOverallLineCoverage(), 0.001);

        report.addFile(new CoverageReport.FileCoverage("a/Calc.java", 3, 1, 1, 1));
        report.addFile(new CoverageReport.FileCoverage("a/Calc.java", 1, 3, 0, 0));
        report.addFile(new CoverageReport.FileCoverage("a/Other.java", 2, 0, 0, 0));

        assertEquals(2, report.getFiles().size());
        assertEquals(60.0, report.getOverallLineCoverage(), 0.001);
        assertEquals(50.0, report.getOverallBranchCoverage(), 0.001);
        assertEquals(50.0, report.getFiles().get("a/Calc.java").lineCoverage(), 0.001);
    }
}
