package com.codelogickeep.agent.adapter.report;

import com.codelogickeep.agent.adapter.model.CaseResult;
import com.codelogickeep.agent.adapter.model.CaseStatus;
import com.codelogickeep.agent.adapter.model.RunResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PytestJsonReportParser Tests")
class PytestJsonReportParserTest {

    private static final String REPORT = "{\"created\": 1.0, \"duration\": 0.5, \"exitcode\": 1, \"root\": \"/p\","
            + " \"summary\": {\"passed\": 1, \"failed\": 1, \"total\": 3},"
            + " \"tests\": ["
            + "{\"nodeid\": \"tests/test_calc.py::test_add\", \"outcome\": \"passed\", \"call\": {\"duration\": 0.01}},"
            + "{\"nodeid\": \"tests/test_calc.py::test_div\", \"outcome\": \"failed\","
            + " \"call\": {\"duration\": 0.02, \"longrepr\": \"assert 1 == 2 }\"}},"
            + "{\"nodeid\": \"tests/test_calc.py::test_big\", \"outcome\": \"xfailed\","
            + " \"call\": {\"duration\": 0.0, \"crash\": {\"message\": \"expected\"}}}"
            + "]}";

    private final PytestJsonReportParser parser = new PytestJsonReportParser();

    @Test
    @DisplayName("should map outcomes and root duration")
    void parse_shouldMapOutcomes() {
        RunResult result = parser.parse(REPORT, "");

        assertEquals(1, result.getPassed());
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getSkipped());
        assertEquals(500.0, result.getDurationMs(), 0.001);

        CaseResult failed = result.getTestCases().get(1);
        assertEquals("tests/test_calc.py::test_div", failed.name());
        assertEquals("tests/test_calc.py", failed.filePath());
        assertEquals("assert 1 == 2 }", failed.failureMessage());
        assertEquals(20.0, failed.durationMs(), 0.001);
    }

    @Test
    @DisplayName("banner-wrapped output should give the same counts as the bare report")
    void parse_bannerWrappedOutput() {
        String stdout = "============ test session starts ============\n"
                + REPORT + "\n"
                + "==== 1 failed, 1 passed in 0.50s ==== }\n";

        RunResult bare = parser.parse(REPORT, "");
        RunResult wrapped = parser.parse(stdout, "");

        assertEquals(bare.getTotal(), wrapped.getTotal());
        assertEquals(bare.getFailed(), wrapped.getFailed());
        assertEquals(bare.getDurationMs(), wrapped.getDurationMs(), 0.001);
    }

    @Test
    @DisplayName("output without JSON should produce an empty result")
    void parse_noJson() {
        RunResult result = parser.parse("ERROR: usage: pytest [options]", "raw");

        assertEquals(0, result.getTotal());
        assertFalse(result.isSuccess());
    }

    @Test
    @DisplayName("outcome mapping table")
    void mapOutcome_table() {
        assertEquals(CaseStatus.PASSED, PytestJsonReportParser.mapOutcome("xpassed"));
        assertEquals(CaseStatus.SKIPPED, PytestJsonReportParser.mapOutcome("skipped"));
        assertEquals(CaseStatus.ERROR, PytestJsonReportParser.mapOutcome("error"));
        assertEquals(CaseStatus.ERROR, PytestJsonReportParser.mapOutcome("rerun"));
    }
}
