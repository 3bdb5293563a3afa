package com.codelogickeep.agent.adapter.report;

import com.codelogickeep.agent.adapter.model.RunResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Catch2ConsoleSummaryParser Tests")
class Catch2ConsoleSummaryParserTest {

    private final Catch2ConsoleSummaryParser parser = new Catch2ConsoleSummaryParser();

    @Test
    @DisplayName("all-passed banner should count the test cases")
    void parse_allPassed() {
        RunResult result = parser.parse("===\nAll tests passed (12 assertions in 3 test cases)\n", "");

        assertEquals(3, result.getPassed());
        assertTrue(result.isSuccess());
        assertTrue(result.getTestCases().isEmpty());
    }

    @Test
    @DisplayName("summary line should count failures and unaccounted cases")
    void parse_summaryLine() {
        RunResult result = parser.parse("test cases: 5 | 2 passed | 1 failed | 1 skipped\nassertions: 9 | 7 passed | 2 failed", "");

        assertEquals(2, result.getPassed());
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getSkipped());
        assertEquals(1, result.getErrors());
        assertFalse(result.isSuccess());
    }

    @Test
    @DisplayName("unrelated output should produce nothing")
    void parse_unrelated() {
        assertEquals(0, parser.parse("Segmentation fault", "").getTotal());
    }
}
