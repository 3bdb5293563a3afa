package com.codelogickeep.agent.adapter.report;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Durations Tests")
class DurationsTest {

    @ParameterizedTest(name = "\"{0}\" -> {1} ms")
    @CsvSource({
            "2.5s, 2500",
            "150ms, 150",
            "2.5, 2500",
            "0:01:02.5, 62500",
            "1:00:00, 3600000",
            "' 0.25S ', 250",
            "1:2, 0",
            "1:2:3:4, 0",
            "abc, 0",
            "'', 0",
            "2.5f, 0",
            "2d, 0",
            "NaN, 0",
            "Infinity, 0",
            "0x1p3, 0",
            "1.5e1s, 15000",
            "1:00:2f, 0"
    })
    @DisplayName("string encodings")
    void toMillis_shouldNormalizeStrings(String input, double expected) {
        assertEquals(expected, Durations.toMillis(input), 0.001);
    }

    @Test
    @DisplayName("null and non-numeric JSON become zero")
    void toMillis_shouldTolerateMissingValues() {
        assertEquals(0.0, Durations.toMillis((String) null), 0.001);
        assertEquals(0.0, Durations.toMillis(JsonNodeFactory.instance.booleanNode(true)), 0.001);
        assertEquals(0.0, Durations.toMillis((com.fasterxml.jackson.databind.JsonNode) null), 0.001);
    }

    @Test
    @DisplayName("JSON numbers are seconds")
    void toMillis_shouldTreatJsonNumbersAsSeconds() {
        assertEquals(2500.0, Durations.toMillis(JsonNodeFactory.instance.numberNode(2.5)), 0.001);
        assertEquals(1.0, Durations.toMillis(JsonNodeFactory.instance.textNode("0.001s")), 0.001);
    }

    @Nested
    @DisplayName("TRX")
    class Trx {

        @Test
        @DisplayName("bare numbers below 1000 are seconds")
        void smallBareNumber_shouldBeSeconds() {
            assertEquals(500.0, Durations.trxToMillis("0.5"), 0.001);
            assertEquals(999_000.0, Durations.trxToMillis(999.0), 0.001);
        }

        @Test
        @DisplayName("bare numbers from 1000 up are already milliseconds")
        void largeBareNumber_shouldBeMillis() {
            assertEquals(1500.0, Durations.trxToMillis("1500"), 0.001);
            assertEquals(1000.0, Durations.trxToMillis(1000.0), 0.001);
        }

        @Test
        @DisplayName("float literal suffixes are not numbers")
        void typedLiteral_shouldBeZero() {
            assertEquals(0.0, Durations.trxToMillis("2.5f"), 0.001);
            assertEquals(0.0, Durations.trxToMillis("1500d"), 0.001);
        }

        @Test
        @DisplayName("clock strings use the common rule")
        void clockString_shouldBeParsed() {
            assertEquals(1500.0, Durations.trxToMillis("00:00:01.5"), 0.001);
            assertEquals(10.0, Durations.trxToMillis("00:00:00.0100000"), 0.001);
            assertEquals(0.0, Durations.trxToMillis("00:01"), 0.001);
            assertEquals(0.0, Durations.trxToMillis((String) null), 0.001);
        }
    }
}
