package com.codelogickeep.agent.adapter.report;

import com.codelogickeep.agent.adapter.model.CaseResult;
import com.codelogickeep.agent.adapter.model.CaseStatus;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Parses pytest-json-report output. The JSON object may be surrounded by banners or
 * warnings when it was captured from stdout; the first balanced object is used.
 */
@Slf4j
public class PytestJsonReportParser implements ReportParser {
    private final ObjectMapper objectMapper;

    public PytestJsonReportParser() {
        this(new ObjectMapper());
    }

    public PytestJsonReportParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public RunResult parse(String reportText, String transcript) {
        RunResult result = new RunResult(transcript);
        Optional<String> json = JsonObjectExtractor.firstObject(reportText);
        if (json.isEmpty()) {
            log.debug("No JSON object found in pytest output");
            return result;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json.get());
        } catch (JsonProcessingException e) {
            log.debug("pytest JSON report could not be parsed: {}", e.getOriginalMessage());
            return result;
        }

        JsonNode tests = root.path("tests");
        if (tests.isArray()) {
            for (JsonNode test : tests) {
                result.record(toCase(test));
            }
        }
        JsonNode duration = root.get("duration");
        if (duration != null && duration.isNumber()) {
            result.setDurationMs(Durations.toMillis(duration.asDouble()));
        }
        return result;
    }

    private static CaseResult toCase(JsonNode test) {
        String nodeId = test.path("nodeid").asText("unknown");
        CaseStatus status = mapOutcome(test.path("outcome").asText("error"));

        JsonNode call = test.path("call");
        double seconds = test.path("duration").asDouble(0.0);
        if (seconds == 0.0) {
            seconds = call.path("duration").asDouble(0.0);
        }

        String failure = "";
        if (status == CaseStatus.FAILED || status == CaseStatus.ERROR) {
            JsonNode longrepr = call.get("longrepr");
            if (longrepr != null && longrepr.isTextual()) {
                failure = longrepr.asText();
            }
            if (failure.isEmpty() && call.path("crash").isObject()) {
                failure = call.path("crash").path("message").asText("");
            }
        }

        int separator = nodeId.indexOf("::");
        String filePath = separator >= 0 ? nodeId.substring(0, separator) : "";
        return new CaseResult(nodeId, status, Durations.toMillis(seconds), failure, filePath);
    }

    static CaseStatus mapOutcome(String outcome) {
        return switch (outcome) {
            case "passed", "xpassed" -> CaseStatus.PASSED;
            case "failed" -> CaseStatus.FAILED;
            case "skipped", "xfailed" -> CaseStatus.SKIPPED;
            default -> CaseStatus.ERROR;
        };
    }
}
