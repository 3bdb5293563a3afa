package com.codelogickeep.agent.adapter.report;

import com.codelogickeep.agent.adapter.model.CaseResult;
import com.codelogickeep.agent.adapter.model.CaseStatus;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses GoogleTest's {@code --gtest_output=json} report.
 * <p>
 * The document is walked recursively through {@code testsuites}, {@code testsuite},
 * {@code testcases}, {@code tests} and {@code children}. A node is a test case when it
 * carries {@code status}, {@code result} or a {@code failures} list; its name is the dotted
 * path of ancestor names. The walk continues below leaves as well.
 */
@Slf4j
public class GTestJsonReportParser implements ReportParser {
    private static final List<String> CHILD_KEYS = List.of("testsuites", "testsuite", "testcases", "tests", "children");
    private static final Set<String> FAILED = Set.of("failed", "failure", "fail");
    private static final Set<String> SKIPPED = Set.of("skipped", "notrun", "disabled", "pending");
    private static final Set<String> PASSED = Set.of("passed", "run", "ok", "success");
    // GoogleTest keeps status=RUN for skipped tests and reports the skip in "result".
    private static final Set<String> SKIPPED_RESULTS = Set.of("skipped", "suppressed");

    private final ObjectMapper objectMapper;

    public GTestJsonReportParser() {
        this(new ObjectMapper());
    }

    public GTestJsonReportParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public RunResult parse(String reportText, String transcript) {
        RunResult result = new RunResult(transcript);
        if (reportText == null || reportText.isBlank()) {
            return result;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(reportText);
        } catch (JsonProcessingException e) {
            log.debug("gtest JSON report is not valid JSON: {}", e.getOriginalMessage());
            return result;
        }
        if (root == null || !root.isObject()) {
            return result;
        }
        List<CaseResult> cases = new ArrayList<>();
        walk(root, List.of(), cases);
        cases.forEach(result::record);
        return result;
    }

    private void walk(JsonNode node, List<String> parents, List<CaseResult> sink) {
        if (node.isArray()) {
            node.forEach(item -> walk(item, parents, sink));
            return;
        }
        if (!node.isObject()) {
            return;
        }
        List<String> path = parents;
        String name = text(node.get("name"));
        if (!name.isEmpty()) {
            path = new ArrayList<>(parents);
            path.add(name);
        }

        if (looksLikeTestCase(node)) {
            sink.add(toCase(node, path));
        }
        for (String key : CHILD_KEYS) {
            JsonNode child = node.get(key);
            if (child != null) {
                walk(child, path, sink);
            }
        }
    }

    private static boolean looksLikeTestCase(JsonNode node) {
        if (node.has("status") || node.has("result")) {
            return true;
        }
        JsonNode failures = node.get("failures");
        return failures != null && failures.isArray();
    }

    private static CaseResult toCase(JsonNode node, List<String> path) {
        String failure = formatFailures(node.get("failures"));
        String status = text(node.get("status"));
        if (status.isEmpty()) {
            status = text(node.get("result"));
        }
        status = status.toLowerCase(Locale.ROOT);
        String result = text(node.get("result")).toLowerCase(Locale.ROOT);

        CaseStatus caseStatus;
        if (!failure.isEmpty() || FAILED.contains(status)) {
            caseStatus = CaseStatus.FAILED;
        } else if (SKIPPED.contains(status) || SKIPPED_RESULTS.contains(result)) {
            caseStatus = CaseStatus.SKIPPED;
        } else if (PASSED.contains(status)) {
            caseStatus = CaseStatus.PASSED;
        } else {
            caseStatus = CaseStatus.ERROR;
        }

        JsonNode time = node.has("time") ? node.get("time") : node.get("duration");
        String caseName = path.isEmpty() ? "unknown" : String.join(".", path);
        String message = caseStatus == CaseStatus.SKIPPED || caseStatus == CaseStatus.PASSED ? "" : failure;
        return new CaseResult(caseName, caseStatus, Durations.toMillis(time), message, text(node.get("file")));
    }

    private static String formatFailures(JsonNode failures) {
        if (failures == null || !failures.isArray()) {
            return "";
        }
        List<String> messages = new ArrayList<>();
        for (JsonNode entry : failures) {
            if (entry.isTextual()) {
                messages.add(entry.asText());
            } else if (entry.isObject()) {
                for (String key : List.of("failure", "message", "value")) {
                    JsonNode value = entry.get(key);
                    if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                        messages.add(value.asText());
                        break;
                    }
                }
            }
        }
        return String.join("\n", messages);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return "";
        }
        return node.asText();
    }
}
