package com.codelogickeep.agent.adapter.report;

import com.codelogickeep.agent.adapter.model.CaseResult;
import com.codelogickeep.agent.adapter.model.CaseStatus;
import com.codelogickeep.agent.adapter.model.RunResult;
import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Parses Visual Studio TRX reports written by {@code dotnet test --logger trx}.
 * <p>
 * Elements are matched by local name, so the TeamTest namespace is optional.
 * {@code Failed} and {@code Error} outcomes both map to {@link CaseStatus#FAILED}.
 */
@Slf4j
public class TrxReportParser implements ReportParser {

    @Override
    public RunResult parse(String reportText, String transcript) {
        RunResult result = new RunResult(transcript);
        if (reportText == null || reportText.isBlank()) {
            return result;
        }
        XMLStreamReader reader = null;
        try {
            reader = XmlInputs.open(reportText);
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT
                        && "UnitTestResult".equals(reader.getLocalName())) {
                    result.record(readResult(reader));
                }
            }
        } catch (XMLStreamException | RuntimeException e) {
            log.debug("Stopped reading TRX after {} results: {}", result.getTotal(), e.getMessage());
        } finally {
            XmlInputs.closeQuietly(reader);
        }
        return result;
    }

    private CaseResult readResult(XMLStreamReader reader) throws XMLStreamException {
        String testName = XmlInputs.attribute(reader, "testName");
        String outcome = XmlInputs.attribute(reader, "outcome");
        String computerName = XmlInputs.attribute(reader, "computerName");
        double durationMs = Durations.trxToMillis(XmlInputs.attribute(reader, "duration"));

        String errorMessage = null;
        String stackTrace = null;
        String directMessage = null;
        boolean inErrorInfo = false;
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                String element = reader.getLocalName();
                depth++;
                if ("ErrorInfo".equals(element)) {
                    inErrorInfo = true;
                } else if ("Message".equals(element)) {
                    String text = reader.getElementText().strip();
                    depth--;
                    if (inErrorInfo && errorMessage == null && !text.isEmpty()) {
                        errorMessage = text;
                    } else if (depth == 1 && directMessage == null && !text.isEmpty()) {
                        directMessage = text;
                    }
                } else if ("StackTrace".equals(element)) {
                    String text = reader.getElementText().strip();
                    depth--;
                    if (inErrorInfo && stackTrace == null && !text.isEmpty()) {
                        stackTrace = text;
                    }
                }
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
                if ("ErrorInfo".equals(reader.getLocalName())) {
                    inErrorInfo = false;
                }
            }
        }

        CaseStatus status = mapOutcome(outcome);
        String message = firstNonNull(errorMessage, stackTrace, directMessage);
        return new CaseResult(testName != null ? testName : "unknown", status, durationMs,
                status == CaseStatus.PASSED || status == CaseStatus.SKIPPED ? "" : message, computerName);
    }

    static CaseStatus mapOutcome(String outcome) {
        String value = outcome != null ? outcome.strip() : "";
        return switch (value) {
            case "Passed" -> CaseStatus.PASSED;
            case "Failed", "Error" -> CaseStatus.FAILED;
            case "NotExecuted", "Skipped", "Ignored" -> CaseStatus.SKIPPED;
            default -> CaseStatus.ERROR;
        };
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return "";
    }
}
