package com.codelogickeep.agent.adapter.report;

import com.codelogickeep.agent.adapter.model.CaseResult;
import com.codelogickeep.agent.adapter.model.CaseStatus;
import com.codelogickeep.agent.adapter.model.RunResult;
import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Streaming parser for JUnit-style XML reports.
 * <p>
 * Each {@code <testcase>} becomes one {@link CaseResult}, wherever it is nested. Status
 * precedence is failure, then error, then skip, then pass. When the document is truncated
 * the cases completed before the break are kept; garbage input yields an empty result.
 */
@Slf4j
public class JUnitXmlReportParser implements ReportParser {
    private final JUnitXmlDialect dialect;

    public JUnitXmlReportParser(JUnitXmlDialect dialect) {
        this.dialect = dialect;
    }

    public JUnitXmlDialect getDialect() {
        return dialect;
    }

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
                if (reader.next() == XMLStreamConstants.START_ELEMENT && "testcase".equals(reader.getLocalName())) {
                    result.record(readTestCase(reader));
                }
            }
        } catch (XMLStreamException | RuntimeException e) {
            log.debug("Stopped reading {} JUnit XML after {} cases: {}", dialect, result.getTotal(), e.getMessage());
        } finally {
            XmlInputs.closeQuietly(reader);
        }
        return result;
    }

    /**
     * Consumes one testcase element, reader positioned on its start tag.
     */
    private CaseResult readTestCase(XMLStreamReader reader) throws XMLStreamException {
        String name = XmlInputs.attribute(reader, "name");
        String className = XmlInputs.attribute(reader, "classname");
        String filePath = XmlInputs.attribute(reader, "file");
        double durationMs = Durations.toMillis(XmlInputs.attribute(reader, "time"));
        boolean skipped = dialect.isSkipped(XmlInputs.attribute(reader, "status"),
                XmlInputs.attribute(reader, "result"));

        Outcome failure = null;
        Outcome error = null;
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                String element = reader.getLocalName();
                if ("failure".equals(element) && failure == null) {
                    failure = readOutcome(reader);
                } else if ("error".equals(element) && error == null) {
                    error = readOutcome(reader);
                } else {
                    if ("skipped".equals(element)) {
                        skipped = true;
                    }
                    depth++;
                }
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }

        String caseName = qualifiedName(className, name);
        if (failure != null) {
            return new CaseResult(caseName, CaseStatus.FAILED, durationMs, failure.compose(), filePath);
        }
        if (error != null) {
            return new CaseResult(caseName, CaseStatus.ERROR, durationMs, error.compose(), filePath);
        }
        return new CaseResult(caseName, skipped ? CaseStatus.SKIPPED : CaseStatus.PASSED, durationMs, "", filePath);
    }

    /**
     * Reads a failure or error element through its end tag.
     */
    private static Outcome readOutcome(XMLStreamReader reader) throws XMLStreamException {
        String message = XmlInputs.attribute(reader, "message");
        StringBuilder body = new StringBuilder();
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> depth++;
                case XMLStreamConstants.END_ELEMENT -> depth--;
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> body.append(reader.getText());
                default -> {
                }
            }
        }
        return new Outcome(message, body.toString());
    }

    static String qualifiedName(String className, String name) {
        String testName = name != null && !name.isEmpty() ? name : "unknown";
        if (className == null || className.isEmpty()) {
            return testName;
        }
        return className + "." + testName;
    }

    private record Outcome(String message, String body) {
        String compose() {
            return FailureMessages.compose(message, body);
        }
    }
}
