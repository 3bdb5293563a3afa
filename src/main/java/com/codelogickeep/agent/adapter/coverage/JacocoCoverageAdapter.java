package com.codelogickeep.agent.adapter.coverage;

import com.codelogickeep.agent.adapter.detect.BuildTool;
import com.codelogickeep.agent.adapter.detect.ProjectScanner;
import com.codelogickeep.agent.adapter.model.CoverageReport;
import com.codelogickeep.agent.adapter.model.CoverageReport.FileCoverage;
import com.codelogickeep.agent.adapter.process.CommandResult;
import com.codelogickeep.agent.adapter.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Reads JaCoCo's XML report from the Gradle or Maven output tree, generating it with
 * {@code jacocoTestReport} or {@code jacoco:report} when the tests left execution data but no report.
 */
public class JacocoCoverageAdapter implements CoverageAdapter {
    private static final Logger log = LoggerFactory.getLogger(JacocoCoverageAdapter.class);

    // Gradle locations first.
    static final List<String> REPORT_PATHS = List.of(
            "build/reports/jacoco/test/jacocoTestReport.xml",
            "build/reports/jacoco/test/jacoco.xml",
            "build/jacoco/test/jacocoTestReport.xml",
            "target/site/jacoco/jacoco.xml",
            "target/jacoco.xml");

    private final CommandRunner commandRunner;
    private final ProjectScanner scanner;

    public JacocoCoverageAdapter() {
        this(new CommandRunner(), new ProjectScanner());
    }

    public JacocoCoverageAdapter(CommandRunner commandRunner, ProjectScanner scanner) {
        this.commandRunner = commandRunner;
        this.scanner = scanner;
    }

    @Override
    public String name() {
        return "jacoco";
    }

    @Override
    public CoverageReport runCoverage(Path projectRoot, List<Path> testFiles, Duration timeout) throws IOException {
        Optional<Path> existing = findReport(projectRoot);
        if (existing.isPresent()) {
            return parse(existing.get());
        }
        List<String> command = reportCommand(BuildTool.of(scanner, projectRoot), projectRoot);
        log.info("JaCoCo report missing, generating it in {}: {}", projectRoot, String.join(" ", command));
        CommandResult result = commandRunner.run(command, projectRoot, timeout);
        if (!result.isSuccess()) {
            String reason = result.stderr().isBlank() ? "exit code " + result.exitCode() : result.stderr();
            throw new IOException(command.get(command.size() - 1) + " failed: " + reason);
        }
        return parse(findReport(projectRoot).orElseThrow(() -> new IOException(
                "Coverage report not found under " + projectRoot.toAbsolutePath() + " in any of " + REPORT_PATHS)));
    }

    static Optional<Path> findReport(Path projectRoot) {
        return REPORT_PATHS.stream()
                .map(projectRoot::resolve)
                .filter(Files::isRegularFile)
                .findFirst();
    }

    static List<String> reportCommand(BuildTool buildTool, Path projectRoot) {
        String launcher = buildTool.launcher(projectRoot);
        return buildTool == BuildTool.GRADLE
                ? List.of(launcher, "jacocoTestReport")
                : List.of(launcher, "-q", "jacoco:report");
    }

    CoverageReport parse(Path xmlFile) throws IOException {
        try {
            Document doc = parseXml(xmlFile);
            CoverageReport report = new CoverageReport();
            NodeList packages = doc.getElementsByTagName("package");
            for (int i = 0; i < packages.getLength(); i++) {
                Element pkg = (Element) packages.item(i);
                String packageName = pkg.getAttribute("name");
                NodeList children = pkg.getChildNodes();
                for (int j = 0; j < children.getLength(); j++) {
                    Node node = children.item(j);
                    if (node.getNodeType() == Node.ELEMENT_NODE && "sourcefile".equals(node.getNodeName())) {
                        report.addFile(toFileCoverage(packageName, (Element) node));
                    }
                }
            }
            return report;
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to parse coverage report: " + e.getMessage(), e);
        }
    }

    private FileCoverage toFileCoverage(String packageName, Element sourceFile) {
        String path = packageName.isEmpty() ? sourceFile.getAttribute("name")
                : packageName + "/" + sourceFile.getAttribute("name");
        long[] lines = counter(sourceFile, "LINE");
        long[] branches = counter(sourceFile, "BRANCH");
        return new FileCoverage(path, (int) lines[1], (int) lines[0], (int) branches[1], (int) branches[0]);
    }

    /**
     * {missed, covered} of the element's direct counter of the given type; zeros when absent.
     */
    private long[] counter(Element element, String counterType) {
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE || !"counter".equals(node.getNodeName())) {
                continue;
            }
            Element counter = (Element) node;
            if (counterType.equals(counter.getAttribute("type"))) {
                return new long[]{Long.parseLong(counter.getAttribute("missed")),
                        Long.parseLong(counter.getAttribute("covered"))};
            }
        }
        return new long[]{0, 0};
    }

    private Document parseXml(Path xmlFile) throws Exception {
        DocumentBuilderFactory dbFactory = DocumentBuilderFactory.newInstance();
        // JaCoCo reports carry a DOCTYPE; allow it but never fetch the DTD.
        dbFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", false);
        dbFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        dbFactory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        dbFactory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        DocumentBuilder dBuilder = dbFactory.newDocumentBuilder();
        Document doc = dBuilder.parse(xmlFile.toFile());
        doc.getDocumentElement().normalize();
        return doc;
    }
}
