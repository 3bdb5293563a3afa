package com.codelogickeep.agent.adapter.framework.unit;

import com.codelogickeep.agent.adapter.aggregate.ResultAggregator;
import com.codelogickeep.agent.adapter.coverage.CoverageAdapter;
import com.codelogickeep.agent.adapter.coverage.JacocoCoverageAdapter;
import com.codelogickeep.agent.adapter.detect.BuildTool;
import com.codelogickeep.agent.adapter.detect.ProjectScanner;
import com.codelogickeep.agent.adapter.exception.AdapterException;
import com.codelogickeep.agent.adapter.exception.AdapterException.ErrorCode;
import com.codelogickeep.agent.adapter.framework.AbstractTestFrameworkAdapter;
import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.RunOptions;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandResult;
import com.codelogickeep.agent.adapter.process.CommandTranscript;
import com.codelogickeep.agent.adapter.report.JUnitXmlDialect;
import com.codelogickeep.agent.adapter.report.JUnitXmlReportParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JUnit 5 through Gradle or Maven. Reports are the XML files the build leaves in
 * {@code build/test-results} or {@code target/surefire-reports}, merged into one result.
 */
public class JUnit5Adapter extends AbstractTestFrameworkAdapter {
    private static final Pattern JUNIT_IMPORT = Pattern.compile("import\\s+org\\.junit\\.jupiter");
    private static final List<String> TEST_PATTERNS = List.of("**/*Test.java", "**/Test*.java");

    private final JUnitXmlReportParser parser = new JUnitXmlReportParser(JUnitXmlDialect.SUREFIRE);

    public JUnit5Adapter() {
        this(AdapterContext.defaults());
    }

    public JUnit5Adapter(AdapterContext context) {
        this(context, new JacocoCoverageAdapter(context.commandRunner(), context.scanner()));
    }

    public JUnit5Adapter(AdapterContext context, CoverageAdapter coverageAdapter) {
        super(context, coverageAdapter);
    }

    @Override
    public String name() {
        return "junit5";
    }

    @Override
    public String language() {
        return "java";
    }

    @Override
    public boolean detect(Path projectRoot) {
        return usesGradle(projectRoot)
                || context.scanner().fileMatches(projectRoot, "pom.xml", BuildTool.JUNIT_DEPENDENCY)
                || (context.scanner().anySourceMatches(projectRoot, Set.of(".java"), JUNIT_IMPORT)
                && context.scanner().anyFileMatches(projectRoot, TEST_PATTERNS));
    }

    private boolean usesGradle(Path projectRoot) {
        return BuildTool.of(context.scanner(), projectRoot) == BuildTool.GRADLE;
    }

    @Override
    public List<String> getTestPattern() {
        return TEST_PATTERNS;
    }

    @Override
    protected RunResult execute(Path projectRoot, RunOptions options, Path reportDir, CommandTranscript transcript)
            throws IOException {
        boolean gradle = usesGradle(projectRoot);
        List<String> command = gradle ? gradleCommand(projectRoot, options.testFiles())
                : mavenCommand(projectRoot, options.testFiles());

        CommandResult result = context.commandRunner().run(command, projectRoot, options.timeout());
        transcript.record(command, result);
        if (result.timedOut() || result.notFound()) {
            return RunResult.failure(transcript.toString());
        }

        List<Path> reports = gradle ? gradleReports(projectRoot) : surefireReports(projectRoot);
        if (reports.isEmpty()) {
            transcript.note(new AdapterException(ErrorCode.REPORT_NOT_FOUND, "No JUnit XML reports were written",
                    projectRoot.toString()).toTranscriptLine());
            return RunResult.failure(transcript.toString());
        }
        log.debug("Merging {} JUnit report(s)", reports.size());
        RunResult aggregate = new RunResult();
        for (Path report : reports) {
            RunResult parsed = parser.parse(ProjectScanner.readFully(report), "");
            if (parsed.getTotal() == 0) {
                transcript.emptyReport(report.toString());
            }
            ResultAggregator.merge(aggregate, parsed);
        }
        return aggregate;
    }

    static List<String> gradleCommand(Path projectRoot, List<Path> testFiles) {
        List<String> command = new ArrayList<>();
        command.add(BuildTool.GRADLE.launcher(projectRoot));
        command.add("test");
        for (Path testFile : testFiles) {
            String className = toClassName(projectRoot, testFile);
            if (!className.isEmpty()) {
                command.add("--tests");
                command.add(className);
            }
        }
        return command;
    }

    static List<String> mavenCommand(Path projectRoot, List<Path> testFiles) {
        List<String> command = new ArrayList<>();
        command.add(BuildTool.MAVEN.launcher(projectRoot));
        command.add("test");
        command.add("-q");
        String names = testFiles.stream()
                .map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(".java"))
                .map(name -> name.substring(0, name.length() - ".java".length()))
                .collect(Collectors.joining(","));
        if (!names.isEmpty()) {
            command.add("-Dtest=" + names);
        }
        return command;
    }

    /**
     * {@code src/test/java/com/example/FooTest.java} becomes {@code com.example.FooTest}.
     * Empty when the file lies outside the project.
     */
    static String toClassName(Path projectRoot, Path testFile) {
        Path absoluteRoot = projectRoot.toAbsolutePath().normalize();
        Path absoluteFile = (testFile.isAbsolute() ? testFile : absoluteRoot.resolve(testFile)).normalize();
        if (!absoluteFile.startsWith(absoluteRoot)) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (Path part : absoluteRoot.relativize(absoluteFile)) {
            parts.add(part.toString());
        }

        int src = parts.indexOf("src");
        if (src >= 0) {
            boolean testTree = src + 1 < parts.size() && "test".equals(parts.get(src + 1));
            parts = new ArrayList<>(parts.subList(src + (testTree ? 2 : 1), parts.size()));
        }
        int java = parts.indexOf("java");
        if (java >= 0) {
            parts = new ArrayList<>(parts.subList(java + 1, parts.size()));
        }
        if (parts.isEmpty()) {
            return "";
        }
        String fileName = parts.remove(parts.size() - 1);
        int dot = fileName.lastIndexOf('.');
        parts.add(dot > 0 ? fileName.substring(0, dot) : fileName);
        return String.join(".", parts);
    }

    static List<Path> surefireReports(Path projectRoot) throws IOException {
        Path dir = projectRoot.resolve("target").resolve("surefire-reports");
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(path -> {
                String name = path.getFileName().toString();
                return name.startsWith("TEST-") && name.endsWith(".xml") && Files.isRegularFile(path);
            }).sorted().toList();
        }
    }

    static List<Path> gradleReports(Path projectRoot) throws IOException {
        Path dir = projectRoot.resolve("build").resolve("test-results");
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(path -> path.getFileName().toString().endsWith(".xml") && Files.isRegularFile(path))
                    .sorted()
                    .toList();
        }
    }

    @Override
    public List<String> getRequiredCommands() {
        return List.of("java");
    }
}
