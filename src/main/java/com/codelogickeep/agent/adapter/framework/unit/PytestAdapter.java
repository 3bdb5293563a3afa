package com.codelogickeep.agent.adapter.framework.unit;

import com.codelogickeep.agent.adapter.coverage.CoverageAdapter;
import com.codelogickeep.agent.adapter.detect.ProjectScanner;
import com.codelogickeep.agent.adapter.framework.AbstractTestFrameworkAdapter;
import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.RunOptions;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandResult;
import com.codelogickeep.agent.adapter.process.CommandTranscript;
import com.codelogickeep.agent.adapter.report.PytestJsonReportParser;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * pytest with the pytest-json-report plugin. There is no execution fallback; a report that
 * ended up on stdout is still recovered by the tolerant JSON parser.
 */
public class PytestAdapter extends AbstractTestFrameworkAdapter {
    static final List<String> VENV_DIRS = List.of(".venv", "venv", "virtualenv", "env");
    private static final List<String> TEST_PATTERNS = List.of("**/test_*.py", "**/*_test.py");
    static final String REPORT_FILE = "report.json";

    private final PytestJsonReportParser parser = new PytestJsonReportParser();

    public PytestAdapter() {
        this(AdapterContext.defaults());
    }

    public PytestAdapter(AdapterContext context) {
        this(context, null);
    }

    public PytestAdapter(AdapterContext context, CoverageAdapter coverageAdapter) {
        super(context, coverageAdapter);
    }

    @Override
    public String name() {
        return "pytest";
    }

    @Override
    public String language() {
        return "python";
    }

    @Override
    public boolean detect(Path projectRoot) {
        ProjectScanner scanner = context.scanner();
        return Files.isRegularFile(projectRoot.resolve("conftest.py"))
                || Files.isRegularFile(projectRoot.resolve("pytest.ini"))
                || scanner.fileContains(projectRoot, "pyproject.toml", "[tool.pytest")
                || scanner.fileContains(projectRoot, "setup.cfg", "[tool:pytest]")
                || declaresPytestDependency(projectRoot);
    }

    /**
     * A non-header line of pyproject.toml mentioning pytest, such as a dependency entry.
     */
    static boolean declaresPytestDependency(Path projectRoot) {
        Path pyproject = projectRoot.resolve("pyproject.toml");
        if (!Files.isRegularFile(pyproject)) {
            return false;
        }
        String content = ProjectScanner.readFully(pyproject);
        if (content == null) {
            return false;
        }
        for (String line : content.split("\\R")) {
            String stripped = line.strip();
            if (stripped.startsWith("[")) {
                continue;
            }
            if (stripped.toLowerCase(Locale.ROOT).contains("pytest") && !stripped.contains("tool.pytest")) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<String> getTestPattern() {
        return TEST_PATTERNS;
    }

    @Override
    protected RunResult execute(Path projectRoot, RunOptions options, Path reportDir, CommandTranscript transcript) {
        Path report = reportDir.toAbsolutePath().resolve(REPORT_FILE);
        List<String> command = new ArrayList<>();
        command.add(resolveCommand(projectRoot));
        command.add("--json-report");
        command.add("--json-report-file=" + report);
        command.add("-q");
        command.addAll(context.config().getPytest().getExtraArgs());
        options.testFiles().forEach(file -> command.add(file.toString()));

        CommandResult result = context.commandRunner().run(command, projectRoot, options.timeout());
        transcript.record(command, result);
        if (result.timedOut()) {
            log.warn("pytest run timed out after {}s", options.timeout().toSeconds());
            return RunResult.failure(transcript.toString());
        }
        if (result.notFound()) {
            transcript.note("pytest not found");
            return RunResult.failure(transcript.toString());
        }

        String json = Files.isRegularFile(report) ? ProjectScanner.readFully(report) : null;
        String source = report.toString();
        if (json == null || json.isBlank()) {
            log.debug("No pytest report file, reading stdout instead");
            json = result.stdout();
            source = "stdout";
        }
        RunResult parsed = parser.parse(json, transcript.toString());
        if (parsed.getTotal() == 0) {
            transcript.emptyReport(source);
        }
        return parsed;
    }

    /**
     * Configured command, else pytest from a project-local virtualenv, else pytest on PATH.
     */
    String resolveCommand(Path projectRoot) {
        String configured = context.config().getPytest().getCommand();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        for (String venv : VENV_DIRS) {
            Path venvDir = projectRoot.resolve(venv);
            if (!Files.isDirectory(venvDir)) {
                continue;
            }
            for (Path candidate : List.of(venvDir.resolve("bin").resolve("pytest"),
                    venvDir.resolve("Scripts").resolve("pytest.exe"),
                    venvDir.resolve("Scripts").resolve("pytest"))) {
                if (Files.isRegularFile(candidate)) {
                    return candidate.toAbsolutePath().toString();
                }
            }
        }
        return "pytest";
    }

    @Override
    public List<String> getRequiredPackages() {
        return List.of("pytest", "pytest-json-report");
    }

    @Override
    public List<String> getRequiredCommands() {
        return List.of("python");
    }
}
