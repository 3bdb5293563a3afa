package com.codelogickeep.agent.adapter.framework.unit;

import com.codelogickeep.agent.adapter.coverage.CoverageAdapter;
import com.codelogickeep.agent.adapter.detect.ProjectScanner;
import com.codelogickeep.agent.adapter.exception.AdapterException;
import com.codelogickeep.agent.adapter.exception.AdapterException.ErrorCode;
import com.codelogickeep.agent.adapter.framework.AbstractTestFrameworkAdapter;
import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.RunOptions;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandResult;
import com.codelogickeep.agent.adapter.process.CommandTranscript;
import com.codelogickeep.agent.adapter.report.TrxReportParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * xUnit.net through {@code dotnet test} with the TRX logger.
 */
public class XUnitAdapter extends AbstractTestFrameworkAdapter {
    static final Pattern CSPROJ_XUNIT = Pattern.compile(
            "PackageReference\\s+Include\\s*=\\s*[\"']([^\"']*xunit[^\"']*)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern USING_XUNIT = Pattern.compile("using\\s+Xunit\\s*;");
    private static final List<String> TEST_PATTERNS = List.of("**/*Tests.cs", "**/*Test.cs");
    static final String TRX_FILE = "results.trx";

    private final TrxReportParser parser = new TrxReportParser();

    public XUnitAdapter() {
        this(AdapterContext.defaults());
    }

    public XUnitAdapter(AdapterContext context) {
        this(context, null);
    }

    public XUnitAdapter(AdapterContext context, CoverageAdapter coverageAdapter) {
        super(context, coverageAdapter);
    }

    @Override
    public String name() {
        return "xunit";
    }

    @Override
    public String language() {
        return "csharp";
    }

    @Override
    public boolean detect(Path projectRoot) {
        return findXUnitProject(projectRoot).isPresent()
                || (context.scanner().anySourceMatches(projectRoot, Set.of(".cs"), USING_XUNIT)
                && context.scanner().anyFileMatches(projectRoot, TEST_PATTERNS));
    }

    @Override
    public List<String> getTestPattern() {
        return TEST_PATTERNS;
    }

    @Override
    protected RunResult execute(Path projectRoot, RunOptions options, Path reportDir, CommandTranscript transcript) {
        Path target = findTarget(projectRoot).orElseThrow(() ->
                new AdapterException(ErrorCode.PROJECT_TARGET_NOT_FOUND, "No .sln or .csproj found", projectRoot.toString()));

        Path trx = reportDir.toAbsolutePath().resolve(TRX_FILE);
        List<String> command = new ArrayList<>(List.of("dotnet", "test", target.toString(),
                "--logger", "trx;LogFileName=" + trx));
        String filter = testFilter(options.testFiles());
        if (!filter.isEmpty()) {
            command.add("--filter");
            command.add(filter);
        }

        CommandResult result = context.commandRunner().run(command, projectRoot, options.timeout());
        transcript.record(command, result);
        if (result.timedOut() || result.notFound()) {
            return RunResult.failure(transcript.toString());
        }
        if (!Files.isRegularFile(trx)) {
            transcript.note(new AdapterException(ErrorCode.REPORT_NOT_FOUND, "TRX report was not written", trx.toString())
                    .toTranscriptLine());
            return RunResult.failure(transcript.toString());
        }
        RunResult parsed = parser.parse(ProjectScanner.readFully(trx), transcript.toString());
        if (parsed.getTotal() == 0) {
            transcript.emptyReport(trx.toString());
        }
        return parsed;
    }

    /**
     * A solution at the root, else an xUnit test project anywhere, else any root project file.
     */
    Optional<Path> findTarget(Path projectRoot) {
        Optional<Path> solution = firstInRoot(projectRoot, ".sln");
        if (solution.isPresent()) {
            return solution;
        }
        Optional<Path> testProject = findXUnitProject(projectRoot);
        if (testProject.isPresent()) {
            return testProject;
        }
        return firstInRoot(projectRoot, ".csproj");
    }

    private Optional<Path> findXUnitProject(Path projectRoot) {
        return context.scanner().findFiles(projectRoot, path -> {
            if (!path.getFileName().toString().endsWith(".csproj")) {
                return false;
            }
            String content = ProjectScanner.readFully(path);
            return content != null && CSPROJ_XUNIT.matcher(content).find();
        }, 1).stream().findFirst();
    }

    private static Optional<Path> firstInRoot(Path projectRoot, String extension) {
        try (Stream<Path> files = Files.list(projectRoot)) {
            return files.filter(path -> Files.isRegularFile(path) && path.getFileName().toString().endsWith(extension))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String testFilter(List<Path> testFiles) {
        return testFiles.stream()
                .map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(".cs"))
                .map(name -> "FullyQualifiedName~" + name.substring(0, name.length() - 3))
                .collect(Collectors.joining("|"));
    }

    @Override
    public List<String> getRequiredPackages() {
        return List.of("xunit", "xunit.runner.visualstudio", "Microsoft.NET.Test.Sdk");
    }

    @Override
    public List<String> getRequiredCommands() {
        return List.of("dotnet");
    }
}
