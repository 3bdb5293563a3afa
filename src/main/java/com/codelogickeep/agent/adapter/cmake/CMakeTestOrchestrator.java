package com.codelogickeep.agent.adapter.cmake;

import com.codelogickeep.agent.adapter.aggregate.ResultAggregator;
import com.codelogickeep.agent.adapter.detect.ProjectScanner;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandResult;
import com.codelogickeep.agent.adapter.process.CommandRunner;
import com.codelogickeep.agent.adapter.process.CommandTranscript;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs a CMake-built test suite: CTest first, the compiled binaries directly when CTest
 * is unavailable.
 * <p>
 * A timeout or a failing build is terminal. A missing tool or a missing CTest report
 * falls through to direct execution. Results are returned unfrozen; raw output is left to
 * the caller.
 */
@Slf4j
public class CMakeTestOrchestrator {
    static final String CTEST_REPORT = "ctest-results.xml";

    private final CMakeToolchain toolchain;
    private final CommandRunner commandRunner;
    private final BinaryDiscovery binaryDiscovery;

    public CMakeTestOrchestrator(CMakeToolchain toolchain, CommandRunner commandRunner, ProjectScanner scanner) {
        this.toolchain = toolchain;
        this.commandRunner = commandRunner;
        this.binaryDiscovery = new BinaryDiscovery(scanner);
    }

    /**
     * How the CTest attempt ended.
     */
    public enum PrimaryOutcome {
        /** No configured build directory; CTest was not attempted. */
        SKIPPED,
        /** cmake or ctest is missing, or CTest wrote no report. */
        UNAVAILABLE,
        /** Report parsed. */
        SUCCEEDED,
        /** Build failed or something timed out. No fallback. */
        FAILED
    }

    record PrimaryAttempt(PrimaryOutcome outcome, RunResult result) {
        static PrimaryAttempt of(PrimaryOutcome outcome) {
            return new PrimaryAttempt(outcome, null);
        }
    }

    public RunResult run(Path projectRoot, List<Path> testFiles, Path reportDir, Duration timeout,
                         CommandTranscript transcript) {
        Optional<Path> buildDir = CMakeBuildLocator.findBuildDir(projectRoot);
        PrimaryAttempt primary = buildDir
                .map(dir -> runCTest(dir, testFiles, reportDir, timeout, transcript))
                .orElseGet(() -> PrimaryAttempt.of(PrimaryOutcome.SKIPPED));
        log.info("{} CTest attempt: {}", toolchain.displayName(), primary.outcome());

        return switch (primary.outcome()) {
            case SUCCEEDED, FAILED -> primary.result();
            case SKIPPED, UNAVAILABLE -> runBinaries(projectRoot, buildDir.orElse(null), testFiles, reportDir,
                    timeout, transcript);
        };
    }

    PrimaryAttempt runCTest(Path buildDir, List<Path> testFiles, Path reportDir, Duration timeout,
                            CommandTranscript transcript) {
        List<String> buildCmd = List.of("cmake", "--build", ".", "--target", "test");
        CommandResult build = commandRunner.run(buildCmd, buildDir, timeout);
        transcript.record(buildCmd, build);
        if (build.notFound()) {
            return PrimaryAttempt.of(PrimaryOutcome.UNAVAILABLE);
        }
        if (build.timedOut() || build.exitCode() != 0) {
            return new PrimaryAttempt(PrimaryOutcome.FAILED, RunResult.failure(transcript.toString()));
        }

        Path report = reportDir.resolve(CTEST_REPORT);
        List<String> ctestCmd = new ArrayList<>(List.of("ctest", "--output-on-failure", "--output-junit", report.toString()));
        String regex = ctestRegex(testFiles);
        if (!regex.isEmpty()) {
            ctestCmd.add("-R");
            ctestCmd.add(regex);
        }
        CommandResult ctest = commandRunner.run(ctestCmd, buildDir, timeout);
        transcript.record(ctestCmd, ctest);
        if (ctest.timedOut()) {
            return new PrimaryAttempt(PrimaryOutcome.FAILED, RunResult.failure(transcript.toString()));
        }
        if (ctest.notFound() || !Files.isRegularFile(report)) {
            return PrimaryAttempt.of(PrimaryOutcome.UNAVAILABLE);
        }
        RunResult parsed = toolchain.ctestReportParser().parse(ProjectScanner.readFully(report), transcript.toString());
        if (parsed.getTotal() == 0) {
            transcript.emptyReport(report.toString());
        }
        return new PrimaryAttempt(PrimaryOutcome.SUCCEEDED, parsed);
    }

    RunResult runBinaries(Path projectRoot, Path buildDir, List<Path> testFiles, Path reportDir, Duration timeout,
                          CommandTranscript transcript) {
        List<Path> binaries = BinaryDiscovery.select(
                binaryDiscovery.discover(projectRoot, buildDir, toolchain.binaryGlobs()), testFiles);
        if (binaries.isEmpty()) {
            transcript.note("No " + toolchain.displayName() + " binaries found for direct execution.");
            return RunResult.failure(transcript.toString());
        }
        log.info("Running {} {} binaries directly", binaries.size(), toolchain.displayName());

        RunResult aggregate = new RunResult();
        for (int i = 0; i < binaries.size(); i++) {
            Path binary = binaries.get(i);
            CMakeToolchain.DirectInvocation invocation = toolchain.directInvocation(binary, reportDir, i);
            CommandResult result = commandRunner.run(invocation.command(), binary.getParent(), timeout);
            transcript.record(invocation.command(), result);

            if (result.timedOut()) {
                aggregate.addErrors(1);
                continue;
            }
            if (Files.isRegularFile(invocation.reportFile())) {
                String report = ProjectScanner.readFully(invocation.reportFile());
                RunResult parsed = invocation.parser().parse(report, transcript.toString());
                if (parsed.getTotal() == 0) {
                    transcript.emptyReport(invocation.reportFile().toString());
                }
                ResultAggregator.merge(aggregate, parsed);
            } else {
                toolchain.parseWithoutReport(result, transcript.toString())
                        .ifPresent(parsed -> ResultAggregator.merge(aggregate, parsed));
            }
        }
        aggregate.setRawOutput(transcript.toString());
        return aggregate;
    }

    /**
     * CTest {@code -R} pattern selecting the requested test files' stems, or "" for all tests.
     */
    static String ctestRegex(List<Path> testFiles) {
        if (testFiles == null || testFiles.isEmpty()) {
            return "";
        }
        return testFiles.stream()
                .map(BinaryDiscovery::stem)
                .filter(stem -> !stem.isEmpty())
                .map(CMakeTestOrchestrator::escapeRegex)
                .collect(Collectors.joining("|"));
    }

    /**
     * Backslash-escapes everything but word characters. CMake regexes have no \Q...\E quoting.
     */
    static String escapeRegex(String text) {
        StringBuilder sb = new StringBuilder(text.length() * 2);
        for (char c : text.toCharArray()) {
            if (!Character.isLetterOrDigit(c) && c != '_') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
