package com.codelogickeep.agent.adapter.framework;

import com.codelogickeep.agent.adapter.coverage.CoverageAdapter;
import com.codelogickeep.agent.adapter.exception.AdapterException;
import com.codelogickeep.agent.adapter.exception.AdapterException.ErrorCode;
import com.codelogickeep.agent.adapter.model.CoverageReport;
import com.codelogickeep.agent.adapter.model.PromptTemplate;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.model.ValidationResult;
import com.codelogickeep.agent.adapter.process.CommandTranscript;
import com.codelogickeep.agent.adapter.validation.ValidationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Shared {@code runTests} lifecycle: a private report directory per call, a transcript of
 * every command, optional coverage, and a frozen result. Subclasses implement {@link #execute}
 * and may throw; whatever escapes is written to the transcript as {@code ERROR [Exxx]: ...}.
 */
public abstract class AbstractTestFrameworkAdapter implements TestFrameworkAdapter {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final AdapterContext context;
    private final CoverageAdapter coverageAdapter;
    private final ValidationGate validationGate;

    protected AbstractTestFrameworkAdapter(AdapterContext context, CoverageAdapter coverageAdapter) {
        this.context = context;
        this.coverageAdapter = coverageAdapter;
        this.validationGate = new ValidationGate(context.syntaxCheckers());
    }

    /**
     * Runs the toolchain and parses its reports. {@code reportDir} is empty, private to this
     * call and removed afterwards. Every command should be recorded in {@code transcript}.
     */
    protected abstract RunResult execute(Path projectRoot, RunOptions options, Path reportDir,
                                         CommandTranscript transcript) throws IOException;

    @Override
    public final RunResult runTests(Path projectRoot, RunOptions options) {
        RunOptions effective = options != null ? options : RunOptions.defaults();
        CommandTranscript transcript = new CommandTranscript();
        log.info("Running {} tests in {}", name(), projectRoot);

        RunResult result;
        Path reportDir = null;
        try {
            if (projectRoot == null || !Files.isDirectory(projectRoot)) {
                throw new AdapterException(ErrorCode.PROJECT_TARGET_NOT_FOUND,
                        "Project directory does not exist", String.valueOf(projectRoot));
            }
            reportDir = Files.createTempDirectory(context.config().getExecution().getTempDirPrefix() + name() + "_");
            result = execute(projectRoot, effective, reportDir, transcript);
        } catch (AdapterException e) {
            log.warn("{} run failed: {}", name(), e.getMessage());
            transcript.note(e.toTranscriptLine());
            result = RunResult.failure("");
        } catch (IOException e) {
            log.error("{} run failed with an I/O error", name(), e);
            transcript.note(new AdapterException(ErrorCode.INFRASTRUCTURE_ERROR, e.getMessage(), name(), e)
                    .toTranscriptLine());
            result = RunResult.failure("");
        } catch (RuntimeException e) {
            log.error("{} run failed unexpectedly", name(), e);
            transcript.note(new AdapterException(ErrorCode.UNKNOWN_ERROR, String.valueOf(e.getMessage()), name(), e)
                    .toTranscriptLine());
            result = RunResult.failure("");
        } finally {
            deleteRecursively(reportDir);
        }

        if (effective.collectCoverage() && coverageAdapter != null && projectRoot != null) {
            collectCoverage(result, projectRoot, effective);
        }
        result.setRawOutput(transcript.toString());
        log.info("{} finished: {}", name(), result);
        return result.freeze();
    }

    private void collectCoverage(RunResult result, Path projectRoot, RunOptions options) {
        try {
            CoverageReport report = coverageAdapter.runCoverage(projectRoot, options.testFiles(), options.timeout());
            result.setCoverage(report);
            log.info("Coverage collected: {}% line coverage", String.format("%.1f", report.getOverallLineCoverage()));
        } catch (Exception e) {
            log.warn("Failed to collect coverage with {}: {}", coverageAdapter.name(), e.getMessage());
        }
    }

    @Override
    public ValidationResult validateTest(String testCode) {
        return validationGate.validate(normalizeForValidation(testCode != null ? testCode : ""), language());
    }

    /**
     * Hook to rewrite framework macros into plain source before syntax checking.
     */
    protected String normalizeForValidation(String testCode) {
        return testCode;
    }

    @Override
    public PromptTemplate getPromptTemplate() {
        return PromptTemplate.forFramework(name(), language());
    }

    @Override
    public List<String> getRequiredPackages() {
        return List.of();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name() + "]";
    }

    static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LoggerFactory.getLogger(AbstractTestFrameworkAdapter.class)
                            .warn("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            LoggerFactory.getLogger(AbstractTestFrameworkAdapter.class)
                    .warn("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
