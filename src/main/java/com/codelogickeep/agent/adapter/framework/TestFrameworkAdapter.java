package com.codelogickeep.agent.adapter.framework;

import com.codelogickeep.agent.adapter.model.PromptTemplate;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.model.ValidationResult;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * One third-party test framework: how to recognise it, run it and read its reports.
 * <p>
 * Implementations are stateless and safe to share between threads. {@link #runTests}
 * never throws for toolchain problems; they show up as an unsuccessful result whose
 * {@link RunResult#getRawOutput()} says which stage failed.
 */
public interface TestFrameworkAdapter {

    /**
     * Registry key, e.g. "gtest".
     */
    String name();

    /**
     * Source language of the tests this framework runs, e.g. "cpp".
     */
    String language();

    /**
     * Read-only, bounded inspection of the project tree. Spawns no processes.
     */
    boolean detect(Path projectRoot);

    List<String> getTestPattern();

    PromptTemplate getPromptTemplate();

    RunResult runTests(Path projectRoot, RunOptions options);

    /**
     * Runs {@link #runTests} on {@code executor}. The call is bounded only by the
     * per-command timeout in {@code options}; cancelling the future does not stop child processes.
     */
    default CompletableFuture<RunResult> runTestsAsync(Path projectRoot, RunOptions options, Executor executor) {
        return CompletableFuture.supplyAsync(() -> runTests(projectRoot, options), executor);
    }

    /**
     * Syntax-only check of candidate test source. The code is never executed.
     */
    ValidationResult validateTest(String testCode);

    /**
     * Packages the project must depend on, in the framework's own package ecosystem.
     */
    List<String> getRequiredPackages();

    /**
     * Executables that must be on PATH.
     */
    List<String> getRequiredCommands();
}
