package com.codelogickeep.agent.adapter.framework;

import com.codelogickeep.agent.adapter.config.AdapterConfig;
import lombok.Builder;
import lombok.Singular;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Per-call options for {@link TestFrameworkAdapter#runTests(Path, RunOptions)}.
 *
 * @param testFiles       files to restrict the run to; empty runs everything
 * @param timeout         budget for each subprocess, not for the whole call
 * @param collectCoverage whether to ask the adapter's coverage collaborator afterwards
 */
@Builder(toBuilder = true)
public record RunOptions(@Singular List<Path> testFiles, Duration timeout, boolean collectCoverage) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(180);

    public RunOptions {
        testFiles = testFiles != null ? List.copyOf(testFiles) : List.of();
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout);
        }
    }

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }

    public static RunOptions from(AdapterConfig.ExecutionConfig execution) {
        return RunOptions.builder()
                .timeout(execution.timeout())
                .collectCoverage(execution.isCollectCoverage())
                .build();
    }
}
