package com.codelogickeep.agent.adapter.framework;

import com.codelogickeep.agent.adapter.config.AdapterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunOptions Tests")
class RunOptionsTest {

    @Test
    @DisplayName("defaults should run everything with the standard timeout")
    void defaults() {
        RunOptions options = RunOptions.defaults();

        assertTrue(options.testFiles().isEmpty());
        assertEquals(RunOptions.DEFAULT_TIMEOUT, options.timeout());
        assertFalse(options.collectCoverage());
    }

    @Test
    @DisplayName("execution config should seed timeout and coverage")
    void fromExecutionConfig() {
        AdapterConfig.ExecutionConfig execution = new AdapterConfig.ExecutionConfig();
        execution.setTimeoutSeconds(42);
        execution.setCollectCoverage(true);

        RunOptions options = RunOptions.from(execution).toBuilder().testFile(Path.of("a_test.cpp")).build();

        assertEquals(Duration.ofSeconds(42), options.timeout());
        assertTrue(options.collectCoverage());
        assertEquals(List.of(Path.of("a_test.cpp")), options.testFiles());
    }

    @Test
    @DisplayName("non-positive timeout should be rejected")
    void invalidTimeout() {
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().timeout(Duration.ofSeconds(-1)).build());
    }
}
