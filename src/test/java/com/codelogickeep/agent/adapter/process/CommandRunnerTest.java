package com.codelogickeep.agent.adapter.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandRunner Tests")
class CommandRunnerTest {

    @TempDir
    Path tempDir;

    private final CommandRunner runner = new CommandRunner();

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should capture exit code, stdout and stderr")
    void run_shouldCaptureOutput() throws IOException {
        Files.writeString(tempDir.resolve("marker.txt"), "x");

        CommandResult result = runner.run(List.of("sh", "-c", "ls; echo oops 1>&2; exit 3"),
                tempDir, Duration.ofSeconds(10));

        assertEquals(3, result.exitCode());
        assertTrue(result.stdout().contains("marker.txt"));
        assertTrue(result.stderr().contains("oops"));
        assertFalse(result.timedOut());
        assertFalse(result.notFound());
        assertFalse(result.isSuccess());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should report a timeout instead of hanging")
    void run_shouldTimeOut() {
        CommandResult result = runner.run(List.of("sleep", "10"), tempDir, Duration.ofMillis(300));

        assertTrue(result.timedOut());
        assertEquals(1, result.exitCode());
        assertTrue(result.stderr().startsWith("Command timed out after"));
    }

    @Test
    @DisplayName("missing executable should be reported as not found")
    void run_shouldReportNotFound() {
        CommandResult result = runner.run(List.of("definitely-not-a-real-tool-4711"), tempDir, Duration.ofSeconds(5));

        assertTrue(result.notFound());
        assertEquals(CommandResult.EXIT_NOT_FOUND, result.exitCode());
        assertEquals("Command not found: definitely-not-a-real-tool-4711", result.stderr());
    }

    @Test
    @DisplayName("missing working directory should be an infrastructure failure")
    void run_missingWorkingDir() {
        CommandResult result = runner.run(List.of("echo"), tempDir.resolve("gone"), Duration.ofSeconds(5));

        assertEquals(CommandResult.EXIT_INFRASTRUCTURE, result.exitCode());
        assertTrue(result.stderr().contains("E301"));
    }

    @Test
    @DisplayName("invalid arguments should be rejected")
    void run_invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> runner.run(List.of(), tempDir, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> runner.run(List.of("echo"), tempDir, Duration.ZERO));
    }

    @Test
    @DisplayName("transcript should record every command block")
    void transcript_shouldRecordBlocks() {
        CommandTranscript transcript = new CommandTranscript();
        assertTrue(transcript.isEmpty());

        transcript.record(List.of("cmake", "--build", "."), CommandResult.notFound("cmake"));
        transcript.note("Falling back");
        transcript.record(List.of("./calc_tests"), CommandResult.completed(0, "ok\n", "", 12));

        assertEquals("$ cmake --build .\nexit_code=127\nCommand not found: cmake"
                + "\n\nERROR [E101]: Command not found: cmake"
                + "\n\nFalling back"
                + "\n\n$ ./calc_tests\nexit_code=0\nok\n", transcript.toString());
    }

    @Test
    @DisplayName("timeouts and empty reports should leave coded error lines")
    void transcript_shouldCarryErrorCodes() {
        CommandTranscript transcript = new CommandTranscript();

        transcript.record(List.of("ctest", "--output-on-failure"), CommandResult.timeout(5, "partial", 5000));
        transcript.emptyReport("/tmp/ctest-results.xml");

        String text = transcript.toString();
        assertTrue(text.contains("exit_code=1\npartial\n"));
        assertTrue(text.contains("ERROR [E102]: Command timed out after "));
        assertTrue(text.contains("s (ctest)"));
        assertTrue(text.endsWith("ERROR [E201]: Report contained no test cases (/tmp/ctest-results.xml)"));
    }
}
