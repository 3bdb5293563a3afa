package com.codelogickeep.agent.adapter.framework.unit;

import com.codelogickeep.agent.adapter.config.AdapterConfig;
import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.RunOptions;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandResult;
import com.codelogickeep.agent.adapter.process.CommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@DisplayName("PytestAdapter Tests")
class PytestAdapterTest {
    private static final String REPORT = "{\"duration\": 0.2, \"tests\": ["
            + "{\"nodeid\": \"tests/test_calc.py::test_add\", \"outcome\": \"passed\", \"call\": {\"duration\": 0.1}},"
            + "{\"nodeid\": \"tests/test_calc.py::test_sub\", \"outcome\": \"passed\", \"call\": {\"duration\": 0.1}}]}";

    @TempDir
    Path tempDir;

    @Mock
    private CommandRunner runner;

    private AdapterConfig config;
    private PytestAdapter adapter;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        config = new AdapterConfig();
        adapter = new PytestAdapter(AdapterContext.from(config).withCommandRunner(runner));
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static String reportPath(List<String> command) {
        return command.stream().filter(arg -> arg.startsWith("--json-report-file="))
                .findFirst().orElseThrow().substring("--json-report-file=".length());
    }

    @Test
    @DisplayName("validation should check Python syntax")
    void validateTest_checksPython() {
        assertTrue(adapter.validateTest("def test_add():\n    assert 1 + 1 == 2\n").valid());
        assertFalse(adapter.validateTest("def broken(:\n  return )))").valid());
        assertFalse(adapter.validateTest("def test_broken():\n    assert (1 +\n").valid());
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("empty project should not be detected")
        void emptyProject() {
            assertFalse(adapter.detect(tempDir));
        }

        @Test
        @DisplayName("conftest.py should be detected")
        void conftest() throws IOException {
            write("conftest.py", "");
            assertTrue(adapter.detect(tempDir));
        }

        @Test
        @DisplayName("pytest dependency in pyproject should be detected")
        void pyprojectDependency() throws IOException {
            write("pyproject.toml", "[project]\nname = \"calc\"\n\n[project.optional-dependencies]\ntest = [\"pytest>=7\"]\n");
            assertTrue(adapter.detect(tempDir));
        }

        @Test
        @DisplayName("pyproject without pytest should not be detected")
        void pyprojectWithoutPytest() throws IOException {
            write("pyproject.toml", "[project]\nname = \"calc\"\ndependencies = [\"requests\"]\n");
            assertFalse(adapter.detect(tempDir));
        }

        @Test
        @DisplayName("setup.cfg section should be detected")
        void setupCfg() throws IOException {
            write("setup.cfg", "[metadata]\nname = calc\n\n[tool:pytest]\ntestpaths = tests\n");
            assertTrue(adapter.detect(tempDir));
        }
    }

    @Nested
    @DisplayName("Command resolution")
    class CommandResolution {

        @Test
        @DisplayName("should default to pytest on PATH")
        void defaultCommand() {
            assertEquals("pytest", adapter.resolveCommand(tempDir));
        }

        @Test
        @DisplayName("should prefer a project virtualenv")
        void virtualenv() throws IOException {
            write("venv/bin/pytest", "#!/usr/bin/env python\n");

            assertEquals(tempDir.resolve("venv/bin/pytest").toAbsolutePath().toString(), adapter.resolveCommand(tempDir));
        }

        @Test
        @DisplayName("configured command should win over a virtualenv")
        void configuredCommand() throws IOException {
            write(".venv/bin/pytest", "");
            config.getPytest().setCommand("/opt/tools/pytest");

            assertEquals("/opt/tools/pytest", adapter.resolveCommand(tempDir));
        }
    }

    @Nested
    @DisplayName("Running")
    class Running {

        @Test
        @DisplayName("report file should be parsed and the report directory removed")
        void reportFile() {
            AtomicReference<Path> report = new AtomicReference<>();
            config.getPytest().setExtraArgs(List.of("-p", "no:cacheprovider"));
            when(runner.run(anyList(), any(), any())).thenAnswer(invocation -> {
                List<String> cmd = invocation.getArgument(0);
                assertEquals(List.of("pytest", "--json-report"), cmd.subList(0, 2));
                assertEquals(List.of("-q", "-p", "no:cacheprovider", "tests/test_calc.py"), cmd.subList(3, 7));
                report.set(Path.of(reportPath(cmd)));
                assertTrue(report.get().getParent().getFileName().toString().startsWith("polytest_pytest_"));
                Files.writeString(report.get(), REPORT);
                return CommandResult.completed(0, "..", "", 300);
            });

            RunResult result = adapter.runTests(tempDir,
                    RunOptions.builder().testFile(Path.of("tests/test_calc.py")).build());

            assertEquals(2, result.getPassed());
            assertTrue(result.isSuccess());
            assertEquals(200.0, result.getDurationMs(), 0.001);
            assertFalse(Files.exists(report.get().getParent()));
        }

        @Test
        @DisplayName("report printed to stdout should still be parsed")
        void stdoutFallback() {
            when(runner.run(anyList(), any(), any())).thenReturn(CommandResult.completed(0,
                    "==== test session starts ====\n" + REPORT + "\n==== 2 passed in 0.20s ====\n", "", 300));

            RunResult result = adapter.runTests(tempDir, RunOptions.defaults());

            assertEquals(2, result.getPassed());
        }

        @Test
        @DisplayName("missing pytest should be noted")
        void notFound() {
            when(runner.run(anyList(), any(), any())).thenReturn(CommandResult.notFound("pytest"));

            RunResult result = adapter.runTests(tempDir, RunOptions.defaults());

            assertFalse(result.isSuccess());
            assertTrue(result.getRawOutput().endsWith("pytest not found"));
        }

        @Test
        @DisplayName("timeout should fail the run")
        void timeout() {
            when(runner.run(anyList(), any(), any())).thenReturn(CommandResult.timeout(180, "collected 2 items", 180_000));

            RunResult result = adapter.runTests(tempDir, RunOptions.defaults());

            assertEquals(0, result.getTotal());
            assertTrue(result.getRawOutput().contains("Command timed out after"));
        }

        @Test
        @DisplayName("async run should complete with the same result")
        void async() {
            when(runner.run(anyList(), any(), any())).thenReturn(CommandResult.completed(0, REPORT, "", 10));

            CompletableFuture<RunResult> future = adapter.runTestsAsync(tempDir, RunOptions.defaults(), Runnable::run);

            assertEquals(2, future.join().getPassed());
        }
    }
}
