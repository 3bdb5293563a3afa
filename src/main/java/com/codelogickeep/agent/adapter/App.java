package com.codelogickeep.agent.adapter;

import com.codelogickeep.agent.adapter.config.AdapterConfig;
import com.codelogickeep.agent.adapter.config.ConfigLoader;
import com.codelogickeep.agent.adapter.exception.AdapterException;
import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.RunOptions;
import com.codelogickeep.agent.adapter.framework.TestFrameworkAdapter;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.model.ValidationResult;
import com.codelogickeep.agent.adapter.registry.AdapterRegistry;
import com.codelogickeep.agent.adapter.registry.EnvironmentChecker;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "polytest", mixinStandardHelpOptions = true, version = "0.1.0",
        description = "Detects, runs and normalizes third-party test frameworks.",
        subcommands = {App.ListCommand.class, App.DetectCommand.class, App.RunCommand.class, App.ValidateCommand.class})
public class App implements Callable<Integer> {

    @Option(names = {"-c", "--config"}, description = "Additional adapters.yml, merged over the default layers")
    private Path configPath;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new App())
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    cmd.getErr().println(ex instanceof AdapterException adapterException
                            ? adapterException.toTranscriptLine() : ex.getMessage());
                    return 1;
                })
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        new CommandLine(this).usage(System.out);
        return 0;
    }

    AdapterConfig loadConfig() {
        return new ConfigLoader().load(configPath);
    }

    AdapterRegistry registry() {
        return AdapterRegistry.discover(AdapterContext.from(loadConfig()));
    }

    static ObjectMapper jsonMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Command(name = "list", description = "List registered adapters and any missing executables.")
    static class ListCommand implements Callable<Integer> {
        @ParentCommand
        private App parent;

        @Override
        public Integer call() {
            EnvironmentChecker checker = new EnvironmentChecker();
            for (TestFrameworkAdapter adapter : parent.registry().all()) {
                List<String> missing = checker.missingCommands(adapter);
                System.out.printf("%-8s %-8s %s%n", adapter.name(), adapter.language(),
                        missing.isEmpty() ? "OK" : "missing: " + String.join(", ", missing));
            }
            return 0;
        }
    }

    @Command(name = "detect", description = "Print the adapters that recognise a project.")
    static class DetectCommand implements Callable<Integer> {
        @ParentCommand
        private App parent;

        @Parameters(index = "0", description = "Project directory")
        private Path projectDir;

        @Override
        public Integer call() {
            List<TestFrameworkAdapter> detected = parent.registry().detectAll(projectDir);
            if (detected.isEmpty()) {
                System.err.println("No supported test framework detected in " + projectDir);
                return 1;
            }
            detected.forEach(adapter -> System.out.println(adapter.name()));
            return 0;
        }
    }

    @Command(name = "run", description = "Run a project's tests and print the normalized result as JSON.")
    static class RunCommand implements Callable<Integer> {
        @ParentCommand
        private App parent;

        @Parameters(index = "0", description = "Project directory")
        private Path projectDir;

        @Option(names = {"-a", "--adapter"}, description = "Adapter name; detected when omitted")
        private String adapterName;

        @Option(names = {"-f", "--test-file"}, description = "Restrict the run to this test file (repeatable)")
        private List<Path> testFiles = new ArrayList<>();

        @Option(names = {"--timeout"}, description = "Per-command timeout in seconds")
        private Long timeoutSeconds;

        @Option(names = {"--coverage"}, description = "Collect coverage after the run")
        private boolean coverage;

        @Override
        public Integer call() throws IOException {
            AdapterConfig config = parent.loadConfig();
            AdapterRegistry registry = AdapterRegistry.discover(AdapterContext.from(config));
            TestFrameworkAdapter adapter;
            try {
                adapter = selectAdapter(registry);
            } catch (AdapterException e) {
                System.err.println(e.toTranscriptLine());
                return 1;
            }

            RunOptions.RunOptionsBuilder options = RunOptions.from(config.getExecution()).toBuilder()
                    .testFiles(testFiles);
            if (timeoutSeconds != null) {
                options.timeout(Duration.ofSeconds(timeoutSeconds));
            }
            if (coverage) {
                options.collectCoverage(true);
            }
            RunResult result = adapter.runTests(projectDir, options.build());
            System.out.println(jsonMapper().writeValueAsString(result));
            return result.isSuccess() ? 0 : 1;
        }

        private TestFrameworkAdapter selectAdapter(AdapterRegistry registry) {
            if (adapterName != null) {
                return registry.require(adapterName);
            }
            return registry.detectAll(projectDir).stream().findFirst().orElseThrow(() ->
                    new AdapterException(AdapterException.ErrorCode.ADAPTER_NOT_FOUND,
                            "No supported test framework detected", projectDir.toString()));
        }
    }

    @Command(name = "validate", description = "Syntax-check a test source file without running it.")
    static class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        private App parent;

        @Option(names = {"-a", "--adapter"}, required = true, description = "Adapter whose language to check")
        private String adapterName;

        @Parameters(index = "0", description = "Test source file")
        private Path testFile;

        @Override
        public Integer call() throws IOException {
            TestFrameworkAdapter adapter;
            try {
                adapter = parent.registry().require(adapterName);
            } catch (AdapterException e) {
                System.err.println(e.toTranscriptLine());
                return 1;
            }
            ValidationResult result = adapter.validateTest(Files.readString(testFile, StandardCharsets.UTF_8));
            System.out.println(jsonMapper().writeValueAsString(result));
            return result.valid() ? 0 : 1;
        }
    }
}
