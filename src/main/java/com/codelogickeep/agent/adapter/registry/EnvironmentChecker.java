package com.codelogickeep.agent.adapter.registry;

import com.codelogickeep.agent.adapter.framework.TestFrameworkAdapter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks that the executables an adapter needs are on PATH, without running them.
 */
@Slf4j
public class EnvironmentChecker {
    private static final List<String> WINDOWS_SUFFIXES = List.of("", ".exe", ".cmd", ".bat");

    private final List<Path> searchPath;
    private final boolean windows;

    public EnvironmentChecker() {
        this(System.getenv("PATH"), System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
    }

    EnvironmentChecker(String pathVariable, boolean windows) {
        this.searchPath = new ArrayList<>();
        if (pathVariable != null) {
            for (String entry : pathVariable.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    searchPath.add(Paths.get(entry));
                }
            }
        }
        this.windows = windows;
    }

    /**
     * Required commands of {@code adapter} that cannot be found, in declaration order.
     */
    public List<String> missingCommands(TestFrameworkAdapter adapter) {
        List<String> missing = new ArrayList<>();
        for (String command : adapter.getRequiredCommands()) {
            if (!isOnPath(command)) {
                missing.add(command);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("{} is missing required commands: {}", adapter.name(), missing);
        }
        return missing;
    }

    public boolean isOnPath(String command) {
        List<String> suffixes = windows ? WINDOWS_SUFFIXES : List.of("");
        for (Path dir : searchPath) {
            for (String suffix : suffixes) {
                Path candidate = dir.resolve(command + suffix);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }
}
