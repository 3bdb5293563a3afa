package com.codelogickeep.agent.adapter.cmake;

import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandResult;
import com.codelogickeep.agent.adapter.report.ReportParser;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * What differs between the CMake-built frameworks the orchestrator drives.
 */
public interface CMakeToolchain {

    /**
     * Human-readable framework name used in transcript messages, e.g. "Google Test".
     */
    String displayName();

    /**
     * File-name globs of compiled test executables.
     */
    List<String> binaryGlobs();

    /**
     * Parser for the JUnit XML CTest writes with {@code --output-junit}.
     */
    ReportParser ctestReportParser();

    /**
     * Command line and report location for running one binary directly.
     */
    DirectInvocation directInvocation(Path binary, Path reportDir, int index);

    /**
     * Result recovered from a binary that wrote no report file. Empty when the toolchain
     * has nothing to fall back on.
     */
    default Optional<RunResult> parseWithoutReport(CommandResult result, String transcript) {
        return Optional.empty();
    }

    record DirectInvocation(List<String> command, Path reportFile, ReportParser parser) {
    }
}
