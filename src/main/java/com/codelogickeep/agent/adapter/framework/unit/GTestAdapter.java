package com.codelogickeep.agent.adapter.framework.unit;

import com.codelogickeep.agent.adapter.cmake.CMakeTestOrchestrator;
import com.codelogickeep.agent.adapter.cmake.GTestToolchain;
import com.codelogickeep.agent.adapter.coverage.CoverageAdapter;
import com.codelogickeep.agent.adapter.framework.AbstractTestFrameworkAdapter;
import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.RunOptions;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandTranscript;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * GoogleTest, built with CMake and run through CTest or directly.
 */
public class GTestAdapter extends AbstractTestFrameworkAdapter {
    static final String CMAKE_FILE = "CMakeLists.txt";
    static final List<String> CMAKE_MARKERS = List.of("find_package(gtest", "gtest_discover_tests", "target_link_libraries");
    static final Set<String> SOURCE_EXTENSIONS = Set.of(".cpp", ".cc", ".cxx", ".h", ".hh", ".hpp", ".hxx");
    private static final Pattern INCLUDE = Pattern.compile("#include\\s*[<\"]gtest/gtest\\.h[>\"]");
    private static final List<String> TEST_PATTERNS = List.of("**/*_test.cpp", "**/*_test.cc");

    private final CMakeTestOrchestrator orchestrator;

    public GTestAdapter() {
        this(AdapterContext.defaults());
    }

    public GTestAdapter(AdapterContext context) {
        this(context, null);
    }

    public GTestAdapter(AdapterContext context, CoverageAdapter coverageAdapter) {
        super(context, coverageAdapter);
        this.orchestrator = new CMakeTestOrchestrator(
                new GTestToolchain(context.config().getGtest().getOutputFormat()),
                context.commandRunner(), context.scanner());
    }

    @Override
    public String name() {
        return "gtest";
    }

    @Override
    public String language() {
        return "cpp";
    }

    @Override
    public boolean detect(Path projectRoot) {
        return context.scanner().configDeclares(projectRoot, CMAKE_FILE, "gtest", CMAKE_MARKERS)
                || context.scanner().anySourceMatches(projectRoot, SOURCE_EXTENSIONS, INCLUDE)
                || context.scanner().anyFileMatches(projectRoot, TEST_PATTERNS);
    }

    @Override
    public List<String> getTestPattern() {
        return TEST_PATTERNS;
    }

    @Override
    protected RunResult execute(Path projectRoot, RunOptions options, Path reportDir, CommandTranscript transcript) {
        return orchestrator.run(projectRoot, options.testFiles(), reportDir, options.timeout(), transcript);
    }

    @Override
    public List<String> getRequiredCommands() {
        return List.of("cmake");
    }
}
