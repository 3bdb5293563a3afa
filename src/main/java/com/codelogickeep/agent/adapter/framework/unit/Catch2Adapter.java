package com.codelogickeep.agent.adapter.framework.unit;

import com.codelogickeep.agent.adapter.cmake.CMakeTestOrchestrator;
import com.codelogickeep.agent.adapter.cmake.Catch2Toolchain;
import com.codelogickeep.agent.adapter.coverage.CoverageAdapter;
import com.codelogickeep.agent.adapter.framework.AbstractTestFrameworkAdapter;
import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.RunOptions;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandTranscript;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Catch2, built with CMake and run through CTest or directly. Binaries that write no
 * JUnit report fall back to their console summary.
 */
public class Catch2Adapter extends AbstractTestFrameworkAdapter {
    static final List<String> CMAKE_MARKERS = List.of(
            "find_package(catch2", "catch_discover_tests", "catch2::catch2", "catch2::catch2withmain");
    private static final Pattern INCLUDE = Pattern.compile("#include\\s*[<\"](catch2/catch[^\">]*|catch\\.hpp)[>\"]");
    private static final List<String> TEST_PATTERNS = List.of(
            "**/*_test.cpp", "**/*_test.cc", "**/*.catch2.cpp", "**/*_tests.cpp");
    // String literals are consumed whole so a ')' inside a test name does not end the argument list.
    private static final String MACRO_ARGS = "\\((?:\"(?:[^\"\\\\]|\\\\.)*\"|[^)\"])*\\)";
    private static final Pattern TEST_CASE_BLOCK = Pattern.compile("\\bTEST_CASE\\s*" + MACRO_ARGS + "\\s*\\{");
    private static final Pattern SECTION_BLOCK = Pattern.compile("\\bSECTION\\s*" + MACRO_ARGS + "\\s*\\{");

    private final CMakeTestOrchestrator orchestrator;

    public Catch2Adapter() {
        this(AdapterContext.defaults());
    }

    public Catch2Adapter(AdapterContext context) {
        this(context, null);
    }

    public Catch2Adapter(AdapterContext context, CoverageAdapter coverageAdapter) {
        super(context, coverageAdapter);
        this.orchestrator = new CMakeTestOrchestrator(new Catch2Toolchain(), context.commandRunner(), context.scanner());
    }

    @Override
    public String name() {
        return "catch2";
    }

    @Override
    public String language() {
        return "cpp";
    }

    @Override
    public boolean detect(Path projectRoot) {
        return context.scanner().configDeclares(projectRoot, GTestAdapter.CMAKE_FILE, "catch2", CMAKE_MARKERS)
                || context.scanner().anySourceMatches(projectRoot, GTestAdapter.SOURCE_EXTENSIONS, INCLUDE)
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

    /**
     * Rewrites TEST_CASE and SECTION macro headers into plain C++ blocks, which a C++ grammar
     * would otherwise reject.
     */
    @Override
    protected String normalizeForValidation(String testCode) {
        String normalized = TEST_CASE_BLOCK.matcher(testCode).replaceAll("void catch2_test_case() {");
        return SECTION_BLOCK.matcher(normalized).replaceAll("{");
    }

    @Override
    public List<String> getRequiredCommands() {
        return List.of("cmake");
    }
}
