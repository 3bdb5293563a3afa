package com.codelogickeep.agent.adapter.framework.unit;

import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.RunOptions;
import com.codelogickeep.agent.adapter.model.CaseStatus;
import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GTestAdapter Tests")
class GTestAdapterTest {

    @TempDir
    Path tempDir;

    private final GTestAdapter adapter = new GTestAdapter(AdapterContext.defaults());

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
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
        @DisplayName("CMakeLists mentioning gtest without a marker should not be detected")
        void nameOnlyCMake() throws IOException {
            write("CMakeLists.txt", "project(demo)\n# TODO: add gtest\n");

            assertFalse(adapter.detect(tempDir));
        }

        @Test
        @DisplayName("find_package(GTest) should be detected")
        void findPackage() throws IOException {
            write("CMakeLists.txt", "cmake_minimum_required(VERSION 3.14)\nfind_package(GTest REQUIRED)\n");

            assertTrue(adapter.detect(tempDir));
        }

        @Test
        @DisplayName("gtest include in a nested source should be detected")
        void includeInSource() throws IOException {
            write("src/calc/calc_math.cc", "#include \"gtest/gtest.h\"\nTEST(Calc, Adds) {}\n");

            assertTrue(adapter.detect(tempDir));
        }

        @Test
        @DisplayName("test file name pattern should be detected")
        void testFilePattern() throws IOException {
            write("tests/calc_test.cpp", "int main() {}\n");

            assertTrue(adapter.detect(tempDir));
        }
    }

    @Test
    @DisplayName("metadata should describe Google Test")
    void metadata() {
        assertEquals("gtest", adapter.name());
        assertEquals("cpp", adapter.language());
        assertEquals(List.of("cmake"), adapter.getRequiredCommands());
        assertTrue(adapter.getRequiredPackages().isEmpty());
        assertTrue(adapter.getTestPattern().contains("**/*_test.cpp"));
        assertTrue(adapter.getPromptTemplate().load().contains("GoogleTest"));
        assertEquals("prompts/gtest.md", adapter.getPromptTemplate().resourcePath());
    }

    @Test
    @DisplayName("validation should check C++ syntax")
    void validateTest_checksCpp() {
        ValidationResult valid = adapter.validateTest("""
                #include <gtest/gtest.h>

                int add(int a, int b) {
                  return a + b;
                }

                TEST(CalcTest, Adds) {
                  EXPECT_EQ(add(2, 3), 5);
                }
                """);
        assertTrue(valid.valid());
        assertTrue(valid.warnings().isEmpty());

        ValidationResult broken = adapter.validateTest("int x = ;\n");
        assertFalse(broken.valid());
        assertFalse(broken.errors().isEmpty());
        assertTrue(broken.errors().stream().allMatch(e -> e.startsWith("Syntax error at line 1-")));
    }

    @Test
    @DisplayName("missing project directory should be reported, not thrown")
    void runTests_missingProject() {
        RunResult result = adapter.runTests(tempDir.resolve("missing"), RunOptions.defaults());

        assertFalse(result.isSuccess());
        assertTrue(result.getRawOutput().startsWith("ERROR [E302]: Project directory does not exist"));
        assertTrue(result.isFrozen());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should run an unconfigured project's test binary directly")
    void runTests_directBinary() throws IOException {
        Path binary = tempDir.resolve("calc_tests");
        Files.writeString(binary, """
                #!/bin/sh
                report="${1#--gtest_output=xml:}"
                cat > "$report" <<'XML'
                <?xml version="1.0" encoding="UTF-8"?>
                <testsuites tests="2" failures="1" name="AllTests">
                  <testsuite name="Calc" tests="2" failures="1">
                    <testcase name="Adds" status="run" result="completed" time="0.001" classname="Calc"/>
                    <testcase name="Divides" status="run" result="completed" time="0.002" classname="Calc">
                      <failure message="calc_test.cpp:12&#x0A;Expected equality" type=""/>
                    </testcase>
                  </testsuite>
                </testsuites>
                XML
                echo "[  FAILED  ] 1 test, listed below:"
                exit 1
                """);
        Files.setPosixFilePermissions(binary, PosixFilePermissions.fromString("rwxr-xr-x"));

        RunResult result = adapter.runTests(tempDir, RunOptions.builder().timeout(Duration.ofSeconds(30)).build());

        assertEquals(1, result.getPassed());
        assertEquals(1, result.getFailed());
        assertFalse(result.isSuccess());
        assertEquals(CaseStatus.FAILED, result.getTestCases().get(1).status());
        assertEquals("calc_test.cpp:12\nExpected equality", result.getTestCases().get(1).failureMessage());
        assertTrue(result.getRawOutput().contains("exit_code=1"));
        assertTrue(result.getRawOutput().contains("[  FAILED  ] 1 test"));
    }
}
