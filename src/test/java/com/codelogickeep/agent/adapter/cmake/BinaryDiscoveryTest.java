package com.codelogickeep.agent.adapter.cmake;

import com.codelogickeep.agent.adapter.config.AdapterConfig;
import com.codelogickeep.agent.adapter.detect.ProjectScanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BinaryDiscovery Tests")
class BinaryDiscoveryTest {

    @TempDir
    Path tempDir;

    private static Path file(Path path, boolean executable) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, "x");
        if (executable) {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxr-xr-x"));
        }
        return path;
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should find executables, build directory first, skipping sources and hidden dirs")
    void discover_shouldFindExecutables() throws IOException {
        Path build = tempDir.resolve("build");
        Path inBuild = file(build.resolve("calc_tests"), true);
        Path inRoot = file(tempDir.resolve("bin/io_test"), true);
        file(tempDir.resolve("src/calc_test.cpp"), true);
        file(tempDir.resolve("bin/readme_test"), false);
        file(tempDir.resolve(".cache/old_tests"), true);

        List<Path> found = new BinaryDiscovery(new ProjectScanner()).discover(tempDir, build, List.of("*test*", "*_tests"));

        assertEquals(List.of(inBuild.toRealPath(), inRoot.toRealPath()), found);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("binaries past the detection scan limit should still be found")
    void discover_shouldIgnoreDetectionLimit() throws IOException {
        AdapterConfig.DetectionConfig config = new AdapterConfig.DetectionConfig();
        config.setMaxScannedFiles(50);
        Path build = tempDir.resolve("build");
        for (int dir = 0; dir < 20; dir++) {
            for (int i = 0; i < 60; i++) {
                file(build.resolve(String.format("obj%02d/unit%02d.o", dir, i)), false);
            }
        }
        Path binary = file(build.resolve("zz/calc_tests"), true);

        List<Path> found = new BinaryDiscovery(new ProjectScanner(config)).discover(tempDir, build, List.of("*_tests"));

        assertEquals(List.of(binary.toRealPath()), found);
    }

    @Test
    @DisplayName("selection should match stems and fall back to everything")
    void select_shouldFilterByStem() {
        List<Path> binaries = List.of(Path.of("/b/calc_test"), Path.of("/b/io_test"));

        assertEquals(List.of(Path.of("/b/calc_test")),
                BinaryDiscovery.select(binaries, List.of(Path.of("tests/Calc_Test.cpp"))));
        assertEquals(binaries, BinaryDiscovery.select(binaries, List.of(Path.of("tests/other_test.cpp"))));
        assertEquals(binaries, BinaryDiscovery.select(binaries, List.of()));
    }

    @Test
    @DisplayName("stem should drop only the last extension")
    void stem_shouldDropLastExtension() {
        assertEquals("calc.test", BinaryDiscovery.stem(Path.of("calc.test.cpp")));
        assertEquals(".hidden", BinaryDiscovery.stem(Path.of(".hidden")));
        assertEquals("calc_tests", BinaryDiscovery.stem(Path.of("calc_tests")));
    }

    @Test
    @DisplayName("build directory lookup should prefer conventional names")
    void findBuildDir_shouldPreferConventionalNames() throws IOException {
        assertEquals(Optional.empty(), CMakeBuildLocator.findBuildDir(tempDir));

        file(tempDir.resolve("CTestTestfile.cmake"), false);
        assertEquals(Optional.of(tempDir), CMakeBuildLocator.findBuildDir(tempDir));

        Files.createDirectories(tempDir.resolve("cmake-build-debug/Testing"));
        assertEquals(Optional.of(tempDir.resolve("cmake-build-debug")), CMakeBuildLocator.findBuildDir(tempDir));

        Files.createDirectories(tempDir.resolve("build"));
        assertEquals(Optional.of(tempDir.resolve("cmake-build-debug")), CMakeBuildLocator.findBuildDir(tempDir));
    }
}
