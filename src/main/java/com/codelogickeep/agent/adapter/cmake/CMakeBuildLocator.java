package com.codelogickeep.agent.adapter.cmake;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds an already configured CMake build directory.
 */
public final class CMakeBuildLocator {
    static final List<String> CANDIDATE_DIRS = List.of("build", "cmake-build-debug", "cmake-build-release");

    private CMakeBuildLocator() {
    }

    /**
     * The first conventional build directory that looks configured, else the project root
     * when it carries CMake artifacts itself, else empty.
     */
    public static Optional<Path> findBuildDir(Path projectRoot) {
        for (String dirName : CANDIDATE_DIRS) {
            Path candidate = projectRoot.resolve(dirName);
            if (looksLikeBuildDir(candidate)) {
                return Optional.of(candidate);
            }
        }
        return looksLikeBuildDir(projectRoot) ? Optional.of(projectRoot) : Optional.empty();
    }

    static boolean looksLikeBuildDir(Path dir) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        return Files.isRegularFile(dir.resolve("CMakeCache.txt"))
                || Files.isRegularFile(dir.resolve("CTestTestfile.cmake"))
                || Files.isDirectory(dir.resolve("Testing"));
    }
}
