package com.codelogickeep.agent.adapter.cmake;

import com.codelogickeep.agent.adapter.detect.ProjectScanner;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Locates compiled test executables for direct execution.
 */
public class BinaryDiscovery {
    static final Set<String> EXCLUDED_EXTENSIONS = Set.of(".cpp", ".cc", ".cxx", ".h", ".hpp", ".txt", ".cmake");

    private final ProjectScanner scanner;

    public BinaryDiscovery(ProjectScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * Executables whose file name matches one of {@code nameGlobs}, searching the build
     * directory first and then the project root. Duplicates are removed by real path; the
     * first occurrence keeps its position. The walk is not bounded by the detection scan
     * limit, so a binary deep in a large build tree is still found.
     */
    public List<Path> discover(Path projectRoot, Path buildDir, List<String> nameGlobs) {
        List<PathMatcher> matchers = nameGlobs.stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
        List<Path> roots = new ArrayList<>();
        if (buildDir != null) {
            roots.add(buildDir);
        }
        roots.add(projectRoot);

        Set<Path> ordered = new LinkedHashSet<>();
        for (Path root : roots) {
            for (PathMatcher matcher : matchers) {
                List<Path> found = scanner.findFiles(root,
                        path -> matcher.matches(path.getFileName()) && isExecutableFile(path),
                        Integer.MAX_VALUE, Integer.MAX_VALUE);
                for (Path candidate : found) {
                    ordered.add(realPath(candidate));
                }
            }
        }
        return new ArrayList<>(ordered);
    }

    /**
     * Keeps binaries whose stem matches a requested test file's stem, case-insensitively.
     * When nothing was requested, or nothing matches, every binary is kept.
     */
    public static List<Path> select(List<Path> binaries, List<Path> testFiles) {
        if (testFiles == null || testFiles.isEmpty()) {
            return binaries;
        }
        Set<String> wanted = testFiles.stream()
                .map(file -> stem(file).toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<Path> filtered = binaries.stream()
                .filter(binary -> wanted.contains(stem(binary).toLowerCase(Locale.ROOT)))
                .toList();
        return filtered.isEmpty() ? binaries : filtered;
    }

    static boolean isExecutableFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot >= 0 && EXCLUDED_EXTENSIONS.contains(name.substring(dot))) {
            return false;
        }
        return Files.isExecutable(path);
    }

    /**
     * File name without its last extension.
     */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}
