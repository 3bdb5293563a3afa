package com.codelogickeep.agent.adapter.detect;

import com.codelogickeep.agent.adapter.config.AdapterConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Read-only, bounded filesystem probes shared by every adapter's {@code detect}.
 * Never spawns processes; hidden directories (any segment starting with '.') are skipped.
 */
@Slf4j
public class ProjectScanner {
    private final int maxScannedFiles;
    private final int scanPrefixChars;

    public ProjectScanner() {
        this(new AdapterConfig.DetectionConfig());
    }

    public ProjectScanner(AdapterConfig.DetectionConfig config) {
        this.maxScannedFiles = config.getMaxScannedFiles();
        this.scanPrefixChars = config.getScanPrefixChars();
    }

    /**
     * True when {@code fileName} exists directly under the root and its lower-cased content
     * contains {@code frameworkName} and at least one of {@code markers}.
     * The name alone is not enough, so a comment mentioning the framework does not count.
     */
    public boolean configDeclares(Path root, String fileName, String frameworkName, List<String> markers) {
        Path config = root.resolve(fileName);
        if (!Files.isRegularFile(config)) {
            return false;
        }
        String content = readLowerCase(config);
        if (content == null || !content.contains(frameworkName.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return markers.stream().anyMatch(marker -> content.contains(marker.toLowerCase(Locale.ROOT)));
    }

    /**
     * True when the root-level file exists and contains {@code needle} verbatim.
     */
    public boolean fileContains(Path root, String fileName, String needle) {
        Path file = root.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return false;
        }
        String content = readFully(file);
        return content != null && content.contains(needle);
    }

    /**
     * True when the root-level file exists and {@code pattern} finds a match in it.
     */
    public boolean fileMatches(Path root, String fileName, Pattern pattern) {
        Path file = root.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return false;
        }
        String content = readFully(file);
        return content != null && pattern.matcher(content).find();
    }

    /**
     * True when any non-hidden file with one of the extensions has a match for
     * {@code pattern} within its first few kilobytes.
     */
    public boolean anySourceMatches(Path root, Set<String> extensions, Pattern pattern) {
        return !findFiles(root, path -> hasExtension(path, extensions)
                && pattern.matcher(readPrefix(path)).find(), 1).isEmpty();
    }

    /**
     * True when any non-hidden file matches one of the glob patterns (relative to root).
     * A leading {@code **}{@code /} also matches files directly in the root.
     */
    public boolean anyFileMatches(Path root, List<String> globs) {
        List<Predicate<Path>> matchers = globs.stream().map(this::globMatcher).toList();
        return !findFiles(root, path -> {
            Path relative = root.relativize(path);
            return matchers.stream().anyMatch(m -> m.test(relative));
        }, 1).isEmpty();
    }

    /**
     * Non-hidden regular files accepted by {@code filter}, in walk order, at most {@code limit}.
     * The walk gives up after the configured number of visited files.
     */
    public List<Path> findFiles(Path root, Predicate<Path> filter, int limit) {
        return findFiles(root, filter, limit, maxScannedFiles);
    }

    /**
     * As {@link #findFiles(Path, Predicate, int)}, visiting at most {@code maxVisited} files.
     */
    public List<Path> findFiles(Path root, Predicate<Path> filter, int limit, int maxVisited) {
        List<Path> found = new ArrayList<>();
        if (root == null || !Files.isDirectory(root)) {
            return found;
        }
        int[] visited = {0};
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (++visited[0] > maxVisited) {
                        log.warn("Scan limit of {} files reached under {}, remaining files were not examined",
                                maxVisited, root);
                        return FileVisitResult.TERMINATE;
                    }
                    if (attrs.isRegularFile() && !isHidden(file) && filter.test(file)) {
                        found.add(file);
                        if (found.size() >= limit) {
                            return FileVisitResult.TERMINATE;
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.debug("Scan of {} stopped early: {}", root, e.getMessage());
        }
        return found;
    }

    /**
     * First {@code scanPrefixChars} characters of a file, malformed bytes replaced.
     * Empty when the file cannot be read.
     */
    public String readPrefix(Path file) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (InputStream in = Files.newInputStream(file);
             Reader reader = new InputStreamReader(in, decoder)) {
            char[] buffer = new char[scanPrefixChars];
            int total = 0;
            int read;
            while (total < buffer.length && (read = reader.read(buffer, total, buffer.length - total)) != -1) {
                total += read;
            }
            return new String(buffer, 0, total);
        } catch (IOException e) {
            return "";
        }
    }

    public static String readFully(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return null;
        }
    }

    private static String readLowerCase(Path file) {
        String content = readFully(file);
        return content != null ? content.toLowerCase(Locale.ROOT) : null;
    }

    static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".") && !".".equals(name.toString());
    }

    private static boolean hasExtension(Path path, Set<String> extensions) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot));
    }

    private Predicate<Path> globMatcher(String glob) {
        FileSystem fs = FileSystems.getDefault();
        PathMatcher full = fs.getPathMatcher("glob:" + glob);
        if (!glob.startsWith("**/")) {
            return full::matches;
        }
        PathMatcher tail = fs.getPathMatcher("glob:" + glob.substring(3));
        return relative -> full.matches(relative) || (relative.getNameCount() == 1 && tail.matches(relative));
    }
}
