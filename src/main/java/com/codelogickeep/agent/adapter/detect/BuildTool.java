package com.codelogickeep.agent.adapter.detect;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * JVM build tool driving a project's tests. Gradle wins when a Gradle build declares JUnit;
 * everything else is treated as Maven.
 */
public enum BuildTool {
    GRADLE,
    MAVEN;

    public static final List<String> GRADLE_FILES = List.of("build.gradle", "build.gradle.kts");
    public static final Pattern JUNIT_DEPENDENCY = Pattern.compile("junit-jupiter|org\\.junit\\.jupiter|junit:junit",
            Pattern.CASE_INSENSITIVE);

    public static BuildTool of(ProjectScanner scanner, Path projectRoot) {
        boolean gradle = GRADLE_FILES.stream()
                .anyMatch(file -> scanner.fileMatches(projectRoot, file, JUNIT_DEPENDENCY));
        return gradle ? GRADLE : MAVEN;
    }

    /**
     * The project's wrapper script when it ships one, else the tool on PATH.
     */
    public String launcher(Path projectRoot) {
        List<String> wrappers = this == GRADLE ? List.of("gradlew", "gradlew.bat") : List.of("mvnw");
        for (String wrapper : wrappers) {
            Path script = projectRoot.resolve(wrapper);
            if (Files.isRegularFile(script)) {
                return script.toAbsolutePath().toString();
            }
        }
        return this == GRADLE ? "gradle" : "mvn";
    }
}
