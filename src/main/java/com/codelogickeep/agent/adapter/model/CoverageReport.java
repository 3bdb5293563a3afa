package com.codelogickeep.agent.adapter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified coverage report produced by a {@code CoverageAdapter}.
 * Keyed by source file path.
 */
public class CoverageReport {
    private final Map<String, FileCoverage> files = new LinkedHashMap<>();

    public void addFile(FileCoverage file) {
        files.merge(file.filePath(), file, FileCoverage::plus);
    }

    public Map<String, FileCoverage> getFiles() {
        return Collections.unmodifiableMap(files);
    }

    public double getOverallLineCoverage() {
        int covered = files.values().stream().mapToInt(FileCoverage::linesCovered).sum();
        int missed = files.values().stream().mapToInt(FileCoverage::linesMissed).sum();
        return percentage(covered, missed);
    }

    public double getOverallBranchCoverage() {
        int covered = files.values().stream().mapToInt(FileCoverage::branchesCovered).sum();
        int missed = files.values().stream().mapToInt(FileCoverage::branchesMissed).sum();
        return percentage(covered, missed);
    }

    static double percentage(int covered, int missed) {
        int total = covered + missed;
        if (total == 0) {
            return 100.0;
        }
        return covered * 100.0 / total;
    }

    /**
     * Line and branch counters for one source file.
     */
    public record FileCoverage(String filePath, int linesCovered, int linesMissed,
                               int branchesCovered, int branchesMissed) {

        public double lineCoverage() {
            return percentage(linesCovered, linesMissed);
        }

        public double branchCoverage() {
            return percentage(branchesCovered, branchesMissed);
        }

        FileCoverage plus(FileCoverage other) {
            return new FileCoverage(filePath,
                    linesCovered + other.linesCovered, linesMissed + other.linesMissed,
                    branchesCovered + other.branchesCovered, branchesMissed + other.branchesMissed);
        }
    }
}
