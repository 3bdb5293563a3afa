package com.codelogickeep.agent.adapter.coverage;

import com.codelogickeep.agent.adapter.model.CoverageReport;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Collects coverage for a project after its tests ran. Failures never affect the test result.
 */
public interface CoverageAdapter {

    String name();

    CoverageReport runCoverage(Path projectRoot, List<Path> testFiles, Duration timeout) throws IOException;
}
