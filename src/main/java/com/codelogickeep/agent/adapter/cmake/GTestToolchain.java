package com.codelogickeep.agent.adapter.cmake;

import com.codelogickeep.agent.adapter.report.GTestJsonReportParser;
import com.codelogickeep.agent.adapter.report.JUnitXmlDialect;
import com.codelogickeep.agent.adapter.report.JUnitXmlReportParser;
import com.codelogickeep.agent.adapter.report.ReportParser;

import java.nio.file.Path;
import java.util.List;

/**
 * GoogleTest binaries, reporting through {@code --gtest_output}.
 */
public class GTestToolchain implements CMakeToolchain {
    private final boolean jsonOutput;

    /**
     * @param outputFormat "xml" or "json"
     */
    public GTestToolchain(String outputFormat) {
        this.jsonOutput = "json".equalsIgnoreCase(outputFormat);
    }

    @Override
    public String displayName() {
        return "Google Test";
    }

    @Override
    public List<String> binaryGlobs() {
        return List.of("*test*", "*_tests");
    }

    @Override
    public ReportParser ctestReportParser() {
        return new JUnitXmlReportParser(JUnitXmlDialect.GTEST);
    }

    @Override
    public DirectInvocation directInvocation(Path binary, Path reportDir, int index) {
        if (jsonOutput) {
            Path report = reportDir.resolve("gtest-" + index + ".json");
            return new DirectInvocation(List.of(binary.toString(), "--gtest_output=json:" + report),
                    report, new GTestJsonReportParser());
        }
        Path report = reportDir.resolve("gtest-" + index + ".xml");
        return new DirectInvocation(List.of(binary.toString(), "--gtest_output=xml:" + report),
                report, new JUnitXmlReportParser(JUnitXmlDialect.GTEST));
    }
}
