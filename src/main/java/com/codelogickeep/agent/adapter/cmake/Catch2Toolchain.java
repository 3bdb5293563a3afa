package com.codelogickeep.agent.adapter.cmake;

import com.codelogickeep.agent.adapter.model.RunResult;
import com.codelogickeep.agent.adapter.process.CommandResult;
import com.codelogickeep.agent.adapter.report.Catch2ConsoleSummaryParser;
import com.codelogickeep.agent.adapter.report.JUnitXmlDialect;
import com.codelogickeep.agent.adapter.report.JUnitXmlReportParser;
import com.codelogickeep.agent.adapter.report.ReportParser;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Catch2 binaries, reporting through {@code --reporter junit}. When no report file appears,
 * the console summary is read instead.
 */
public class Catch2Toolchain implements CMakeToolchain {
    private final Catch2ConsoleSummaryParser consoleParser = new Catch2ConsoleSummaryParser();

    @Override
    public String displayName() {
        return "Catch2";
    }

    @Override
    public List<String> binaryGlobs() {
        return List.of("*test*", "*_tests", "*catch2*");
    }

    @Override
    public ReportParser ctestReportParser() {
        return new JUnitXmlReportParser(JUnitXmlDialect.CATCH2);
    }

    @Override
    public DirectInvocation directInvocation(Path binary, Path reportDir, int index) {
        Path report = reportDir.resolve("catch2-" + index + ".xml");
        return new DirectInvocation(
                List.of(binary.toString(), "--reporter", "junit", "--out", report.toString()),
                report, new JUnitXmlReportParser(JUnitXmlDialect.CATCH2));
    }

    @Override
    public Optional<RunResult> parseWithoutReport(CommandResult result, String transcript) {
        RunResult parsed = consoleParser.parse(result.stdout(), transcript);
        if (parsed.getTotal() > 0) {
            return Optional.of(parsed);
        }
        if (result.exitCode() != 0) {
            RunResult crashed = new RunResult(transcript);
            crashed.addErrors(1);
            return Optional.of(crashed);
        }
        return Optional.empty();
    }
}
