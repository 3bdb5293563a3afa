package com.codelogickeep.agent.adapter.process;

import com.codelogickeep.agent.adapter.exception.AdapterException;
import com.codelogickeep.agent.adapter.exception.AdapterException.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Running diagnostic log for one {@code runTests} call.
 * Every command is recorded as {@code $ <cmd>}, {@code exit_code=<n>}, stdout, stderr,
 * whatever its outcome, so a caller can always tell which stage failed. A missing executable
 * or a timeout is followed by its {@code ERROR [Exxx]} line.
 */
public class CommandTranscript {
    private final List<String> parts = new ArrayList<>();

    public void record(List<String> command, CommandResult result) {
        List<String> block = new ArrayList<>();
        block.add("$ " + String.join(" ", command));
        block.add("exit_code=" + result.exitCode());
        if (!result.stdout().isEmpty()) {
            block.add(result.stdout());
        }
        if (!result.stderr().isEmpty()) {
            block.add(result.stderr());
        }
        parts.add(String.join("\n", block));
        if (result.notFound()) {
            error(new AdapterException(ErrorCode.TOOL_NOT_FOUND, result.stderr()));
        } else if (result.timedOut()) {
            error(new AdapterException(ErrorCode.COMMAND_TIMEOUT, result.stderr(), command.get(0)));
        }
    }

    public void note(String message) {
        parts.add(message);
    }

    public void error(AdapterException e) {
        parts.add(e.toTranscriptLine());
    }

    /**
     * Records that a report was found but yielded no test cases.
     */
    public void emptyReport(String report) {
        error(new AdapterException(ErrorCode.MALFORMED_REPORT, "Report contained no test cases", report));
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    @Override
    public String toString() {
        return String.join("\n\n", parts);
    }
}
