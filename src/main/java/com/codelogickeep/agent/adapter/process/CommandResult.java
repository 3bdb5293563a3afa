package com.codelogickeep.agent.adapter.process;

/**
 * Outcome of one subprocess invocation.
 * <p>
 * {@code timedOut} and {@code notFound} are separate from an ordinary non-zero exit
 * because orchestrators branch on them: a timeout is terminal, a missing tool means
 * "toolchain absent" and may trigger a fallback.
 */
public record CommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean notFound,
        double durationMs
) {
    public static final int EXIT_NOT_FOUND = 127;
    public static final int EXIT_INFRASTRUCTURE = -1;

    public CommandResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public static CommandResult completed(int exitCode, String stdout, String stderr, double durationMs) {
        return new CommandResult(exitCode, stdout, stderr, false, false, durationMs);
    }

    public static CommandResult timeout(double timeoutSeconds, String stdout, double durationMs) {
        return new CommandResult(1, stdout, String.format("Command timed out after %.1fs", timeoutSeconds),
                true, false, durationMs);
    }

    public static CommandResult notFound(String executable) {
        return new CommandResult(EXIT_NOT_FOUND, "", "Command not found: " + executable, false, true, 0.0);
    }

    public static CommandResult infrastructureFailure(String message) {
        return new CommandResult(EXIT_INFRASTRUCTURE, "", message, false, false, 0.0);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut && !notFound;
    }
}
