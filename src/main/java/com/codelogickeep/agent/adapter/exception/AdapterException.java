package com.codelogickeep.agent.adapter.exception;

/**
 * Unified exception for failures inside the adapter layer.
 * <p>
 * Adapters catch it at their boundary and report it through the run transcript,
 * so callers of {@code TestFrameworkAdapter} never have to handle it themselves.
 * The registry and the configuration loader do throw it to their callers.
 */
public class AdapterException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String context;

    public AdapterException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public AdapterException(ErrorCode errorCode, String message, String context) {
        this(errorCode, message, context, null);
    }

    public AdapterException(ErrorCode errorCode, String message, String context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getContext() {
        return context;
    }

    /**
     * One-line form written into run transcripts, e.g. {@code ERROR [E101]: Command not found: cmake}.
     */
    public String toTranscriptLine() {
        StringBuilder sb = new StringBuilder();
        sb.append("ERROR [").append(errorCode.getCode()).append("]: ").append(getMessage());
        if (context != null && !context.isEmpty()) {
            sb.append(" (").append(context).append(")");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toTranscriptLine();
    }

    /**
     * Error codes grouped by stage.
     */
    public enum ErrorCode {
        // Execution (1xx)
        TOOL_NOT_FOUND("E101", "Required executable not found"),
        COMMAND_TIMEOUT("E102", "Command exceeded its time budget"),

        // Reports (2xx)
        MALFORMED_REPORT("E201", "Report could not be parsed"),
        REPORT_NOT_FOUND("E202", "Expected report artifact was not produced"),

        // Environment (3xx)
        INFRASTRUCTURE_ERROR("E301", "Operating system or subprocess failure"),
        PROJECT_TARGET_NOT_FOUND("E302", "Project has no runnable test target"),

        // Registry (4xx)
        ADAPTER_NOT_FOUND("E401", "No adapter registered under that name"),

        // Configuration (5xx)
        CONFIG_NOT_FOUND("E501", "Configuration file not found"),
        CONFIG_INVALID("E502", "Invalid configuration"),

        UNKNOWN_ERROR("E999", "Unknown error occurred");

        private final String code;
        private final String description;

        ErrorCode(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }
}
