package com.codelogickeep.agent.adapter.report;

/**
 * Builds a case's failure message from a structured message attribute and a free-text body.
 */
public final class FailureMessages {

    private FailureMessages() {
    }

    public static String compose(String message, String body) {
        String msg = message != null ? message : "";
        String text = body != null ? body.strip() : "";
        if (!msg.isEmpty() && !text.isEmpty()) {
            return msg + "\n" + text;
        }
        if (!msg.isEmpty()) {
            return msg;
        }
        return text;
    }
}
