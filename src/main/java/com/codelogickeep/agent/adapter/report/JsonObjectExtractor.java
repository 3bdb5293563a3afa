package com.codelogickeep.agent.adapter.report;

import java.util.Optional;

/**
 * Finds the first balanced JSON object in text that may carry banner output around it.
 * <p>
 * Braces are depth-counted, skipping braces inside string literals and escaped quotes,
 * so a trailing log line containing '}' cannot extend the span.
 */
public final class JsonObjectExtractor {

    private JsonObjectExtractor() {
    }

    public static Optional<String> firstObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }
}
