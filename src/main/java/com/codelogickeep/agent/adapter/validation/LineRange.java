package com.codelogickeep.agent.adapter.validation;

/**
 * 1-based, inclusive line span of a syntax error.
 */
public record LineRange(int startLine, int endLine) {

    public LineRange {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + "-" + endLine);
        }
    }
}
