package com.codelogickeep.agent.adapter.report;

import com.codelogickeep.agent.adapter.model.RunResult;

/**
 * Converts one native report format into the canonical {@link RunResult}.
 * <p>
 * Implementations are pure and must never throw: empty, truncated or garbage input
 * yields a result with {@code total == 0}, which is never successful.
 */
@FunctionalInterface
public interface ReportParser {

    /**
     * @param reportText raw report content
     * @param transcript diagnostic transcript to carry into {@link RunResult#getRawOutput()}
     */
    RunResult parse(String reportText, String transcript);
}
