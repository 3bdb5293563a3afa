package com.codelogickeep.agent.adapter.model;

/**
 * Outcome of a single test case, folded from each framework's native vocabulary.
 */
public enum CaseStatus {
    PASSED,
    FAILED,
    SKIPPED,
    ERROR
}
