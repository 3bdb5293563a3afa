package com.codelogickeep.agent.adapter.model;

/**
 * Result of a single test case execution.
 *
 * @param name           framework-specific identifier, usually dotted suite and test name
 * @param status         normalized outcome
 * @param durationMs     duration in milliseconds
 * @param failureMessage empty unless the case FAILED or ERRORed
 * @param filePath       best-effort source location, empty when unknown
 */
public record CaseResult(
        String name,
        CaseStatus status,
        double durationMs,
        String failureMessage,
        String filePath
) {
    public CaseResult {
        name = name != null ? name : "unknown";
        status = status != null ? status : CaseStatus.ERROR;
        failureMessage = failureMessage != null ? failureMessage : "";
        filePath = filePath != null ? filePath : "";
    }

    public static CaseResult passed(String name, double durationMs) {
        return new CaseResult(name, CaseStatus.PASSED, durationMs, "", "");
    }

    public static CaseResult failed(String name, double durationMs, String failureMessage) {
        return new CaseResult(name, CaseStatus.FAILED, durationMs, failureMessage, "");
    }

    public boolean isFailure() {
        return status == CaseStatus.FAILED || status == CaseStatus.ERROR;
    }
}
