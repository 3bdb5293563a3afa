package com.codelogickeep.agent.adapter.report;

import java.util.Locale;
import java.util.Set;

/**
 * Differences between the JUnit-XML flavours written by GoogleTest, Catch2/CTest and
 * Surefire/Gradle. They share the element layout but disagree on how a skip is signalled
 * outside of a {@code <skipped>} element.
 */
public enum JUnitXmlDialect {
    /**
     * {@code status="notrun|disabled|skipped"} or {@code result="skipped"}.
     */
    GTEST(Set.of("notrun", "disabled", "skipped"), false),
    /**
     * Only the {@code <skipped>} element. CTest's {@code --output-junit} uses this form too.
     */
    CATCH2(Set.of(), false),
    /**
     * {@code status} containing "skipped".
     */
    SUREFIRE(Set.of("skipped"), true);

    private final Set<String> skipStatuses;
    private final boolean substringMatch;

    JUnitXmlDialect(Set<String> skipStatuses, boolean substringMatch) {
        this.skipStatuses = skipStatuses;
        this.substringMatch = substringMatch;
    }

    boolean isSkipped(String status, String result) {
        if (this == GTEST && result != null && "skipped".equalsIgnoreCase(result.trim())) {
            return true;
        }
        if (status == null || skipStatuses.isEmpty()) {
            return false;
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        if (substringMatch) {
            return skipStatuses.stream().anyMatch(normalized::contains);
        }
        return skipStatuses.contains(normalized);
    }
}
