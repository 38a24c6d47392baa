package com.candor.core.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Report lifecycle.
 *
 * <pre>
 * SUBMITTED -> UNDER_INVESTIGATION -> DECRYPTION_PENDING -> RESOLVED | DISMISSED | REFUNDED
 * UNDER_INVESTIGATION -> REFUNDED   (investigation timeout)
 * any open status -> RESOLVED | DISMISSED   (manual close)
 * </pre>
 *
 * RESOLVED, DISMISSED and REFUNDED are terminal. A report is never refunded before assignment.
 */
public enum ReportStatus {
    SUBMITTED,
    UNDER_INVESTIGATION,
    DECRYPTION_PENDING,
    RESOLVED,
    DISMISSED,
    REFUNDED;

    public Set<ReportStatus> successors() {
        return switch (this) {
            case SUBMITTED -> EnumSet.of(UNDER_INVESTIGATION, RESOLVED, DISMISSED);
            case UNDER_INVESTIGATION -> EnumSet.of(DECRYPTION_PENDING, RESOLVED, DISMISSED, REFUNDED);
            case DECRYPTION_PENDING -> EnumSet.of(RESOLVED, DISMISSED, REFUNDED);
            case RESOLVED, DISMISSED, REFUNDED -> EnumSet.noneOf(ReportStatus.class);
        };
    }

    public boolean canTransitionTo(ReportStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
