package com.candor.api.refund;

import com.candor.api.event.CaseEventLog;
import com.candor.core.domain.CaseEventType;
import com.candor.core.domain.Investigation;
import com.candor.core.domain.Principal;
import com.candor.core.domain.Report;
import com.candor.core.domain.ReportStatus;
import com.candor.core.exception.StateException;
import com.candor.core.exception.TimeoutNotReachedException;
import com.candor.core.exception.ValidationException;
import com.candor.core.store.CaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Refund and timeout recovery.
 *
 * Anyone may claim; the deadlines are the only guard. A report is refunded at most once,
 * whichever track claims first.
 */
@Service
public class TimeoutRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(TimeoutRecoveryService.class);

    private final CaseStore store;
    private final CaseEventLog eventLog;
    private final Clock clock;

    public TimeoutRecoveryService(CaseStore store, CaseEventLog eventLog, Clock clock) {
        this.store = store;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * Refunds a report still awaiting closure once the decryption window has passed,
     * whether or not the oracle answered.
     */
    public RefundResult claimDecryptionTimeoutRefund(Principal caller, long reportId) {
        return store.inTransaction(() -> {
            Report report = requireReport(reportId);
            requireUnclaimed(report);
            if (report.getStatus() != ReportStatus.DECRYPTION_PENDING) {
                throw new StateException("Report " + reportId + " is not awaiting decryption");
            }
            Instant now = clock.instant();
            if (!report.isDecryptionOverdue(now)) {
                log.debug("Decryption refund for report {} claimed before deadline", reportId);
                throw new TimeoutNotReachedException("Decryption deadline not reached for report " + reportId);
            }

            refund(report, now);
            eventLog.append(CaseEventType.REFUND_ISSUED, reportId, actorOf(caller),
                    Map.of("reason", RefundReason.DECRYPTION_TIMEOUT.name()), now);
            return new RefundResult(reportId, RefundReason.DECRYPTION_TIMEOUT, report.getStatus());
        });
    }

    /**
     * Refunds a report whose investigation outlived its deadline.
     */
    public RefundResult claimInvestigationTimeoutRefund(Principal caller, long reportId) {
        return store.inTransaction(() -> {
            Report report = requireReport(reportId);
            requireUnclaimed(report);
            Investigation investigation = store.findInvestigation(reportId)
                    .filter(Investigation::isActive)
                    .orElseThrow(() -> new StateException("No active investigation for report " + reportId));
            Instant now = clock.instant();
            if (!investigation.isExpired(now)) {
                log.debug("Investigation refund for report {} claimed before deadline", reportId);
                throw new TimeoutNotReachedException("Investigation deadline not reached for report " + reportId);
            }
            if (!report.getStatus().canTransitionTo(ReportStatus.REFUNDED)) {
                throw new StateException("Report " + reportId + " cannot be refunded from " + report.getStatus());
            }

            refund(report, now);
            Principal actor = actorOf(caller);
            eventLog.append(CaseEventType.INVESTIGATION_TIMEOUT, reportId, actor,
                    Map.of("deadline", investigation.getDeadline().toString()), now);
            eventLog.append(CaseEventType.REFUND_ISSUED, reportId, actor,
                    Map.of("reason", RefundReason.INVESTIGATION_TIMEOUT.name()), now);
            return new RefundResult(reportId, RefundReason.INVESTIGATION_TIMEOUT, report.getStatus());
        });
    }

    public RefundAvailability isRefundAvailable(long reportId) {
        return store.inTransaction(() -> {
            Report report = requireReport(reportId);
            Instant now = clock.instant();
            boolean decryption = !report.isRefundClaimed() && report.isDecryptionOverdue(now);
            boolean investigation = !report.isRefundClaimed()
                    && report.getStatus().canTransitionTo(ReportStatus.REFUNDED)
                    && store.findInvestigation(reportId)
                            .map(inv -> inv.isActive() && inv.isExpired(now))
                            .orElse(false);
            return new RefundAvailability(reportId, decryption || investigation, decryption, investigation);
        });
    }

    // ==================== Private Methods ====================

    private Report requireReport(long reportId) {
        return store.findReport(reportId)
                .orElseThrow(() -> new ValidationException("Report does not exist"));
    }

    private static void requireUnclaimed(Report report) {
        if (report.isRefundClaimed()) {
            throw new StateException("Refund already claimed for report " + report.getId());
        }
    }

    private void refund(Report report, Instant now) {
        report.claimRefund();
        store.findInvestigation(report.getId())
                .filter(Investigation::isActive)
                .ifPresent(investigation -> investigation.deactivate(now));
        store.recordRefunded();
    }

    private static Principal actorOf(Principal caller) {
        return Optional.ofNullable(caller).orElse(Principal.NONE);
    }

    public enum RefundReason {
        DECRYPTION_TIMEOUT,
        INVESTIGATION_TIMEOUT
    }

    public record RefundResult(long reportId, RefundReason reason, ReportStatus status) {}

    public record RefundAvailability(
            long reportId,
            boolean available,
            boolean decryptionTimeout,
            boolean investigationTimeout
    ) {}
}
