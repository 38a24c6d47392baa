package com.candor.api.decryption;

import com.candor.api.access.AccessControlService;
import com.candor.api.config.CandorProperties;
import com.candor.api.event.CaseEventLog;
import com.candor.core.domain.CaseEventType;
import com.candor.core.domain.Investigation;
import com.candor.core.domain.Principal;
import com.candor.core.domain.Report;
import com.candor.core.domain.ReportStatus;
import com.candor.core.domain.RevealedValues;
import com.candor.core.exception.CaseException;
import com.candor.core.exception.ProofVerificationException;
import com.candor.core.exception.StateException;
import com.candor.core.exception.ValidationException;
import com.candor.core.seal.DecryptionGateway;
import com.candor.core.seal.PendingDecryption;
import com.candor.core.seal.ProofVerifier;
import com.candor.core.seal.SealedHandle;
import com.candor.core.seal.SealedType;
import com.candor.core.store.CaseStore;
import com.candor.oracle.codec.ClearValuesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Decryption Oracle Protocol.
 *
 * {@link #requestDecryption} packages a report's sealed category, severity and timestamp
 * into one oracle request and returns once it is dispatched. The oracle's answer arrives
 * later, either through the gateway's future or relayed to {@link #handleCallback}, and is
 * applied in a single transaction after its proof verifies.
 */
@Service
public class DecryptionOracleService {

    private static final Logger log = LoggerFactory.getLogger(DecryptionOracleService.class);

    private final CaseStore store;
    private final DecryptionGateway gateway;
    private final ProofVerifier proofVerifier;
    private final ClearValuesCodec codec;
    private final AccessControlService accessControl;
    private final CandorProperties properties;
    private final CaseEventLog eventLog;
    private final Clock clock;

    public DecryptionOracleService(
            CaseStore store,
            DecryptionGateway gateway,
            ProofVerifier proofVerifier,
            ClearValuesCodec codec,
            AccessControlService accessControl,
            CandorProperties properties,
            CaseEventLog eventLog,
            Clock clock) {
        this.store = store;
        this.gateway = gateway;
        this.proofVerifier = proofVerifier;
        this.codec = codec;
        this.accessControl = accessControl;
        this.properties = properties;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    // ==================== Request ====================

    public DecryptionTicket requestDecryption(Principal caller, long reportId) {
        Dispatched dispatched = store.inTransaction(() -> {
            Report report = requireReport(reportId);
            accessControl.requireAuthorityOrAssigned(caller, report.getInvestigator().orElse(null));
            if (report.getStatus() != ReportStatus.UNDER_INVESTIGATION) {
                throw new StateException("Report not under investigation: " + reportId);
            }
            Investigation investigation = store.findInvestigation(reportId)
                    .orElseThrow(() -> new StateException("Report not under investigation: " + reportId));
            Instant now = clock.instant();
            if (investigation.isExpired(now)) {
                throw new StateException("Investigation deadline passed for report " + reportId);
            }
            if (report.isDecryptionInFlight()) {
                throw new StateException("Decryption already in flight for report " + reportId);
            }

            PendingDecryption pending = gateway.requestReveal(report.getSealedFields().disclosable());
            Instant deadline = now.plus(properties.getDecryptionWindow());
            store.indexDecryptionRequest(pending.requestId(), reportId);
            report.markDecryptionRequested(pending.requestId(), now, deadline);
            investigation.touch(now);

            eventLog.append(CaseEventType.DECRYPTION_REQUESTED, reportId, caller,
                    Map.of("requestId", Long.toString(pending.requestId()), "deadline", deadline.toString()), now);
            return new Dispatched(pending, new DecryptionTicket(reportId, pending.requestId(), now, deadline));
        });

        // attached after the request id is indexed and outside the store lock
        long requestId = dispatched.pending().requestId();
        dispatched.pending().response().whenCompleteAsync((response, failure) -> {
            if (failure != null) {
                log.warn("Oracle response for decryption request {} failed: {}", requestId, failure.getMessage());
                return;
            }
            try {
                handleCallback(response.requestId(), response.clearValues(), response.proof());
            } catch (CaseException e) {
                log.warn("Oracle response for decryption request {} rejected: {}", requestId, e.getMessage());
            }
        });
        return dispatched.ticket();
    }

    // ==================== Callback ====================

    /**
     * Applies an oracle response. Callable by anyone; the proof is the only credential.
     *
     * @throws ProofVerificationException if the proof does not verify, with no state change
     * @throws ValidationException if the request id is unknown or the payload is malformed
     * @throws StateException if the request was already answered or the report has moved on
     */
    public CallbackResult handleCallback(long requestId, byte[] clearValues, byte[] proof) {
        if (!proofVerifier.verify(requestId, clearValues, proof)) {
            log.warn("Rejected oracle callback for request {}: proof did not verify", requestId);
            throw new ProofVerificationException("Invalid decryption proof for request " + requestId);
        }

        return store.inTransaction(() -> {
            long reportId = store.findReportIdByRequestId(requestId)
                    .orElseThrow(() -> new ValidationException("Unknown decryption request: " + requestId));
            Report report = requireReport(reportId);
            if (report.isCallbackCompleted()) {
                throw new StateException("Decryption already completed for report " + reportId);
            }
            if (report.getStatus() != ReportStatus.DECRYPTION_PENDING) {
                throw new StateException("Report " + reportId + " no longer awaits decryption");
            }

            RevealedValues revealed = decode(report, clearValues);
            Instant now = clock.instant();
            report.recordDecryption(revealed);

            boolean autoResolved = revealed.severity() >= properties.getAutoResolveThreshold();
            eventLog.append(CaseEventType.DECRYPTION_COMPLETED, reportId, Principal.NONE,
                    Map.of("requestId", Long.toString(requestId), "autoResolved", Boolean.toString(autoResolved)), now);
            if (autoResolved) {
                report.transitionTo(ReportStatus.RESOLVED);
                store.findInvestigation(reportId).ifPresent(investigation -> investigation.deactivate(now));
                store.recordResolved();
                eventLog.append(CaseEventType.REPORT_STATUS_CHANGED, reportId, Principal.NONE,
                        Map.of("from", ReportStatus.DECRYPTION_PENDING.name(), "to", ReportStatus.RESOLVED.name()), now);
            } else {
                store.findInvestigation(reportId).ifPresent(investigation -> investigation.touch(now));
            }
            return new CallbackResult(reportId, requestId, revealed.severity(), report.getStatus());
        });
    }

    // ==================== Queries ====================

    public DecryptionStatus getDecryptionStatus(long reportId) {
        return store.inTransaction(() -> {
            Report report = requireReport(reportId);
            RevealedValues revealed = report.getRevealed();
            return new DecryptionStatus(
                    reportId,
                    report.getStatus(),
                    report.getDecryptionRequestId().orElse(null),
                    report.getDecryptionRequestedAt().orElse(null),
                    report.getDecryptionDeadline().orElse(null),
                    report.isCallbackCompleted(),
                    revealed.category(),
                    revealed.severity(),
                    revealed.timestamp(),
                    report.isRefundClaimed());
        });
    }

    // ==================== Private Methods ====================

    private Report requireReport(long reportId) {
        return store.findReport(reportId)
                .orElseThrow(() -> new ValidationException("Report does not exist"));
    }

    private RevealedValues decode(Report report, byte[] clearValues) {
        List<SealedType> types = report.getSealedFields().disclosable().stream()
                .map(SealedHandle::type)
                .toList();
        List<BigInteger> values;
        try {
            values = codec.decode(clearValues, types);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed clear values: " + e.getMessage(), e);
        }
        try {
            return new RevealedValues(values.get(0).intValueExact(), values.get(1).intValueExact(), values.get(2).longValueExact());
        } catch (ArithmeticException e) {
            throw new ValidationException("Clear value out of range", e);
        }
    }

    private record Dispatched(PendingDecryption pending, DecryptionTicket ticket) {}

    // ==================== DTOs ====================

    public record DecryptionTicket(long reportId, long requestId, Instant requestedAt, Instant deadline) {}

    public record CallbackResult(long reportId, long requestId, int revealedSeverity, ReportStatus status) {}

    public record DecryptionStatus(
            long reportId,
            ReportStatus status,
            Long requestId,
            Instant requestedAt,
            Instant deadline,
            boolean callbackCompleted,
            int revealedCategory,
            int revealedSeverity,
            long revealedTimestamp,
            boolean refundClaimed
    ) {}
}
