package com.candor.api.report;

import com.candor.api.event.CaseEventLog;
import com.candor.api.privacy.SeverityObfuscator;
import com.candor.core.domain.CaseEventType;
import com.candor.core.domain.Principal;
import com.candor.core.domain.Report;
import com.candor.core.domain.ReportCategory;
import com.candor.core.domain.ReportStatus;
import com.candor.core.domain.SealedReportFields;
import com.candor.core.exception.AuthorizationException;
import com.candor.core.exception.ValidationException;
import com.candor.core.seal.SealedHandle;
import com.candor.core.seal.SealedType;
import com.candor.core.seal.SealingService;
import com.candor.core.store.CaseCounters;
import com.candor.core.store.CaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Report Registry.
 *
 * Owns report creation and the public read projections. Every sensitive field is sealed
 * at submission; only the obfuscated severity is published.
 */
@Service
public class ReportRegistryService {

    private static final Logger log = LoggerFactory.getLogger(ReportRegistryService.class);

    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 100;

    private final CaseStore store;
    private final SealingService sealingService;
    private final SeverityObfuscator obfuscator;
    private final CaseEventLog eventLog;
    private final Clock clock;

    public ReportRegistryService(
            CaseStore store,
            SealingService sealingService,
            SeverityObfuscator obfuscator,
            CaseEventLog eventLog,
            Clock clock) {
        this.store = store;
        this.sealingService = sealingService;
        this.obfuscator = obfuscator;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    // ==================== Submission ====================

    /**
     * Submits a report. Anonymous submissions seal the null identity as the reporter.
     */
    public SubmissionResult submit(Principal caller, int category, boolean anonymous, int severity) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        ReportCategory reportCategory = ReportCategory.fromCode(category);
        if (severity < MIN_SEVERITY || severity > MAX_SEVERITY) {
            log.debug("Rejected submission with severity {}", severity);
            throw new ValidationException("Invalid severity");
        }

        return store.inTransaction(() -> {
            Instant now = clock.instant();
            long reportId = store.nextReportId();
            Principal reporter = anonymous ? Principal.NONE : caller;

            SealedReportFields fields = new SealedReportFields(
                    sealingService.seal(SealedType.ADDRESS, reporter.toBigInteger()),
                    sealingService.seal(SealedType.UINT8, BigInteger.valueOf(reportCategory.code())),
                    sealingService.seal(SealedType.UINT64, BigInteger.valueOf(now.getEpochSecond())),
                    sealingService.seal(SealedType.BOOL, anonymous ? BigInteger.ONE : BigInteger.ZERO),
                    sealingService.seal(SealedType.UINT32, BigInteger.valueOf(severity)));

            Principal authority = store.getAuthority();
            fields.all().forEach(handle -> sealingService.grantAccess(handle, authority));

            store.saveReport(Report.submit(reportId, fields, now));

            int obfuscatedSeverity = obfuscator.obfuscate(severity, reportId, caller);
            // reporter identity stays sealed; the ledger actor is always the null identity
            eventLog.append(CaseEventType.REPORT_SUBMITTED, reportId, Principal.NONE,
                    Map.of("obfuscatedSeverity", Integer.toString(obfuscatedSeverity)), now);
            return new SubmissionResult(reportId, obfuscatedSeverity, now);
        });
    }

    // ==================== Queries ====================

    public ReportInfo getBasicInfo(long reportId) {
        return store.inTransaction(() -> {
            Report report = requireReport(reportId);
            return new ReportInfo(
                    report.getId(),
                    report.getStatus(),
                    report.getSubmittedAt(),
                    report.getInvestigator().map(Principal::address).orElse(Principal.NONE.address()),
                    true,
                    report.isCallbackCompleted(),
                    report.getRevealedSeverity());
        });
    }

    public SystemStats getStats() {
        return store.inTransaction(() -> {
            CaseCounters counters = store.counters();
            return new SystemStats(
                    counters.total(),
                    counters.resolved(),
                    counters.pending(),
                    counters.refunded(),
                    counters.dismissed());
        });
    }

    /**
     * Returns the clear value of every sealed field the caller was granted; the rest are null.
     *
     * @throws AuthorizationException if the caller holds no grant on the report at all
     */
    public SealedFieldsView readSealedFields(long reportId, Principal caller) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        SealedReportFields fields = store.inTransaction(() -> requireReport(reportId).getSealedFields());

        BigInteger reporter = readIfGranted(fields.reporter(), caller);
        BigInteger category = readIfGranted(fields.category(), caller);
        BigInteger timestamp = readIfGranted(fields.timestamp(), caller);
        BigInteger anonymous = readIfGranted(fields.anonymous(), caller);
        BigInteger severity = readIfGranted(fields.severity(), caller);

        if (reporter == null && category == null && timestamp == null && anonymous == null && severity == null) {
            log.warn("Sealed field read on report {} by {} without any grant", reportId, caller);
            throw new AuthorizationException("No sealed fields granted for report " + reportId);
        }
        return new SealedFieldsView(
                reportId,
                reporter != null ? Principal.fromBigInteger(reporter).address() : null,
                category != null ? category.intValue() : null,
                timestamp != null ? timestamp.longValue() : null,
                anonymous != null ? anonymous.signum() != 0 : null,
                severity != null ? severity.intValue() : null);
    }

    // ==================== Private Methods ====================

    private Report requireReport(long reportId) {
        return store.findReport(reportId)
                .orElseThrow(() -> new ValidationException("Report does not exist"));
    }

    private BigInteger readIfGranted(SealedHandle handle, Principal caller) {
        return sealingService.isAllowed(handle, caller) ? sealingService.unseal(handle, caller) : null;
    }

    // ==================== DTOs ====================

    public record SubmissionResult(long reportId, int obfuscatedSeverity, Instant submittedAt) {}

    public record ReportInfo(
            long reportId,
            ReportStatus status,
            Instant submittedAt,
            String investigator,
            boolean exists,
            boolean callbackCompleted,
            int revealedSeverity
    ) {}

    public record SystemStats(long total, long resolved, long pending, long refunded, long dismissed) {}

    public record SealedFieldsView(
            long reportId,
            String reporter,
            Integer category,
            Long timestamp,
            Boolean anonymous,
            Integer severity
    ) {}
}
