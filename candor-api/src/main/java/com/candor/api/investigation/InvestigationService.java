package com.candor.api.investigation;

import com.candor.api.access.AccessControlService;
import com.candor.api.config.CandorProperties;
import com.candor.api.event.CaseEventLog;
import com.candor.core.domain.CaseEventType;
import com.candor.core.domain.Investigation;
import com.candor.core.domain.Principal;
import com.candor.core.domain.Report;
import com.candor.core.domain.ReportStatus;
import com.candor.core.exception.AuthorizationException;
import com.candor.core.exception.StateException;
import com.candor.core.exception.ValidationException;
import com.candor.core.seal.SealingService;
import com.candor.core.store.CaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Investigation Manager.
 *
 * Assigns submitted reports to authorized investigators and drives the manual part of the
 * workflow. Each operation validates everything before it mutates, so a rejected call
 * leaves the store untouched.
 */
@Service
public class InvestigationService {

    private static final Logger log = LoggerFactory.getLogger(InvestigationService.class);

    private final CaseStore store;
    private final SealingService sealingService;
    private final AccessControlService accessControl;
    private final CandorProperties properties;
    private final CaseEventLog eventLog;
    private final Clock clock;

    public InvestigationService(
            CaseStore store,
            SealingService sealingService,
            AccessControlService accessControl,
            CandorProperties properties,
            CaseEventLog eventLog,
            Clock clock) {
        this.store = store;
        this.sealingService = sealingService;
        this.accessControl = accessControl;
        this.properties = properties;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    // ==================== Assignment ====================

    public AssignmentResult assign(Principal caller, long reportId, Principal investigator) {
        return store.inTransaction(() -> {
            accessControl.requireAuthority(caller);
            if (investigator == null || investigator.isNone() || !store.isInvestigator(investigator)) {
                throw new ValidationException("Investigator not authorized");
            }
            Report report = requireReport(reportId);

            Instant now = clock.instant();
            report.assignTo(investigator);
            Investigation investigation = Investigation.open(report, investigator, now, properties.getInvestigationWindow());
            store.saveInvestigation(investigation);
            store.addToPortfolio(investigator, reportId);
            report.getSealedFields().investigatorVisible()
                    .forEach(handle -> sealingService.grantAccess(handle, investigator));
            log.debug("Report {} assigned to {}", reportId, investigator);

            eventLog.append(CaseEventType.REPORT_ASSIGNED, reportId, caller,
                    Map.of("investigator", investigator.address(),
                            "deadline", investigation.getDeadline().toString()), now);
            return new AssignmentResult(reportId, investigator.address(), report.getStatus(), investigation.getDeadline());
        });
    }

    // ==================== Workflow ====================

    /**
     * Replaces the notes text and adds one cost unit. Before assignment only the authority
     * can write notes; they are kept on the report and carried into the investigation.
     */
    public void addNotes(Principal caller, long reportId, String notes) {
        if (notes == null) {
            throw new ValidationException("Notes are required");
        }
        store.runInTransaction(() -> {
            Report report = requireReport(reportId);
            accessControl.requireAuthorityOrAssigned(caller, report.getInvestigator().orElse(null));

            Instant now = clock.instant();
            long cost;
            Optional<Investigation> investigation = store.findInvestigation(reportId);
            if (investigation.isPresent()) {
                investigation.get().recordNotes(notes, properties.getNotesCostUnit(), now);
                cost = investigation.get().getCost();
            } else {
                report.recordNotes(notes, properties.getNotesCostUnit());
                cost = report.getNotesCost();
            }
            eventLog.append(CaseEventType.NOTES_UPDATED, reportId, caller,
                    Map.of("cost", Long.toString(cost)), now);
        });
    }

    /**
     * Closes an open report as RESOLVED or DISMISSED, whatever stage it has reached.
     * The investigation, if one was opened, is deactivated.
     */
    public ReportStatus updateStatus(Principal caller, long reportId, ReportStatus newStatus) {
        Objects.requireNonNull(newStatus, "Status cannot be null");
        return store.inTransaction(() -> {
            Report report = requireReport(reportId);
            accessControl.requireAuthorityOrAssigned(caller, report.getInvestigator().orElse(null));
            if (newStatus != ReportStatus.RESOLVED && newStatus != ReportStatus.DISMISSED) {
                log.debug("Rejected manual status {} for report {}", newStatus, reportId);
                throw new StateException("Status " + newStatus + " cannot be set manually");
            }
            ReportStatus previous = report.getStatus();
            if (!previous.canTransitionTo(newStatus)) {
                log.debug("Rejected status change {} -> {} for report {}", previous, newStatus, reportId);
                throw new StateException("Report " + reportId + " cannot move from " + previous + " to " + newStatus);
            }

            Instant now = clock.instant();
            report.transitionTo(newStatus);
            store.findInvestigation(reportId)
                    .filter(Investigation::isActive)
                    .ifPresent(investigation -> investigation.deactivate(now));
            if (newStatus == ReportStatus.RESOLVED) {
                store.recordResolved();
            } else {
                store.recordDismissed();
            }
            eventLog.append(CaseEventType.REPORT_STATUS_CHANGED, reportId, caller,
                    Map.of("from", previous.name(), "to", newStatus.name()), now);
            return report.getStatus();
        });
    }

    // ==================== Queries ====================

    public InvestigationInfo getInvestigationInfo(long reportId, Principal caller) {
        return store.inTransaction(() -> {
            Report report = requireReport(reportId);
            accessControl.requireAuthorityOrAssigned(caller, report.getInvestigator().orElse(null),
                    "Not authorized to view this investigation");
            Optional<Investigation> opened = store.findInvestigation(reportId);
            if (opened.isEmpty()) {
                return new InvestigationInfo(reportId, Principal.NONE.address(), null, null, null,
                        false, report.getNotes(), report.getNotesCost());
            }
            Investigation investigation = opened.get();
            return new InvestigationInfo(
                    reportId,
                    investigation.getInvestigator().address(),
                    investigation.getStartedAt(),
                    investigation.getLastUpdatedAt(),
                    investigation.getDeadline(),
                    investigation.isActive(),
                    investigation.getNotes(),
                    investigation.getCost());
        });
    }

    public List<Long> getInvestigatorReports(Principal investigator, Principal caller) {
        Objects.requireNonNull(investigator, "Investigator cannot be null");
        return store.inTransaction(() -> {
            if (!investigator.equals(caller) && !accessControl.isAuthority(caller)) {
                throw new AuthorizationException("Not authorized to view this portfolio");
            }
            return store.findPortfolio(investigator);
        });
    }

    // ==================== Private Methods ====================

    private Report requireReport(long reportId) {
        return store.findReport(reportId)
                .orElseThrow(() -> new ValidationException("Report does not exist"));
    }

    // ==================== DTOs ====================

    public record AssignmentResult(long reportId, String investigator, ReportStatus status, Instant deadline) {}

    public record InvestigationInfo(
            long reportId,
            String investigator,
            Instant startedAt,
            Instant lastUpdatedAt,
            Instant deadline,
            boolean active,
            String notes,
            long cost
    ) {}
}
