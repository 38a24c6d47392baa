package com.candor.core.domain;

import com.candor.core.exception.StateException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One submitted case. Sensitive fields are held only as sealed handles; the clear values
 * appear in {@link #getRevealed()} once the oracle has answered a decryption request.
 */
public class Report {

    private final long id;
    private final SealedReportFields sealedFields;
    private final Instant submittedAt;

    private ReportStatus status;
    private Principal investigator;
    private Long decryptionRequestId;
    private Instant decryptionRequestedAt;
    private Instant decryptionDeadline;
    private boolean callbackCompleted;
    private RevealedValues revealed;
    private boolean refundClaimed;

    // notes written before assignment; handed to the investigation when it opens
    private String notes;
    private long notesCost;

    private Report(long id, SealedReportFields sealedFields, Instant submittedAt) {
        this.id = id;
        this.sealedFields = sealedFields;
        this.submittedAt = submittedAt;
        this.status = ReportStatus.SUBMITTED;
        this.revealed = RevealedValues.NONE;
        this.notes = "";
    }

    public static Report submit(long id, SealedReportFields sealedFields, Instant submittedAt) {
        if (id < 1) {
            throw new IllegalArgumentException("Report id must be positive");
        }
        return new Report(id,
                Objects.requireNonNull(sealedFields, "Sealed fields cannot be null"),
                Objects.requireNonNull(submittedAt, "Submission time cannot be null"));
    }

    public void assignTo(Principal investigator) {
        if (this.investigator != null || status != ReportStatus.SUBMITTED) {
            throw new StateException("Report already assigned: " + id);
        }
        transitionTo(ReportStatus.UNDER_INVESTIGATION);
        this.investigator = investigator;
    }

    public void markDecryptionRequested(long requestId, Instant requestedAt, Instant deadline) {
        if (isDecryptionInFlight()) {
            throw new StateException("Decryption already in flight for report " + id);
        }
        transitionTo(ReportStatus.DECRYPTION_PENDING);
        this.decryptionRequestId = requestId;
        this.decryptionRequestedAt = requestedAt;
        this.decryptionDeadline = deadline;
    }

    public void recordDecryption(RevealedValues values) {
        if (callbackCompleted) {
            throw new StateException("Decryption already completed for report " + id);
        }
        this.revealed = Objects.requireNonNull(values, "Revealed values cannot be null");
        this.callbackCompleted = true;
    }

    /**
     * Records notes on a report that has no investigation yet.
     */
    public void recordNotes(String notes, long costUnit) {
        if (investigator != null) {
            throw new StateException("Report " + id + " is assigned; notes belong to its investigation");
        }
        this.notes = notes != null ? notes : "";
        this.notesCost += costUnit;
    }

    public void transitionTo(ReportStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new StateException("Report " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    /**
     * Marks the refund as claimed and moves the report to REFUNDED. Succeeds at most once.
     */
    public void claimRefund() {
        if (refundClaimed) {
            throw new StateException("Refund already claimed for report " + id);
        }
        transitionTo(ReportStatus.REFUNDED);
        this.refundClaimed = true;
    }

    public boolean isDecryptionInFlight() {
        return decryptionRequestId != null && !callbackCompleted;
    }

    public boolean isDecryptionOverdue(Instant now) {
        return status == ReportStatus.DECRYPTION_PENDING
                && decryptionDeadline != null
                && now.isAfter(decryptionDeadline);
    }

    public boolean isAssignedTo(Principal principal) {
        return investigator != null && investigator.equals(principal);
    }

    // Getters
    public long getId() { return id; }
    public SealedReportFields getSealedFields() { return sealedFields; }
    public Instant getSubmittedAt() { return submittedAt; }
    public ReportStatus getStatus() { return status; }
    public Optional<Principal> getInvestigator() { return Optional.ofNullable(investigator); }
    public Optional<Long> getDecryptionRequestId() { return Optional.ofNullable(decryptionRequestId); }
    public Optional<Instant> getDecryptionRequestedAt() { return Optional.ofNullable(decryptionRequestedAt); }
    public Optional<Instant> getDecryptionDeadline() { return Optional.ofNullable(decryptionDeadline); }
    public boolean isCallbackCompleted() { return callbackCompleted; }
    public RevealedValues getRevealed() { return revealed; }
    public int getRevealedSeverity() { return revealed.severity(); }
    public boolean isRefundClaimed() { return refundClaimed; }
    public String getNotes() { return notes; }
    public long getNotesCost() { return notesCost; }
}
