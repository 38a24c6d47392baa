package com.candor.core.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Workflow record for an assigned report. Never deleted; deactivated when the report closes.
 */
public class Investigation {

    private final long reportId;
    private final Principal investigator;
    private final Instant startedAt;
    private final Instant deadline;

    private Instant lastUpdatedAt;
    private boolean active;
    private String notes;
    private long cost;

    private Investigation(long reportId, Principal investigator, Instant startedAt, Instant deadline) {
        this.reportId = reportId;
        this.investigator = investigator;
        this.startedAt = startedAt;
        this.deadline = deadline;
        this.lastUpdatedAt = startedAt;
        this.active = true;
        this.notes = "";
        this.cost = 0L;
    }

    public static Investigation open(long reportId, Principal investigator, Instant now, Duration window) {
        return new Investigation(reportId, investigator, now, now.plus(window));
    }

    /**
     * Opens an investigation that starts from notes already written on the report.
     */
    public static Investigation open(Report report, Principal investigator, Instant now, Duration window) {
        Investigation investigation = open(report.getId(), investigator, now, window);
        investigation.notes = report.getNotes();
        investigation.cost = report.getNotesCost();
        return investigation;
    }

    public void recordNotes(String notes, long costUnit, Instant now) {
        this.notes = notes != null ? notes : "";
        this.cost += costUnit;
        this.lastUpdatedAt = now;
    }

    public void touch(Instant now) {
        this.lastUpdatedAt = now;
    }

    public void deactivate(Instant now) {
        this.active = false;
        this.lastUpdatedAt = now;
    }

    /**
     * Expired strictly after the deadline instant.
     */
    public boolean isExpired(Instant now) {
        return now.isAfter(deadline);
    }

    // Getters
    public long getReportId() { return reportId; }
    public Principal getInvestigator() { return investigator; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getDeadline() { return deadline; }
    public Instant getLastUpdatedAt() { return lastUpdatedAt; }
    public boolean isActive() { return active; }
    public String getNotes() { return notes; }
    public long getCost() { return cost; }
}
