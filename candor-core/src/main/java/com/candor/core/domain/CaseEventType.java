package com.candor.core.domain;

/**
 * Log entries emitted by successful mutating operations.
 */
public enum CaseEventType {
    REPORT_SUBMITTED("ReportSubmitted"),
    REPORT_ASSIGNED("ReportAssigned"),
    REPORT_STATUS_CHANGED("ReportStatusChanged"),
    NOTES_UPDATED("NotesUpdated"),
    INVESTIGATOR_ADDED("InvestigatorAdded"),
    INVESTIGATOR_REMOVED("InvestigatorRemoved"),
    AUTHORITY_TRANSFERRED("AuthorityTransferred"),
    DECRYPTION_REQUESTED("DecryptionRequested"),
    DECRYPTION_COMPLETED("DecryptionCompleted"),
    REFUND_ISSUED("RefundIssued"),
    INVESTIGATION_TIMEOUT("InvestigationTimeout");

    private final String eventName;

    CaseEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
