package com.candor.core.domain;

import com.candor.core.seal.SealedHandle;

import java.util.List;

/**
 * Handles of the sealed values captured at submission.
 */
public record SealedReportFields(
        SealedHandle reporter,
        SealedHandle category,
        SealedHandle timestamp,
        SealedHandle anonymous,
        SealedHandle severity
) {

    public List<SealedHandle> all() {
        return List.of(reporter, category, timestamp, anonymous, severity);
    }

    /**
     * The fields an assigned investigator may read.
     */
    public List<SealedHandle> investigatorVisible() {
        return List.of(category, timestamp, severity);
    }

    /**
     * The fields packaged into one decryption request, in wire order.
     */
    public List<SealedHandle> disclosable() {
        return List.of(category, severity, timestamp);
    }
}
