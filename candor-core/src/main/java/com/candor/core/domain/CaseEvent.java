package com.candor.core.domain;

import java.time.Instant;
import java.util.Map;

/**
 * An entry in the case event ledger. Each entry is chained to its predecessor by hash.
 *
 * @param reportId null for roster events
 */
public record CaseEvent(
        long sequence,
        CaseEventType type,
        Long reportId,
        Principal actor,
        Map<String, String> attributes,
        Instant timestamp,
        String previousHash,
        String hash
) {
    public CaseEvent {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }
}
