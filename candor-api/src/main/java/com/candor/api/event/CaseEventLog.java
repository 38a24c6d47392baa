package com.candor.api.event;

import com.candor.core.domain.CaseEvent;
import com.candor.core.domain.CaseEventType;
import com.candor.core.domain.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Append-only, hash-chained ledger of case events.
 *
 * Each entry hashes its canonical fields together with the previous entry's hash,
 * starting from {@code GENESIS}. Services append only after an operation has fully
 * succeeded, inside the same case store transaction, so ledger order matches commit order.
 */
@Service
public class CaseEventLog {

    private static final Logger log = LoggerFactory.getLogger(CaseEventLog.class);

    static final String GENESIS = "GENESIS";

    private final List<CaseEvent> events = new ArrayList<>();

    public synchronized CaseEvent append(
            CaseEventType type,
            Long reportId,
            Principal actor,
            Map<String, String> attributes,
            Instant timestamp) {
        Objects.requireNonNull(type, "Event type cannot be null");
        Objects.requireNonNull(actor, "Actor cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");

        long sequence = events.size() + 1L;
        String previousHash = events.isEmpty() ? GENESIS : events.get(events.size() - 1).hash();
        Map<String, String> attrs = attributes != null ? attributes : Map.of();
        String hash = sha256(canonical(sequence, type, reportId, actor, attrs, timestamp, previousHash));

        CaseEvent event = new CaseEvent(sequence, type, reportId, actor, attrs, timestamp, previousHash, hash);
        events.add(event);

        log.info("{} report={} actor={} {}", type.eventName(), reportId != null ? reportId : "-", actor,
                new TreeMap<>(attrs));
        return event;
    }

    /**
     * Events with a sequence number greater than {@code afterSequence}, oldest first.
     */
    public synchronized List<CaseEvent> list(long afterSequence, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        int from = (int) Math.min(Math.max(afterSequence, 0L), events.size());
        int to = Math.min(from + limit, events.size());
        return List.copyOf(events.subList(from, to));
    }

    public synchronized List<CaseEvent> forReport(long reportId) {
        return events.stream()
                .filter(event -> event.reportId() != null && event.reportId() == reportId)
                .toList();
    }

    public synchronized int size() {
        return events.size();
    }

    /**
     * Recomputes every hash and link in the chain.
     */
    public synchronized ChainVerification verifyChain() {
        String expectedPrevious = GENESIS;
        for (CaseEvent event : events) {
            String recomputed = sha256(canonical(event.sequence(), event.type(), event.reportId(), event.actor(),
                    event.attributes(), event.timestamp(), event.previousHash()));
            if (!expectedPrevious.equals(event.previousHash()) || !recomputed.equals(event.hash())) {
                log.warn("Case event chain broken at sequence {}", event.sequence());
                return new ChainVerification(false, events.size(), event.sequence());
            }
            expectedPrevious = event.hash();
        }
        return new ChainVerification(true, events.size(), null);
    }

    // ==================== Private Methods ====================

    private static String canonical(
            long sequence,
            CaseEventType type,
            Long reportId,
            Principal actor,
            Map<String, String> attributes,
            Instant timestamp,
            String previousHash) {
        // attribute maps are unordered; sort keys so the hash is stable
        String attrs = new TreeMap<>(attributes).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(";"));
        return String.join("|",
                Long.toString(sequence),
                type.eventName(),
                reportId != null ? reportId.toString() : "-",
                actor.address(),
                attrs,
                timestamp.toString(),
                previousHash
        );
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record ChainVerification(boolean valid, int length, Long brokenAtSequence) {}
}
