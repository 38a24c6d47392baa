package com.candor.core.store;

import com.candor.core.domain.Investigation;
import com.candor.core.domain.Principal;
import com.candor.core.domain.Report;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory case store. A single fair lock serialises transactions, so each one observes
 * the effects of every transaction that finished before it.
 */
public class InMemoryCaseStore implements CaseStore {

    private final ReentrantLock lock = new ReentrantLock(true);

    private final Map<Long, Report> reports = new TreeMap<>();
    private final Map<Long, Investigation> investigations = new HashMap<>();
    private final Map<Principal, List<Long>> portfolios = new HashMap<>();
    private final Set<Principal> investigators = new LinkedHashSet<>();
    private final Map<Long, Long> reportIdsByRequestId = new HashMap<>();

    private Principal authority;
    private long lastReportId;
    private long resolved;
    private long dismissed;
    private long refunded;

    public InMemoryCaseStore(Principal authority) {
        this.authority = Objects.requireNonNull(authority, "Authority cannot be null");
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long nextReportId() {
        requireTransaction();
        return ++lastReportId;
    }

    @Override
    public void saveReport(Report report) {
        requireTransaction();
        reports.put(report.getId(), report);
    }

    @Override
    public Optional<Report> findReport(long reportId) {
        requireTransaction();
        return Optional.ofNullable(reports.get(reportId));
    }

    @Override
    public Collection<Report> findAllReports() {
        requireTransaction();
        return List.copyOf(reports.values());
    }

    @Override
    public void saveInvestigation(Investigation investigation) {
        requireTransaction();
        investigations.put(investigation.getReportId(), investigation);
    }

    @Override
    public Optional<Investigation> findInvestigation(long reportId) {
        requireTransaction();
        return Optional.ofNullable(investigations.get(reportId));
    }

    @Override
    public void addToPortfolio(Principal investigator, long reportId) {
        requireTransaction();
        portfolios.computeIfAbsent(investigator, k -> new ArrayList<>()).add(reportId);
    }

    @Override
    public List<Long> findPortfolio(Principal investigator) {
        requireTransaction();
        return List.copyOf(portfolios.getOrDefault(investigator, List.of()));
    }

    @Override
    public Principal getAuthority() {
        requireTransaction();
        return authority;
    }

    @Override
    public void setAuthority(Principal authority) {
        requireTransaction();
        this.authority = Objects.requireNonNull(authority, "Authority cannot be null");
    }

    @Override
    public boolean isInvestigator(Principal principal) {
        requireTransaction();
        return investigators.contains(principal);
    }

    @Override
    public void addInvestigator(Principal principal) {
        requireTransaction();
        investigators.add(principal);
    }

    @Override
    public void removeInvestigator(Principal principal) {
        requireTransaction();
        investigators.remove(principal);
    }

    @Override
    public Set<Principal> findInvestigators() {
        requireTransaction();
        return Set.copyOf(investigators);
    }

    @Override
    public void indexDecryptionRequest(long requestId, long reportId) {
        requireTransaction();
        Long previous = reportIdsByRequestId.putIfAbsent(requestId, reportId);
        if (previous != null && previous != reportId) {
            throw new IllegalStateException("Request id " + requestId + " already bound to report " + previous);
        }
    }

    @Override
    public Optional<Long> findReportIdByRequestId(long requestId) {
        requireTransaction();
        return Optional.ofNullable(reportIdsByRequestId.get(requestId));
    }

    @Override
    public CaseCounters counters() {
        requireTransaction();
        return new CaseCounters(reports.size(), resolved, dismissed, refunded);
    }

    @Override
    public void recordResolved() {
        requireTransaction();
        resolved++;
    }

    @Override
    public void recordDismissed() {
        requireTransaction();
        dismissed++;
    }

    @Override
    public void recordRefunded() {
        requireTransaction();
        refunded++;
    }

    private void requireTransaction() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Case store accessed outside a transaction");
        }
    }
}
