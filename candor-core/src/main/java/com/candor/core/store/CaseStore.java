package com.candor.core.store;

import com.candor.core.domain.Investigation;
import com.candor.core.domain.Principal;
import com.candor.core.domain.Report;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The single authoritative store for reports, investigations, the roster and the
 * decryption request index. Every workflow operation runs inside {@link #inTransaction},
 * which serialises it against all others.
 */
public interface CaseStore {

    <T> T inTransaction(Supplier<T> work);

    default void runInTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    // ==================== Reports ====================

    /**
     * Allocates the next report id. Ids start at 1 and are never handed out twice.
     */
    long nextReportId();

    void saveReport(Report report);

    Optional<Report> findReport(long reportId);

    Collection<Report> findAllReports();

    // ==================== Investigations ====================

    void saveInvestigation(Investigation investigation);

    Optional<Investigation> findInvestigation(long reportId);

    void addToPortfolio(Principal investigator, long reportId);

    List<Long> findPortfolio(Principal investigator);

    // ==================== Roster ====================

    Principal getAuthority();

    void setAuthority(Principal authority);

    boolean isInvestigator(Principal principal);

    void addInvestigator(Principal principal);

    void removeInvestigator(Principal principal);

    Set<Principal> findInvestigators();

    // ==================== Decryption requests ====================

    void indexDecryptionRequest(long requestId, long reportId);

    Optional<Long> findReportIdByRequestId(long requestId);

    // ==================== Counters ====================

    CaseCounters counters();

    void recordResolved();

    void recordDismissed();

    void recordRefunded();
}
