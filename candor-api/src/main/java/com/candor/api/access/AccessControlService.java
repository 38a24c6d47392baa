package com.candor.api.access;

import com.candor.api.event.CaseEventLog;
import com.candor.core.domain.CaseEventType;
import com.candor.core.domain.Principal;
import com.candor.core.exception.AuthorizationException;
import com.candor.core.exception.ValidationException;
import com.candor.core.store.CaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Authority principal and investigator roster.
 *
 * The {@code require*} checks read the case store and must be called from inside a
 * store transaction.
 */
@Service
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    private final CaseStore store;
    private final CaseEventLog eventLog;
    private final Clock clock;

    public AccessControlService(CaseStore store, CaseEventLog eventLog, Clock clock) {
        this.store = store;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    // ==================== Roster ====================

    public void addInvestigator(Principal caller, Principal investigator) {
        store.runInTransaction(() -> {
            requireAuthority(caller);
            if (investigator == null || investigator.isNone()) {
                throw new ValidationException("Invalid investigator address");
            }
            if (store.isInvestigator(investigator)) {
                throw new ValidationException("Investigator already authorized");
            }
            store.addInvestigator(investigator);
            eventLog.append(CaseEventType.INVESTIGATOR_ADDED, null, caller,
                    Map.of("investigator", investigator.address()), clock.instant());
        });
    }

    public void removeInvestigator(Principal caller, Principal investigator) {
        store.runInTransaction(() -> {
            requireAuthority(caller);
            if (investigator == null || !store.isInvestigator(investigator)) {
                throw new ValidationException("Investigator not authorized");
            }
            store.removeInvestigator(investigator);
            eventLog.append(CaseEventType.INVESTIGATOR_REMOVED, null, caller,
                    Map.of("investigator", investigator.address()), clock.instant());
        });
    }

    public void transferAuthority(Principal caller, Principal newAuthority) {
        store.runInTransaction(() -> {
            requireAuthority(caller);
            if (newAuthority == null || newAuthority.isNone()) {
                throw new ValidationException("Invalid authority address");
            }
            Principal previous = store.getAuthority();
            store.setAuthority(newAuthority);
            eventLog.append(CaseEventType.AUTHORITY_TRANSFERRED, null, caller,
                    Map.of("previousAuthority", previous.address(), "newAuthority", newAuthority.address()),
                    clock.instant());
        });
    }

    // ==================== Queries ====================

    public boolean isAuthorizedInvestigator(Principal principal) {
        return principal != null && store.inTransaction(() -> store.isInvestigator(principal));
    }

    public Principal getAuthority() {
        return store.inTransaction(store::getAuthority);
    }

    public List<Principal> getInvestigators() {
        return store.inTransaction(() -> store.findInvestigators().stream()
                .sorted((a, b) -> a.address().compareTo(b.address()))
                .toList());
    }

    // ==================== Checks ====================

    public boolean isAuthority(Principal caller) {
        return caller != null && caller.equals(store.getAuthority());
    }

    public void requireAuthority(Principal caller) {
        if (!isAuthority(caller)) {
            log.debug("Rejected non-authority caller {}", caller);
            throw new AuthorizationException("Only authority can perform this action");
        }
    }

    /**
     * Authority, or the investigator the report is assigned to.
     */
    public void requireAuthorityOrAssigned(Principal caller, Principal assignedInvestigator) {
        requireAuthorityOrAssigned(caller, assignedInvestigator, "Not authorized to update this report");
    }

    public void requireAuthorityOrAssigned(Principal caller, Principal assignedInvestigator, String message) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        if (isAuthority(caller) || caller.equals(assignedInvestigator)) {
            return;
        }
        log.debug("Rejected caller {} for report assigned to {}", caller, assignedInvestigator);
        throw new AuthorizationException(message);
    }
}
