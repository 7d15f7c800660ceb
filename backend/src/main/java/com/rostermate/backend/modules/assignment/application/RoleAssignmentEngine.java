package com.rostermate.backend.modules.assignment.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rostermate.backend.modules.assignment.domain.AssignmentDecision;
import com.rostermate.backend.modules.assignment.domain.ReassignmentPolicy;
import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Decides whether a volunteer may take a role at an event and commits the assignment when allowed.
 *
 * <p>Each call runs in its own transaction that first locks the event row. All assignment writes for
 * one event therefore run one at a time, while different events proceed in parallel. The storage
 * uniqueness constraints stay in place as the last check; if one of them fires anyway the attempt is
 * rolled back and reported as the matching decline.
 *
 * <p>Declines are returned as {@link AssignmentDecision} values. Only storage trouble is thrown:
 * {@link StoreUnavailableException} for transient failures, the original exception otherwise.
 */
@Service
public class RoleAssignmentEngine {

    private static final Logger log = LoggerFactory.getLogger(RoleAssignmentEngine.class);

    private final AssignmentStore assignmentStore;
    private final TransactionTemplate transactionTemplate;
    private final ReassignmentPolicy reassignmentPolicy;

    public RoleAssignmentEngine(
            AssignmentStore assignmentStore,
            PlatformTransactionManager transactionManager,
            AssignmentProperties assignmentProperties
    ) {
        this.assignmentStore = assignmentStore;
        this.reassignmentPolicy = assignmentProperties.reassignmentPolicy();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(assignmentProperties.storeTimeoutSeconds());
    }

    public AssignmentDecision assign(long volunteerId, UUID eventId, String roleName) {
        try {
            AssignmentDecision decision = inTransaction(
                    volunteerId, eventId, roleName, status -> decide(volunteerId, eventId, roleName));
            if (decision.ok()) {
                log.info("Assigned volunteer={} event={} role={}", volunteerId, eventId, decision.roleCode());
            } else {
                log.info("Declined volunteer={} event={} role={} reason={} conflictingRole={}",
                        volunteerId, eventId, roleName, decision.reason(), decision.conflictingRoleCode());
            }
            return decision;
        } catch (UniqueConstraintViolationException ex) {
            log.warn("Storage constraint {} rejected volunteer={} event={} role={}",
                    ex.getConstraint(), volunteerId, eventId, ex.getRoleCode());
            return switch (ex.getConstraint()) {
                case VOLUNTEER_ROLE_EVENT -> AssignmentDecision.alreadyAssigned(ex.getRoleCode(), ex.getRoleName());
                case UNIQUE_ROLE_EVENT -> AssignmentDecision.roleTaken(ex.getRoleCode(), ex.getRoleName());
            };
        }
    }

    /**
     * Removes every role the volunteer holds at the event.
     *
     * @return whether anything was removed
     */
    public boolean unassign(long volunteerId, UUID eventId) {
        Integer removed = inTransaction(volunteerId, eventId, null, status -> {
            assignmentStore.lockEvent(eventId);
            return assignmentStore.deleteAll(volunteerId, eventId);
        });
        log.info("Unassigned volunteer={} event={} removed={}", volunteerId, eventId, removed);
        return removed != null && removed > 0;
    }

    private AssignmentDecision decide(long volunteerId, UUID eventId, String roleName) {
        Optional<CatalogueRole> resolved = assignmentStore.findRole(roleName);
        if (resolved.isEmpty()) {
            return AssignmentDecision.roleNotFound(roleName);
        }
        CatalogueRole role = resolved.get();

        assignmentStore.lockEvent(eventId);

        if (assignmentStore.hasAssignment(volunteerId, role, eventId)) {
            return AssignmentDecision.alreadyAssigned(role.getCode(), role.getDisplayName());
        }
        if (role.isUniquePerEvent() && assignmentStore.isRoleTaken(role, eventId)) {
            return AssignmentDecision.roleTaken(role.getCode(), role.getDisplayName());
        }

        if (reassignmentPolicy == ReassignmentPolicy.REPLACE_EXISTING) {
            int replaced = assignmentStore.deleteAll(volunteerId, eventId);
            if (replaced > 0) {
                log.debug("Replacing {} existing role(s) of volunteer={} event={}", replaced, volunteerId, eventId);
            }
        } else {
            Optional<CatalogueRole> conflict = findExclusionConflict(role, assignmentStore.rolesHeldBy(volunteerId, eventId));
            if (conflict.isPresent()) {
                return AssignmentDecision.exclusionConflict(role, conflict.get());
            }
        }

        assignmentStore.insert(volunteerId, role, eventId);
        return AssignmentDecision.committed(role);
    }

    private Optional<CatalogueRole> findExclusionConflict(CatalogueRole requested, List<CatalogueRole> held) {
        if (requested.getExclusionGroups().isEmpty()) {
            return Optional.empty();
        }
        return held.stream()
                .filter(requested::excludes)
                .findFirst();
    }

    private <T> T inTransaction(long volunteerId, UUID eventId, String roleName, TransactionCallback<T> callback) {
        try {
            return transactionTemplate.execute(callback);
        } catch (TransientDataAccessException | DataAccessResourceFailureException | TransactionException ex) {
            log.warn("Assignment store unavailable volunteer={} event={} role={}: {}",
                    volunteerId, eventId, roleName, ex.getMessage(), ex);
            throw new StoreUnavailableException("Assignment store unavailable, retry the request", ex);
        } catch (DataAccessException ex) {
            log.error("Assignment store failure volunteer={} event={} role={}", volunteerId, eventId, roleName, ex);
            throw ex;
        }
    }
}
