package com.rostermate.backend.modules.assignment.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;

/**
 * Durable ground truth for (volunteer, role, event) assignments.
 *
 * <p>Every method must be called inside the caller's transaction. The reads made for one
 * assignment attempt are only meaningful while the lock taken by {@link #lockEvent(UUID)} is held,
 * i.e. until that transaction commits or rolls back.
 */
public interface AssignmentStore {

    /**
     * Resolves a role by canonical code, falling back to its display label.
     */
    Optional<CatalogueRole> findRole(String roleName);

    /**
     * Takes the per-event write lock that serializes all assignment changes for the event.
     *
     * @throws com.rostermate.backend.global.error.ProblemException {@code EVENT_NOT_FOUND} if there is no such event
     */
    void lockEvent(UUID eventId);

    boolean hasAssignment(long volunteerId, CatalogueRole role, UUID eventId);

    /**
     * Whether anyone at all holds the role at the event.
     */
    boolean isRoleTaken(CatalogueRole role, UUID eventId);

    /**
     * Roles the volunteer holds at the event, in catalogue display order.
     */
    List<CatalogueRole> rolesHeldBy(long volunteerId, UUID eventId);

    /**
     * Inserts and flushes the assignment.
     *
     * @throws UniqueConstraintViolationException when storage rejects a duplicate triple or a second holder of a
     *                                            unique role
     */
    void insert(long volunteerId, CatalogueRole role, UUID eventId);

    /**
     * Removes every role the volunteer holds at the event.
     *
     * @return number of removed assignments
     */
    int deleteAll(long volunteerId, UUID eventId);
}
