package com.rostermate.backend.modules.assignment.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rostermate.backend.global.error.ProblemException;
import com.rostermate.backend.modules.assignment.domain.VolunteerAssignment;
import com.rostermate.backend.modules.assignment.infrastructure.persistence.VolunteerAssignmentRepository;
import com.rostermate.backend.modules.catalogue.application.RoleCatalogueService;
import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;
import com.rostermate.backend.modules.event.infrastructure.persistence.RosterEventRepository;
import com.rostermate.backend.modules.volunteer.infrastructure.persistence.VolunteerRepository;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(propagation = Propagation.MANDATORY)
public class JpaAssignmentStore implements AssignmentStore {

    static final String UQ_VOLUNTEER_ROLE_EVENT = "uq_assignment_volunteer_role_event";
    static final String UQ_UNIQUE_ROLE_EVENT = "uq_assignment_unique_role_event";
    static final String FK_VOLUNTEER = "fk_assignment_volunteer";

    private final RoleCatalogueService roleCatalogueService;
    private final RosterEventRepository rosterEventRepository;
    private final VolunteerRepository volunteerRepository;
    private final VolunteerAssignmentRepository volunteerAssignmentRepository;

    public JpaAssignmentStore(
            RoleCatalogueService roleCatalogueService,
            RosterEventRepository rosterEventRepository,
            VolunteerRepository volunteerRepository,
            VolunteerAssignmentRepository volunteerAssignmentRepository
    ) {
        this.roleCatalogueService = roleCatalogueService;
        this.rosterEventRepository = rosterEventRepository;
        this.volunteerRepository = volunteerRepository;
        this.volunteerAssignmentRepository = volunteerAssignmentRepository;
    }

    @Override
    public Optional<CatalogueRole> findRole(String roleName) {
        return roleCatalogueService.resolve(roleName);
    }

    @Override
    public void lockEvent(UUID eventId) {
        rosterEventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "EVENT_NOT_FOUND"));
    }

    @Override
    public boolean hasAssignment(long volunteerId, CatalogueRole role, UUID eventId) {
        return volunteerAssignmentRepository.existsByVolunteerIdAndRoleCodeAndEventId(volunteerId, role.getCode(), eventId);
    }

    @Override
    public boolean isRoleTaken(CatalogueRole role, UUID eventId) {
        return volunteerAssignmentRepository.existsByRoleCodeAndEventId(role.getCode(), eventId);
    }

    @Override
    public List<CatalogueRole> rolesHeldBy(long volunteerId, UUID eventId) {
        return volunteerAssignmentRepository.findRolesHeld(volunteerId, eventId);
    }

    @Override
    public void insert(long volunteerId, CatalogueRole role, UUID eventId) {
        VolunteerAssignment assignment = new VolunteerAssignment();
        assignment.setVolunteer(volunteerRepository.getReferenceById(volunteerId));
        assignment.setRole(role);
        assignment.setEvent(rosterEventRepository.getReferenceById(eventId));
        try {
            volunteerAssignmentRepository.saveAndFlush(assignment);
        } catch (DataIntegrityViolationException ex) {
            String message = violationMessage(ex);
            if (message.contains(UQ_UNIQUE_ROLE_EVENT)) {
                throw new UniqueConstraintViolationException(
                        UniqueConstraintViolationException.Constraint.UNIQUE_ROLE_EVENT,
                        role.getCode(), role.getDisplayName(), ex);
            }
            if (message.contains(UQ_VOLUNTEER_ROLE_EVENT)) {
                throw new UniqueConstraintViolationException(
                        UniqueConstraintViolationException.Constraint.VOLUNTEER_ROLE_EVENT,
                        role.getCode(), role.getDisplayName(), ex);
            }
            if (message.contains(FK_VOLUNTEER)) {
                throw new ProblemException(HttpStatus.NOT_FOUND, "VOLUNTEER_NOT_FOUND", null, ex);
            }
            throw ex;
        }
    }

    @Override
    public int deleteAll(long volunteerId, UUID eventId) {
        return volunteerAssignmentRepository.deleteByVolunteerAndEvent(volunteerId, eventId);
    }

    private String violationMessage(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null ? message : "";
    }
}
