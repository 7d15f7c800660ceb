package com.rostermate.backend.modules.roster.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.rostermate.backend.modules.assignment.domain.VolunteerAssignment;
import com.rostermate.backend.modules.assignment.infrastructure.persistence.VolunteerAssignmentRepository;
import com.rostermate.backend.modules.catalogue.application.RoleCatalogueService;
import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;
import com.rostermate.backend.modules.event.application.EventCalendarService;
import com.rostermate.backend.modules.event.domain.RosterEvent;
import com.rostermate.backend.modules.volunteer.domain.Volunteer;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds the "who fills what" view of an event: every catalogue role in display order, each followed by
 * its committed assignees, or a single empty line when nobody has taken it.
 */
@Service
public class EventRosterProjector {

    private final EventCalendarService eventCalendarService;
    private final RoleCatalogueService roleCatalogueService;
    private final VolunteerAssignmentRepository volunteerAssignmentRepository;

    public EventRosterProjector(
            EventCalendarService eventCalendarService,
            RoleCatalogueService roleCatalogueService,
            VolunteerAssignmentRepository volunteerAssignmentRepository
    ) {
        this.eventCalendarService = eventCalendarService;
        this.roleCatalogueService = roleCatalogueService;
        this.volunteerAssignmentRepository = volunteerAssignmentRepository;
    }

    // catalogue and assignment reads share one committed snapshot
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public EventRoster project(UUID eventId) {
        RosterEvent event = eventCalendarService.getEvent(eventId);
        List<CatalogueRole> roles = roleCatalogueService.listInDisplayOrder();

        Map<String, List<VolunteerAssignment>> byRole = new LinkedHashMap<>();
        for (VolunteerAssignment assignment : volunteerAssignmentRepository.findByEventWithVolunteer(eventId)) {
            byRole.computeIfAbsent(assignment.getRole().getCode(), code -> new ArrayList<>()).add(assignment);
        }

        List<RosterEntry> entries = new ArrayList<>();
        for (CatalogueRole role : roles) {
            List<VolunteerAssignment> holders = byRole.getOrDefault(role.getCode(), List.of());
            if (holders.isEmpty()) {
                entries.add(RosterEntry.unfilled(role.getCode(), role.getDisplayName()));
                continue;
            }
            for (VolunteerAssignment holder : holders) {
                Volunteer volunteer = holder.getVolunteer();
                entries.add(new RosterEntry(
                        role.getCode(),
                        role.getDisplayName(),
                        volunteer.getId(),
                        volunteer.getFullName(),
                        volunteer.getHandle()
                ));
            }
        }
        return new EventRoster(event.getId(), event.getLocation().getName(), event.getEventDate(), List.copyOf(entries));
    }
}
