package com.rostermate.backend.modules.roster.presentation.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.rostermate.backend.modules.roster.application.EventRoster;

public record EventRosterResponse(
        UUID eventId,
        String locationName,
        LocalDate eventDate,
        List<RosterEntryResponse> entries
) {

    public static EventRosterResponse from(EventRoster roster) {
        List<RosterEntryResponse> entries = roster.entries().stream()
                .map(entry -> new RosterEntryResponse(
                        entry.roleCode(),
                        entry.roleName(),
                        entry.volunteerId(),
                        entry.assigneeName(),
                        entry.assigneeHandle(),
                        entry.filled()
                ))
                .toList();
        return new EventRosterResponse(roster.eventId(), roster.locationName(), roster.eventDate(), entries);
    }
}
