package com.rostermate.backend.modules.roster.application;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record EventRoster(
        UUID eventId,
        String locationName,
        LocalDate eventDate,
        List<RosterEntry> entries
) {
}
