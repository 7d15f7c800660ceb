package com.rostermate.backend.modules.event.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.rostermate.backend.modules.event.domain.RosterEvent;

public record EventResponse(
        UUID eventId,
        UUID locationId,
        String locationName,
        LocalDate eventDate
) {

    public static EventResponse from(RosterEvent event) {
        return new EventResponse(
                event.getId(),
                event.getLocation().getId(),
                event.getLocation().getName(),
                event.getEventDate()
        );
    }
}
