package com.rostermate.backend.modules.roster.presentation.dto;

public record RosterEntryResponse(
        String roleCode,
        String roleName,
        Long volunteerId,
        String assigneeName,
        String assigneeHandle,
        boolean filled
) {
}
