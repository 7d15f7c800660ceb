package com.rostermate.backend.modules.assignment.presentation.dto;

import java.util.UUID;

public record AssignmentResponse(
        UUID eventId,
        Long volunteerId,
        String roleCode,
        String roleName,
        String message
) {
}
