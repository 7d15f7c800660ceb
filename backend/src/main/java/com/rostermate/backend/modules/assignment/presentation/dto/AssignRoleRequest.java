package com.rostermate.backend.modules.assignment.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record AssignRoleRequest(
        @NotNull(message = "VOLUNTEER_REQUIRED")
        @Positive(message = "VOLUNTEER_ID_INVALID")
        Long volunteerId,
        @NotBlank(message = "ROLE_REQUIRED")
        @Size(max = 100, message = "ROLE_NAME_TOO_LONG")
        String roleName
) {
}
