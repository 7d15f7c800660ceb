package com.rostermate.backend.modules.volunteer.presentation.dto;

import jakarta.validation.constraints.Size;

public record RegisterVolunteerRequest(
        @Size(max = 100, message = "FIRST_NAME_TOO_LONG")
        String firstName,
        @Size(max = 100, message = "LAST_NAME_TOO_LONG")
        String lastName,
        @Size(max = 100, message = "HANDLE_TOO_LONG")
        String handle
) {
}
