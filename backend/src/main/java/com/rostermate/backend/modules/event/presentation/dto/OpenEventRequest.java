package com.rostermate.backend.modules.event.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OpenEventRequest(
        @NotBlank(message = "LOCATION_REQUIRED")
        @Size(max = 120, message = "LOCATION_TOO_LONG")
        String locationName,
        LocalDate eventDate
) {
}
