package com.rostermate.backend.modules.event.presentation.dto;

import java.util.UUID;

public record LocationResponse(
        UUID locationId,
        String name
) {
}
