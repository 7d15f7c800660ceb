package com.rostermate.backend.modules.catalogue.presentation.dto;

import java.util.List;

public record RoleResponse(
        String code,
        String displayName,
        boolean uniquePerEvent,
        int sortOrder,
        List<String> exclusionGroups
) {
}
