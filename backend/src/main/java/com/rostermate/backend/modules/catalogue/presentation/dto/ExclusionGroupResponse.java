package com.rostermate.backend.modules.catalogue.presentation.dto;

import java.util.List;

public record ExclusionGroupResponse(
        String code,
        String name,
        List<String> memberRoleCodes
) {
}
