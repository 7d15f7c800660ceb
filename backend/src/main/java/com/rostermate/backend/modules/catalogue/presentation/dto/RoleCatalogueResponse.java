package com.rostermate.backend.modules.catalogue.presentation.dto;

import java.util.List;

public record RoleCatalogueResponse(
        List<RoleResponse> roles,
        List<ExclusionGroupResponse> exclusionGroups
) {
}
