package com.rostermate.backend.modules.catalogue.application;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;
import com.rostermate.backend.modules.catalogue.domain.ExclusionGroup;
import com.rostermate.backend.modules.catalogue.infrastructure.persistence.CatalogueRoleRepository;
import com.rostermate.backend.modules.catalogue.infrastructure.persistence.ExclusionGroupRepository;
import com.rostermate.backend.modules.catalogue.presentation.dto.ExclusionGroupResponse;
import com.rostermate.backend.modules.catalogue.presentation.dto.RoleCatalogueResponse;
import com.rostermate.backend.modules.catalogue.presentation.dto.RoleResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional(readOnly = true)
public class RoleCatalogueService {

    private final CatalogueRoleRepository catalogueRoleRepository;
    private final ExclusionGroupRepository exclusionGroupRepository;

    public RoleCatalogueService(
            CatalogueRoleRepository catalogueRoleRepository,
            ExclusionGroupRepository exclusionGroupRepository
    ) {
        this.catalogueRoleRepository = catalogueRoleRepository;
        this.exclusionGroupRepository = exclusionGroupRepository;
    }

    /**
     * Resolves a caller-supplied role name. The canonical code wins; the display label is accepted
     * as a fallback so chat keyboards that send the label keep working.
     */
    public Optional<CatalogueRole> resolve(String roleName) {
        if (!StringUtils.hasText(roleName)) {
            return Optional.empty();
        }
        String trimmed = roleName.trim();
        return catalogueRoleRepository.findByCodeIgnoreCase(trimmed)
                .or(() -> catalogueRoleRepository.findByDisplayNameIgnoreCase(trimmed));
    }

    public List<CatalogueRole> listInDisplayOrder() {
        return catalogueRoleRepository.findAllByOrderBySortOrderAsc();
    }

    public RoleCatalogueResponse describeCatalogue() {
        List<RoleResponse> roles = catalogueRoleRepository.findAllWithExclusionGroups().stream()
                .map(role -> new RoleResponse(
                        role.getCode(),
                        role.getDisplayName(),
                        role.isUniquePerEvent(),
                        role.getSortOrder(),
                        role.getExclusionGroups().stream()
                                .map(ExclusionGroup::getCode)
                                .sorted()
                                .toList()
                ))
                .toList();
        List<ExclusionGroupResponse> groups = exclusionGroupRepository.findAllWithMembers().stream()
                .map(group -> new ExclusionGroupResponse(
                        group.getCode(),
                        group.getName(),
                        group.getMembers().stream()
                                .sorted(Comparator.comparingInt(CatalogueRole::getSortOrder))
                                .map(CatalogueRole::getCode)
                                .toList()
                ))
                .toList();
        return new RoleCatalogueResponse(roles, groups);
    }
}
