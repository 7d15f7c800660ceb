package com.rostermate.backend.modules.catalogue.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;

public interface CatalogueRoleRepository extends JpaRepository<CatalogueRole, String> {

    Optional<CatalogueRole> findByCodeIgnoreCase(String code);

    Optional<CatalogueRole> findByDisplayNameIgnoreCase(String displayName);

    List<CatalogueRole> findAllByOrderBySortOrderAsc();

    @Query("""
            select distinct r
              from CatalogueRole r
              left join fetch r.exclusionGroups g
             order by r.sortOrder asc
            """)
    List<CatalogueRole> findAllWithExclusionGroups();
}
