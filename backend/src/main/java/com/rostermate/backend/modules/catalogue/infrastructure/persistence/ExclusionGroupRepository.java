package com.rostermate.backend.modules.catalogue.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import com.rostermate.backend.modules.catalogue.domain.ExclusionGroup;

public interface ExclusionGroupRepository extends JpaRepository<ExclusionGroup, String> {

    @Query("""
            select distinct g
              from ExclusionGroup g
              left join fetch g.members m
             order by g.code asc
            """)
    List<ExclusionGroup> findAllWithMembers();
}
