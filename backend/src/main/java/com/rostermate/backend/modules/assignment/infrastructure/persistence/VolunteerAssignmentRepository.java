package com.rostermate.backend.modules.assignment.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.rostermate.backend.modules.assignment.domain.VolunteerAssignment;
import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;

public interface VolunteerAssignmentRepository extends JpaRepository<VolunteerAssignment, UUID> {

    boolean existsByVolunteerIdAndRoleCodeAndEventId(Long volunteerId, String roleCode, UUID eventId);

    boolean existsByRoleCodeAndEventId(String roleCode, UUID eventId);

    @Query("""
            select a.role
              from VolunteerAssignment a
             where a.volunteer.id = :volunteerId
               and a.event.id = :eventId
             order by a.role.sortOrder asc
            """)
    List<CatalogueRole> findRolesHeld(@Param("volunteerId") Long volunteerId, @Param("eventId") UUID eventId);

    @Query("""
            select a
              from VolunteerAssignment a
              join fetch a.volunteer v
              join fetch a.role r
             where a.event.id = :eventId
             order by a.createdAt asc, a.id asc
            """)
    List<VolunteerAssignment> findByEventWithVolunteer(@Param("eventId") UUID eventId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from VolunteerAssignment a where a.volunteer.id = :volunteerId and a.event.id = :eventId")
    int deleteByVolunteerAndEvent(@Param("volunteerId") Long volunteerId, @Param("eventId") UUID eventId);
}
