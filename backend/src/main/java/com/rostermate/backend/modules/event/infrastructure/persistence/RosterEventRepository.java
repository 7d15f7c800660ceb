package com.rostermate.backend.modules.event.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.rostermate.backend.modules.event.domain.RosterEvent;

public interface RosterEventRepository extends JpaRepository<RosterEvent, UUID> {

    @Query("""
            select e from RosterEvent e
              join fetch e.location l
             where l.id = :locationId
               and e.eventDate = :eventDate
            """)
    Optional<RosterEvent> findByLocationAndDate(
            @Param("locationId") UUID locationId,
            @Param("eventDate") LocalDate eventDate);

    @Query("select e from RosterEvent e join fetch e.location where e.id = :id")
    Optional<RosterEvent> findWithLocation(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from RosterEvent e where e.id = :id")
    Optional<RosterEvent> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Race-free lazy creation: concurrent callers for the same (location, date) all end up reading one row.
     */
    @Modifying
    @Query(value = """
            INSERT INTO roster_event (id, location_id, event_date, created_at, updated_at)
            VALUES (gen_random_uuid(), :locationId, :eventDate, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (location_id, event_date) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("locationId") UUID locationId, @Param("eventDate") LocalDate eventDate);
}
