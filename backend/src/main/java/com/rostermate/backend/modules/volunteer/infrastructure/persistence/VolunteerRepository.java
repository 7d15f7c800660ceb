package com.rostermate.backend.modules.volunteer.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.rostermate.backend.modules.volunteer.domain.Volunteer;

public interface VolunteerRepository extends JpaRepository<Volunteer, Long> {

    @Modifying(clearAutomatically = true)
    @Query(value = """
            INSERT INTO volunteer (id, first_name, last_name, full_name, handle, created_at, updated_at)
            VALUES (:id, :firstName, :lastName, :fullName, :handle, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (id) DO UPDATE
               SET first_name = EXCLUDED.first_name,
                   last_name = EXCLUDED.last_name,
                   full_name = EXCLUDED.full_name,
                   handle = EXCLUDED.handle,
                   updated_at = CURRENT_TIMESTAMP
            """, nativeQuery = true)
    int upsertProfile(
            @Param("id") Long id,
            @Param("firstName") String firstName,
            @Param("lastName") String lastName,
            @Param("fullName") String fullName,
            @Param("handle") String handle);
}
