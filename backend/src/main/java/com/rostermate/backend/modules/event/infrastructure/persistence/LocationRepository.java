package com.rostermate.backend.modules.event.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.rostermate.backend.modules.event.domain.Location;

public interface LocationRepository extends JpaRepository<Location, UUID> {

    List<Location> findByActiveTrueOrderByNameAsc();

    Optional<Location> findByNameIgnoreCaseAndActiveTrue(String name);
}
