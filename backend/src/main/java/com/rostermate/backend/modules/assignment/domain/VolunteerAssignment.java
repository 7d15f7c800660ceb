package com.rostermate.backend.modules.assignment.domain;

import java.util.UUID;

import com.rostermate.backend.global.jpa.AbstractTimestampedEntity;
import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;
import com.rostermate.backend.modules.event.domain.RosterEvent;
import com.rostermate.backend.modules.volunteer.domain.Volunteer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * "This volunteer fills this role at this event". Inserted and deleted, never updated.
 * {@code exclusiveRole} copies the role's uniqueness flag so the partial unique index on
 * (role_code, event_id) can enforce single occupancy in storage.
 */
@Entity
@Table(name = "volunteer_assignment")
public class VolunteerAssignment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "volunteer_id", nullable = false, updatable = false)
    private Volunteer volunteer;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "role_code", nullable = false, updatable = false)
    private CatalogueRole role;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", nullable = false, updatable = false)
    private RosterEvent event;

    @Column(name = "exclusive_role", nullable = false, updatable = false)
    private boolean exclusiveRole;

    public UUID getId() {
        return id;
    }

    public Volunteer getVolunteer() {
        return volunteer;
    }

    public void setVolunteer(Volunteer volunteer) {
        this.volunteer = volunteer;
    }

    public CatalogueRole getRole() {
        return role;
    }

    public void setRole(CatalogueRole role) {
        this.role = role;
        this.exclusiveRole = role != null && role.isUniquePerEvent();
    }

    public RosterEvent getEvent() {
        return event;
    }

    public void setEvent(RosterEvent event) {
        this.event = event;
    }

    public boolean isExclusiveRole() {
        return exclusiveRole;
    }
}
