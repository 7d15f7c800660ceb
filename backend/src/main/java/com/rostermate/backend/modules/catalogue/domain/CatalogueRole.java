package com.rostermate.backend.modules.catalogue.domain;

import java.util.LinkedHashSet;
import java.util.Set;

import com.rostermate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;

/**
 * A position volunteers can fill at an event. Reference data seeded by migration and not edited at runtime.
 * The {@code code} is the identity used by constraints; {@code displayName} is presentation only.
 */
@Entity
@Table(name = "catalogue_role")
public class CatalogueRole extends AbstractTimestampedEntity {

    @Id
    @Column(name = "code", nullable = false, length = 32)
    private String code;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "unique_per_event", nullable = false)
    private boolean uniquePerEvent;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @ManyToMany(mappedBy = "members")
    private Set<ExclusionGroup> exclusionGroups = new LinkedHashSet<>();

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public boolean isUniquePerEvent() {
        return uniquePerEvent;
    }

    public void setUniquePerEvent(boolean uniquePerEvent) {
        this.uniquePerEvent = uniquePerEvent;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(int sortOrder) {
        this.sortOrder = sortOrder;
    }

    public Set<ExclusionGroup> getExclusionGroups() {
        return exclusionGroups;
    }

    /**
     * True when both roles share at least one exclusion group, so one volunteer may not hold them
     * together at the same event. A role never excludes itself.
     */
    public boolean excludes(CatalogueRole other) {
        if (other == null || code.equals(other.getCode())) {
            return false;
        }
        return exclusionGroups.stream().anyMatch(group -> group.contains(other.getCode()));
    }
}
