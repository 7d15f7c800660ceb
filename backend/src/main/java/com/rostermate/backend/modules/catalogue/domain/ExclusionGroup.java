package com.rostermate.backend.modules.catalogue.domain;

import java.util.LinkedHashSet;
import java.util.Set;

import com.rostermate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;

/**
 * Named set of roles of which a single volunteer may hold at most one per event.
 */
@Entity
@Table(name = "exclusion_group")
public class ExclusionGroup extends AbstractTimestampedEntity {

    @Id
    @Column(name = "code", nullable = false, length = 32)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @ManyToMany
    @JoinTable(
            name = "exclusion_group_member",
            joinColumns = @JoinColumn(name = "group_code"),
            inverseJoinColumns = @JoinColumn(name = "role_code")
    )
    private Set<CatalogueRole> members = new LinkedHashSet<>();

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Set<CatalogueRole> getMembers() {
        return members;
    }

    public void addMember(CatalogueRole role) {
        members.add(role);
        role.getExclusionGroups().add(this);
    }

    public boolean contains(String roleCode) {
        return members.stream().anyMatch(member -> member.getCode().equals(roleCode));
    }
}
