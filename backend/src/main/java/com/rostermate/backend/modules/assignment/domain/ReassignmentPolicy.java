package com.rostermate.backend.modules.assignment.domain;

/**
 * What happens when a volunteer who already holds roles at an event asks for another one.
 */
public enum ReassignmentPolicy {
    /** Existing roles stay; exclusion groups decide whether the new role may be added. */
    REQUIRE_UNASSIGN,
    /** Existing roles at the event are dropped and replaced by the requested one. */
    REPLACE_EXISTING
}
