package com.rostermate.backend.modules.assignment.domain;

import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;

/**
 * Result of an assignment attempt. {@code ok} is true exactly when a record was committed; otherwise
 * {@code reason} says why and the role fields carry what a caller needs to explain it.
 */
public record AssignmentDecision(
        boolean ok,
        DeclineReason reason,
        String roleCode,
        String roleName,
        String conflictingRoleCode,
        String conflictingRoleName
) {

    public static AssignmentDecision committed(CatalogueRole role) {
        return new AssignmentDecision(true, null, role.getCode(), role.getDisplayName(), null, null);
    }

    public static AssignmentDecision roleNotFound(String requestedName) {
        return new AssignmentDecision(false, DeclineReason.ROLE_NOT_FOUND, null, requestedName, null, null);
    }

    public static AssignmentDecision alreadyAssigned(String roleCode, String roleName) {
        return new AssignmentDecision(false, DeclineReason.ALREADY_ASSIGNED_SAME_ROLE, roleCode, roleName, null, null);
    }

    public static AssignmentDecision roleTaken(String roleCode, String roleName) {
        return new AssignmentDecision(false, DeclineReason.ROLE_TAKEN, roleCode, roleName, null, null);
    }

    public static AssignmentDecision exclusionConflict(CatalogueRole requested, CatalogueRole conflicting) {
        return new AssignmentDecision(false, DeclineReason.EXCLUSION_CONFLICT,
                requested.getCode(), requested.getDisplayName(),
                conflicting.getCode(), conflicting.getDisplayName());
    }

    public String message() {
        if (ok) {
            return "Signed up as '" + roleName + "'";
        }
        return switch (reason) {
            case ROLE_NOT_FOUND -> "Role '" + roleName + "' is not in the catalogue";
            case ALREADY_ASSIGNED_SAME_ROLE -> "Already signed up as '" + roleName + "' for this event";
            case ROLE_TAKEN -> "Role '" + roleName + "' is already taken for this event";
            case EXCLUSION_CONFLICT -> "Role '" + roleName + "' cannot be combined with '"
                    + conflictingRoleName + "', which is already held for this event";
        };
    }
}
