package com.rostermate.backend.modules.assignment.domain;

/**
 * Business-rule outcomes of a refused assignment. These are expected results, not failures.
 */
public enum DeclineReason {
    ROLE_NOT_FOUND,
    ALREADY_ASSIGNED_SAME_ROLE,
    ROLE_TAKEN,
    EXCLUSION_CONFLICT
}
