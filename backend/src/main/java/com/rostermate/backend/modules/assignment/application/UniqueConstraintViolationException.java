package com.rostermate.backend.modules.assignment.application;

/**
 * Storage refused an insert because one of the assignment uniqueness constraints fired.
 * Only reachable when something bypassed the event lock; the engine maps it to a decline.
 */
public class UniqueConstraintViolationException extends RuntimeException {

    public enum Constraint {
        VOLUNTEER_ROLE_EVENT,
        UNIQUE_ROLE_EVENT
    }

    private final Constraint constraint;
    private final String roleCode;
    private final String roleName;

    public UniqueConstraintViolationException(Constraint constraint, String roleCode, String roleName,
                                              Throwable cause) {
        super("Assignment constraint " + constraint + " violated for role " + roleCode, cause);
        this.constraint = constraint;
        this.roleCode = roleCode;
        this.roleName = roleName;
    }

    public Constraint getConstraint() {
        return constraint;
    }

    public String getRoleCode() {
        return roleCode;
    }

    public String getRoleName() {
        return roleName;
    }
}
