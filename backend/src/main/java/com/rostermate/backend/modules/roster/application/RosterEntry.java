package com.rostermate.backend.modules.roster.application;

/**
 * One line of the roster. Unfilled roles have a null volunteer id and empty assignee fields.
 */
public record RosterEntry(
        String roleCode,
        String roleName,
        Long volunteerId,
        String assigneeName,
        String assigneeHandle
) {

    public static RosterEntry unfilled(String roleCode, String roleName) {
        return new RosterEntry(roleCode, roleName, null, "", "");
    }

    public boolean filled() {
        return volunteerId != null;
    }
}
