package com.rostermate.backend.modules.volunteer.presentation.dto;

import com.rostermate.backend.modules.volunteer.domain.Volunteer;

public record VolunteerResponse(
        Long volunteerId,
        String fullName,
        String handle
) {

    public static VolunteerResponse from(Volunteer volunteer) {
        return new VolunteerResponse(volunteer.getId(), volunteer.getFullName(), volunteer.getHandle());
    }
}
