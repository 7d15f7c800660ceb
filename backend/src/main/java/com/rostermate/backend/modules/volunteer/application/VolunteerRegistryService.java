package com.rostermate.backend.modules.volunteer.application;

import com.rostermate.backend.global.error.ProblemException;
import com.rostermate.backend.modules.volunteer.domain.Volunteer;
import com.rostermate.backend.modules.volunteer.infrastructure.persistence.VolunteerRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class VolunteerRegistryService {

    private final VolunteerRepository volunteerRepository;

    public VolunteerRegistryService(VolunteerRepository volunteerRepository) {
        this.volunteerRepository = volunteerRepository;
    }

    /**
     * Creates the volunteer on first contact and refreshes the profile fields on later ones.
     */
    public Volunteer register(long externalId, String firstName, String lastName, String handle) {
        if (externalId <= 0) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_VOLUNTEER_ID");
        }
        String first = normalize(firstName);
        String last = normalize(lastName);
        String fullName = (first + " " + last).trim();
        volunteerRepository.upsertProfile(externalId, first, last, fullName, normalize(handle));
        return get(externalId);
    }

    @Transactional(readOnly = true)
    public Volunteer get(long volunteerId) {
        return volunteerRepository.findById(volunteerId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "VOLUNTEER_NOT_FOUND"));
    }

    private String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
