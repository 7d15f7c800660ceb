package com.rostermate.backend.modules.volunteer.presentation;

import com.rostermate.backend.modules.volunteer.application.VolunteerRegistryService;
import com.rostermate.backend.modules.volunteer.presentation.dto.RegisterVolunteerRequest;
import com.rostermate.backend.modules.volunteer.presentation.dto.VolunteerResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/volunteers")
public class VolunteerController {

    private final VolunteerRegistryService volunteerRegistryService;

    public VolunteerController(VolunteerRegistryService volunteerRegistryService) {
        this.volunteerRegistryService = volunteerRegistryService;
    }

    @PutMapping("/{volunteerId}")
    public ResponseEntity<VolunteerResponse> register(
            @PathVariable("volunteerId") long volunteerId,
            @Valid @RequestBody RegisterVolunteerRequest request
    ) {
        return ResponseEntity.ok(VolunteerResponse.from(volunteerRegistryService.register(
                volunteerId,
                request.firstName(),
                request.lastName(),
                request.handle()
        )));
    }

    @GetMapping("/{volunteerId}")
    public ResponseEntity<VolunteerResponse> get(@PathVariable("volunteerId") long volunteerId) {
        return ResponseEntity.ok(VolunteerResponse.from(volunteerRegistryService.get(volunteerId)));
    }
}
