package com.rostermate.backend.modules.roster.presentation;

import java.util.UUID;

import com.rostermate.backend.modules.roster.application.EventRosterProjector;
import com.rostermate.backend.modules.roster.presentation.dto.EventRosterResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RosterController {

    private final EventRosterProjector eventRosterProjector;

    public RosterController(EventRosterProjector eventRosterProjector) {
        this.eventRosterProjector = eventRosterProjector;
    }

    @GetMapping("/events/{eventId}/roster")
    public ResponseEntity<EventRosterResponse> getRoster(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(EventRosterResponse.from(eventRosterProjector.project(eventId)));
    }
}
