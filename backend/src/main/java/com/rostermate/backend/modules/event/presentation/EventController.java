package com.rostermate.backend.modules.event.presentation;

import java.util.List;
import java.util.UUID;

import com.rostermate.backend.modules.event.application.EventCalendarService;
import com.rostermate.backend.modules.event.presentation.dto.EventResponse;
import com.rostermate.backend.modules.event.presentation.dto.LocationResponse;
import com.rostermate.backend.modules.event.presentation.dto.OpenEventRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EventController {

    private final EventCalendarService eventCalendarService;

    public EventController(EventCalendarService eventCalendarService) {
        this.eventCalendarService = eventCalendarService;
    }

    @GetMapping("/locations")
    public ResponseEntity<List<LocationResponse>> listLocations() {
        List<LocationResponse> locations = eventCalendarService.listActiveLocations().stream()
                .map(location -> new LocationResponse(location.getId(), location.getName()))
                .toList();
        return ResponseEntity.ok(locations);
    }

    @PostMapping("/events")
    public ResponseEntity<EventResponse> openEvent(@Valid @RequestBody OpenEventRequest request) {
        return ResponseEntity.ok(EventResponse.from(
                eventCalendarService.openEvent(request.locationName(), request.eventDate())));
    }

    @GetMapping("/events/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(EventResponse.from(eventCalendarService.getEvent(eventId)));
    }
}
