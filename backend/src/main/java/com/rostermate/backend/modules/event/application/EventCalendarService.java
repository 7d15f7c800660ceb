package com.rostermate.backend.modules.event.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.UUID;

import com.rostermate.backend.global.error.ProblemException;
import com.rostermate.backend.modules.event.domain.Location;
import com.rostermate.backend.modules.event.domain.RosterEvent;
import com.rostermate.backend.modules.event.infrastructure.persistence.LocationRepository;
import com.rostermate.backend.modules.event.infrastructure.persistence.RosterEventRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class EventCalendarService {

    private static final Logger log = LoggerFactory.getLogger(EventCalendarService.class);

    private final LocationRepository locationRepository;
    private final RosterEventRepository rosterEventRepository;
    private final CalendarProperties calendarProperties;
    private final Clock clock;

    public EventCalendarService(
            LocationRepository locationRepository,
            RosterEventRepository rosterEventRepository,
            CalendarProperties calendarProperties,
            Clock clock
    ) {
        this.locationRepository = locationRepository;
        this.rosterEventRepository = rosterEventRepository;
        this.calendarProperties = calendarProperties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Location> listActiveLocations() {
        return locationRepository.findByActiveTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Location findActiveLocation(String locationName) {
        if (!StringUtils.hasText(locationName)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "LOCATION_REQUIRED");
        }
        return locationRepository.findByNameIgnoreCaseAndActiveTrue(locationName.trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "LOCATION_NOT_FOUND",
                        "No active location named '" + locationName.trim() + "'"));
    }

    /**
     * Next occurrence of the configured event weekday strictly after today.
     * On the event day itself this is the following week's date.
     */
    public LocalDate nextEventDate() {
        LocalDate today = LocalDate.now(clock.withZone(calendarProperties.zone()));
        return today.with(TemporalAdjusters.next(calendarProperties.eventDay()));
    }

    /**
     * Returns the event for the location on the given date, creating it on first use.
     * A null date means the upcoming cycle.
     */
    public RosterEvent openEvent(String locationName, LocalDate eventDate) {
        Location location = findActiveLocation(locationName);
        LocalDate targetDate = eventDate != null ? eventDate : nextEventDate();
        LocalDate today = LocalDate.now(clock.withZone(calendarProperties.zone()));
        if (targetDate.isBefore(today)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "EVENT_DATE_IN_PAST");
        }

        return rosterEventRepository.findByLocationAndDate(location.getId(), targetDate)
                .orElseGet(() -> {
                    int inserted = rosterEventRepository.insertIfAbsent(location.getId(), targetDate);
                    if (inserted > 0) {
                        log.info("Created event location={} date={}", location.getName(), targetDate);
                    }
                    return rosterEventRepository.findByLocationAndDate(location.getId(), targetDate)
                            .orElseThrow(() -> new IllegalStateException(
                                    "Event row missing after insert for location " + location.getId()));
                });
    }

    @Transactional(readOnly = true)
    public RosterEvent getEvent(UUID eventId) {
        return rosterEventRepository.findWithLocation(eventId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "EVENT_NOT_FOUND"));
    }
}
