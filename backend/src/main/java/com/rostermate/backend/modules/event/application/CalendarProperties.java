package com.rostermate.backend.modules.event.application;

import java.time.DayOfWeek;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Weekly cycle settings: the zone the locations live in and the weekday the event is held.
 */
@ConfigurationProperties(prefix = "rostermate.calendar")
public record CalendarProperties(
        ZoneId zone,
        DayOfWeek eventDay
) {

    public CalendarProperties {
        if (zone == null) {
            zone = ZoneId.of("UTC");
        }
        if (eventDay == null) {
            eventDay = DayOfWeek.SATURDAY;
        }
    }
}
