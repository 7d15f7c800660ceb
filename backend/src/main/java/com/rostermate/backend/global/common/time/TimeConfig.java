package com.rostermate.backend.global.common.time;

import java.time.Clock;

import com.rostermate.backend.modules.event.application.CalendarProperties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single clock source for every module, ticking in the calendar zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock calendarClock(CalendarProperties calendarProperties) {
        return Clock.system(calendarProperties.zone());
    }
}
