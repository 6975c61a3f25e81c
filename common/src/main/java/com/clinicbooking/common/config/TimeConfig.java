package com.clinicbooking.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single clock source for booking windows, "past" slots and job cut-offs.
 * Booking times are local wall-clock times of the configured zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(@Value("${app.time-zone:UTC}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }
}
