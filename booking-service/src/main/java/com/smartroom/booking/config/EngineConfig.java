package com.smartroom.booking.config;

import com.smartroom.booking.domain.service.RecurrenceExpander;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RecurrenceExpander recurrenceExpander(BookingEngineProperties properties) {
        ZoneId zone = ZoneId.of(properties.getRecurrence().getZone());
        log.info("Recurrence expansion zone: {}, horizon: {} occurrences",
                zone, properties.getRecurrence().getMaxOccurrences());
        return new RecurrenceExpander(zone);
    }
}
