package com.smartroom.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Booking engine settings, bound from {@code booking.*}.
 *
 * Example:
 * booking:
 *   admission:
 *     lock-strategy: local   # local | distributed
 *     lock-wait: 3s
 *     lock-lease: 30s
 *   recurrence:
 *     zone: Europe/Berlin
 *     max-occurrences: 366
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "booking")
public class BookingEngineProperties {

    private Admission admission = new Admission();
    private Recurrence recurrence = new Recurrence();
    private Policy policy = new Policy();
    private RoomDirectory roomDirectory = new RoomDirectory();

    @Getter
    @Setter
    public static class Admission {
        private String lockStrategy = "local";

        /** How long a request queues for its room before the outcome is BUSY. */
        private Duration lockWait = Duration.ofSeconds(3);

        /** Distributed lock only. */
        private Duration lockLease = Duration.ofSeconds(30);

        private Duration persistenceBackoff = Duration.ofMillis(100);
    }

    @Getter
    @Setter
    public static class Recurrence {
        private String zone = "UTC";
        private int maxOccurrences = 366;
    }

    @Getter
    @Setter
    public static class Policy {
        private Duration minDuration = Duration.ofMinutes(15);
        private Duration maxDuration = Duration.ofDays(7);
        private int maxTitleLength = 200;
        private String defaultTitle = "Meeting";
        private int maxDescriptionLength = 2000;
        private int maxPageSize = 100;
    }

    @Getter
    @Setter
    public static class RoomDirectory {
        private String url = "http://localhost:8082";
    }
}
