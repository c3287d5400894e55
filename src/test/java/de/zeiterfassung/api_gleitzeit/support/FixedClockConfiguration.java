package de.zeiterfassung.api_gleitzeit.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Mittwoch, 12.03.2025, 10:00 Uhr in Berlin.
 */
@TestConfiguration
public class FixedClockConfiguration {

    public static final Instant NOW = Instant.parse("2025-03-12T09:00:00Z");

    @Bean
    @Primary
    public Clock fixedClock() {
        return Clock.fixed(NOW, ZoneId.of("Europe/Berlin"));
    }
}
