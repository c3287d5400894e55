package de.zeiterfassung.api_gleitzeit.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${gleitzeit.clock.zone:Europe/Berlin}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
