package de.zeiterfassung.api_gleitzeit.service.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeServiceTest {

    private final TimeService timeService = new TimeService();

    @Test
    void parse_acceptsTwoDigitHoursAndMinutes() {
        assertThat(timeService.parse("07:05")).isEqualTo(LocalTime.of(7, 5));
        assertThat(timeService.parse(" 23:59 ")).isEqualTo(LocalTime.of(23, 59));
    }

    @Test
    void parse_rejectsMalformedTimes() {
        assertThatThrownBy(() -> timeService.parse("7:5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timeService.parse("25:00")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timeService.parse("")).hasMessage("Uhrzeit fehlt.");
    }

    @Test
    void parseDate_acceptsIsoAndGermanFormat() {
        assertThat(timeService.parseDate("2025-03-12")).isEqualTo(LocalDate.of(2025, 3, 12));
        assertThat(timeService.parseDate("12.03.2025")).isEqualTo(LocalDate.of(2025, 3, 12));
    }

    @Test
    void parseDate_isStrict() {
        assertThatThrownBy(() -> timeService.parseDate("31.02.2025")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timeService.parseDate("morgen")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hoursConversionAndRounding() {
        assertThat(timeService.toHours(Duration.ofMinutes(15))).isEqualTo(0.25);
        assertThat(timeService.fromHours(7.6)).isEqualTo(Duration.ofMinutes(456));
        assertThat(timeService.round2(1.005)).isEqualTo(1.01);
        assertThat(timeService.round2(-0.333333)).isEqualTo(-0.33);
    }
}
