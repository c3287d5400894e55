package de.zeiterfassung.api_gleitzeit.service.common;

import java.time.Duration;
import java.time.LocalTime;

/**
 * Gesetzliche Grenzwerte nach ArbZG (Erwachsene) und JArbSchG (Minderjährige).
 */
public final class LaborLaw {

    private LaborLaw() {
    }

    // Arbeitsfenster
    public static final LocalTime WORK_WINDOW_START = LocalTime.of(6, 0);
    public static final LocalTime ADULT_WORK_WINDOW_END = LocalTime.of(22, 0);
    public static final LocalTime MINOR_WORK_WINDOW_END = LocalTime.of(20, 0);

    // Pausen
    public static final Duration ADULT_LONG_SHIFT = Duration.ofHours(9);
    public static final Duration ADULT_LONG_BREAK = Duration.ofMinutes(45);
    public static final Duration ADULT_SHORT_SHIFT = Duration.ofHours(6);
    public static final Duration ADULT_SHORT_BREAK = Duration.ofMinutes(30);
    public static final Duration MINOR_LONG_SHIFT = Duration.ofHours(6);
    public static final Duration MINOR_LONG_BREAK = Duration.ofMinutes(60);
    public static final Duration MINOR_SHORT_SHIFT = Duration.ofMinutes(270);
    public static final Duration MINOR_SHORT_BREAK = Duration.ofMinutes(30);

    // Ruhezeiten
    public static final Duration ADULT_REST_PERIOD = Duration.ofHours(11);
    public static final Duration MINOR_REST_PERIOD = Duration.ofHours(12);

    // Tageshöchstarbeitszeit (nach Pausenabzug)
    public static final Duration ADULT_DAILY_MAXIMUM = Duration.ofHours(10);
    public static final Duration MINOR_DAILY_MAXIMUM = Duration.ofHours(8);

    // Durchschnitt über 24 Wochen
    public static final int AVERAGE_WINDOW_WEEKS = 24;
    public static final Duration AVERAGE_DAILY_LIMIT = Duration.ofHours(8);

    // Minderjährige pro Woche
    public static final Duration MINOR_WEEKLY_MAXIMUM = Duration.ofHours(40);
    public static final int MINOR_MAX_WORKDAYS_PER_WEEK = 5;

    // PopUp-Warnungen: eingestempelte Bruttozeit, 30 Minuten Vorlauf
    public static final Duration ADULT_GROSS_DAILY_MAXIMUM = Duration.ofMinutes(10 * 60 + 45);
    public static final Duration MINOR_GROSS_DAILY_MAXIMUM = Duration.ofHours(9);
    public static final Duration POPUP_LEAD_TIME = Duration.ofMinutes(30);

    public static LocalTime workWindowEnd(boolean minor) {
        return minor ? MINOR_WORK_WINDOW_END : ADULT_WORK_WINDOW_END;
    }

    public static Duration restPeriod(boolean minor) {
        return minor ? MINOR_REST_PERIOD : ADULT_REST_PERIOD;
    }

    public static Duration dailyMaximum(boolean minor) {
        return minor ? MINOR_DAILY_MAXIMUM : ADULT_DAILY_MAXIMUM;
    }

    public static Duration grossDailyMaximum(boolean minor) {
        return minor ? MINOR_GROSS_DAILY_MAXIMUM : ADULT_GROSS_DAILY_MAXIMUM;
    }
}
