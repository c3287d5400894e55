package de.zeiterfassung.api_gleitzeit.entity.notification;

import java.util.Arrays;

public enum NotificationCode {
    MISSING_WORKDAY(1, false),          // Werktag ohne Stempel, Sollzeit abgezogen
    ODD_STAMP_COUNT(2, false),          // ungerade Anzahl Stempel
    REST_PERIOD(3, false),              // Ruhezeit unterschritten
    SIX_MONTH_AVERAGE(4, false),        // Durchschnitt der letzten 24 Wochen > 8h
    DAILY_MAXIMUM(5, false),            // Tageshöchstarbeitszeit überschritten
    SUNDAY_OR_HOLIDAY(6, false),        // Arbeit an Sonn- oder Feiertag
    MINOR_WEEKLY_HOURS(7, false),       // Minderjährige: mehr als 40h pro Woche
    MINOR_WORKDAYS(8, false),           // Minderjährige: mehr als 5 Arbeitstage pro Woche
    WORK_WINDOW_ENDING(9, true),        // PopUp: Arbeitsfenster endet bald
    MAX_HOURS_APPROACHING(10, true);    // PopUp: Tageshöchstarbeitszeit bald erreicht

    private final int code;
    private final boolean popup;

    NotificationCode(int code, boolean popup) {
        this.code = code;
        this.popup = popup;
    }

    public int getCode() {
        return code;
    }

    public boolean isPopup() {
        return popup;
    }

    public static NotificationCode fromCode(int code) {
        return Arrays.stream(values())
                .filter(c -> c.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unbekannter Benachrichtigungscode: " + code));
    }
}
