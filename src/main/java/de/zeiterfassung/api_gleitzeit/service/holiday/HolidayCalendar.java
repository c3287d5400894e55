package de.zeiterfassung.api_gleitzeit.service.holiday;

import java.time.LocalDate;

public interface HolidayCalendar {

    /** Gesetzlicher oder betrieblicher Feiertag am Datum. */
    boolean isHoliday(LocalDate date);
}
