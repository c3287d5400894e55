package de.zeiterfassung.api_gleitzeit.dto.timeStamp;

/**
 * Hinweis, der vor einer Stempelbuchung angezeigt und vom Client bestätigt wird.
 */
public record StampAdvisory(Kind kind, String message) {

    public enum Kind {
        WORK_WINDOW,
        REST_PERIOD,
        SIXTH_WORKDAY,
        SUNDAY_OR_HOLIDAY,
        ABSENCE_TODAY
    }
}
