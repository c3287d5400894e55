package de.zeiterfassung.api_gleitzeit.dto.flexTime;

/** Kumulierte Gleitzeit seit Monats-, Quartals- und Jahresbeginn. */
public record CumulativeFlexTime(double monthHours, double quarterHours, double yearHours) {
}
