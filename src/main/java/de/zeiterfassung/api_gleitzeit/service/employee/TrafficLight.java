package de.zeiterfassung.api_gleitzeit.service.employee;

/** Ampel zum Gleitzeitkonto. */
public enum TrafficLight {
    GREEN,
    YELLOW,
    RED;

    public static TrafficLight evaluate(double balance, double green, double red) {
        if (balance >= green) {
            return GREEN;
        }
        if (balance > red) {
            return YELLOW;
        }
        return RED;
    }
}
