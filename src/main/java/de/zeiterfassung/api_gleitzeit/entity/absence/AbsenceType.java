package de.zeiterfassung.api_gleitzeit.entity.absence;

public enum AbsenceType {
    VACATION,   // Urlaub
    SICK,       // Krankheit
    TRAINING,   // Fortbildung
    OTHER;      // Sonstiges

    /** Über die API dürfen nur Urlaub und Krankheit eingetragen werden. */
    public boolean isSelfService() {
        return this == VACATION || this == SICK;
    }
}
