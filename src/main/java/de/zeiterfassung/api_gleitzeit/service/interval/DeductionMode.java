package de.zeiterfassung.api_gleitzeit.service.interval;

/** Welche Abzüge auf ein Stempelpaar angewendet werden. */
public enum DeductionMode {
    RAW(false, false),
    BREAKS(true, false),
    BREAKS_AND_WORK_WINDOW(true, true);

    private final boolean breaks;
    private final boolean workWindow;

    DeductionMode(boolean breaks, boolean workWindow) {
        this.breaks = breaks;
        this.workWindow = workWindow;
    }

    public boolean deductsBreaks() {
        return breaks;
    }

    public boolean clipsWorkWindow() {
        return workWindow;
    }
}
