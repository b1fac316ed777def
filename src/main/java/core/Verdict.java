package core;

public enum Verdict {
    SKIPPED_UNRATED,
    SKIPPED_FAKE_VOLUME,
    SKIPPED_BLACKLISTED,
    FILTERED,
    NORMAL,
    RUG,
    PUMP,
    DIP;

    /** Snapshot got through every gate and the admission filter. */
    public boolean admitted() {
        return ordinal() >= NORMAL.ordinal();
    }
}
