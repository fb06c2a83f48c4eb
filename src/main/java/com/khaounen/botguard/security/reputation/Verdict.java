package com.khaounen.botguard.security.reputation;

public enum Verdict {
    FLAGGED,
    CLEAN,
    UNKNOWN;

    public boolean isDefinite() {
        return this != UNKNOWN;
    }
}
