package com.khaounen.botguard.security.guard;

public enum GuardAction {
    ALLOW(200),
    BLOCK(403),
    CHALLENGE(403);

    private final int httpStatus;

    GuardAction(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
