package com.khaounen.botguard.security.guard;

public enum DecisionReason {
    ACTION_ALLOW,
    ACTION_BLOCK,
    ACTION_FIGHT,
    INVALID_USER_AGENT,
    CRAWLER,
    UNKNOWN_IP,
    RATE_LIMITED,
    MALICIOUS_IP,
    TOR_EXIT,
    CLEAN,
    ERROR;

    public boolean suspicious() {
        return this == INVALID_USER_AGENT
                || this == CRAWLER
                || this == UNKNOWN_IP
                || this == RATE_LIMITED
                || this == MALICIOUS_IP
                || this == TOR_EXIT;
    }
}
