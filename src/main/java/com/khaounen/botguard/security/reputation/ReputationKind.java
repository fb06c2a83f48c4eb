package com.khaounen.botguard.security.reputation;

public enum ReputationKind {
    MALICIOUS,
    TOR
}
