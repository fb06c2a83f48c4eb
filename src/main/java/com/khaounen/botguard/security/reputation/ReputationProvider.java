package com.khaounen.botguard.security.reputation;

/**
 * A source classifying an address for one {@link ReputationKind}. Providers are
 * selected by {@link #name()} from the {@code third-parties} setting.
 * <p>
 * {@link #check(String)} must not throw for network or parse failures; it
 * reports them as {@link Verdict#UNKNOWN}.
 */
public interface ReputationProvider {

    String name();

    ReputationKind kind();

    default boolean supports(String ip) {
        return true;
    }

    /**
     * Consulted only after every other selected provider failed to flag the address.
     */
    default boolean lastResort() {
        return false;
    }

    ProviderResult check(String ip);
}
