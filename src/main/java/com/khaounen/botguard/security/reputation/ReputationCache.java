package com.khaounen.botguard.security.reputation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;

/**
 * Process-wide store of definite verdicts keyed by {@code (provider, input)}.
 * Entries expire a fixed time after they were written and an expired entry is
 * never returned. {@link Verdict#UNKNOWN} is never stored, so a failed lookup
 * is retried by the next request.
 */
public class ReputationCache {

    public static final Duration DEFAULT_TTL = Duration.ofHours(8);

    private final Cache<Key, Verdict> verdicts;
    private final Duration ttl;

    public ReputationCache() {
        this(DEFAULT_TTL, Ticker.systemTicker());
    }

    public ReputationCache(Duration ttl, Ticker ticker) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive");
        }
        this.ttl = ttl;
        this.verdicts = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Verdict get(String provider, String input) {
        return verdicts.getIfPresent(new Key(provider, input));
    }

    public void put(String provider, String input, Verdict verdict) {
        if (verdict == null || !verdict.isDefinite()) {
            return;
        }
        verdicts.put(new Key(provider, input), verdict);
    }

    public void invalidateAll() {
        verdicts.invalidateAll();
    }

    public Duration ttl() {
        return ttl;
    }

    long size() {
        verdicts.cleanUp();
        return verdicts.estimatedSize();
    }

    private record Key(String provider, String input) {
    }
}
