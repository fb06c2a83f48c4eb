package com.khaounen.botguard.security.guard;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window request counter keyed by Beam ID. Uses Redis when a template is
 * available and falls back to local counters otherwise or when Redis fails.
 */
@Slf4j
public class RateLimiter {

    private final ObjectProvider<RedisTemplate<String, Long>> redisTemplateProvider;
    private final Clock clock;

    private final Cache<String, Counter> localCounters;

    public RateLimiter(ObjectProvider<RedisTemplate<String, Long>> redisTemplateProvider, Clock clock) {
        this.redisTemplateProvider = redisTemplateProvider;
        this.clock = clock;
        this.localCounters = Caffeine.newBuilder()
                .expireAfter(new CounterExpiry(clock))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Counts one request for {@code key}.
     *
     * @return false once more than {@code maxRequests} arrived within the current window
     */
    public boolean tryAcquire(String key, int maxRequests, Duration window) {
        int safeMax = Math.max(1, maxRequests);
        long windowMillis = Math.max(1000L, window.toMillis());

        RedisTemplate<String, Long> redis = redisTemplateProvider.getIfAvailable();
        if (redis != null) {
            try {
                return !incrementRedis(redis, key, safeMax, windowMillis);
            } catch (Exception ex) {
                log.warn("bot-guard redis rate limit failed, using local counters: {}", ex.getMessage());
            }
        }
        return !incrementLocal(key, safeMax, windowMillis);
    }

    private boolean incrementLocal(String key, int maxRequests, long windowMillis) {
        long now = clock.millis();
        Counter counter = localCounters.asMap().compute(countKey(key), (k, existing) -> {
            if (existing == null || existing.expiresAt <= now) {
                return new Counter(1, now + windowMillis);
            }
            existing.count += 1;
            return existing;
        });
        return counter.count > maxRequests;
    }

    private static boolean incrementRedis(
            RedisTemplate<String, Long> redis,
            String key,
            int maxRequests,
            long windowMillis
    ) {
        String countKey = countKey(key);
        Long count = redis.opsForValue().increment(countKey);
        if (count != null && count == 1L) {
            redis.expire(countKey, Duration.ofMillis(windowMillis));
        }
        return count != null && count > maxRequests;
    }

    private static String countKey(String key) {
        return "bot-guard:rate:" + key;
    }

    private static class Counter {
        private long count;
        private final long expiresAt;

        private Counter(long count, long expiresAt) {
            this.count = count;
            this.expiresAt = expiresAt;
        }
    }

    private static class CounterExpiry implements Expiry<String, Counter> {

        private final Clock clock;

        private CounterExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, Counter value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, Counter value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, Counter value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Counter value) {
            long remainingMillis = value.expiresAt - clock.millis();
            if (remainingMillis <= 0) {
                return 0;
            }
            return TimeUnit.MILLISECONDS.toNanos(remainingMillis);
        }
    }
}
