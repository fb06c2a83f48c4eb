package com.khaounen.botguard.security.audit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local audit log. Clients idle for longer than the retention are dropped, and each
 * client keeps only its latest {@code maxEntriesPerClient} entries.
 */
public class InMemoryAuditLog implements AuditLog {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);
    public static final long DEFAULT_MAX_CLIENTS = 10_000;
    public static final int DEFAULT_MAX_ENTRIES_PER_CLIENT = 100;

    private final Cache<String, Deque<AuditLogEntry>> entries;
    private final int maxEntriesPerClient;

    public InMemoryAuditLog() {
        this(DEFAULT_RETENTION, DEFAULT_MAX_CLIENTS, DEFAULT_MAX_ENTRIES_PER_CLIENT, Ticker.systemTicker());
    }

    public InMemoryAuditLog(Duration retention, long maxClients, int maxEntriesPerClient, Ticker ticker) {
        if (maxEntriesPerClient < 1) {
            throw new IllegalArgumentException("maxEntriesPerClient must be positive");
        }
        this.entries = Caffeine.newBuilder()
                .expireAfterAccess(retention)
                .maximumSize(maxClients)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        this.maxEntriesPerClient = maxEntriesPerClient;
    }

    @Override
    public boolean append(String fingerprint, AuditLogEntry entry) {
        AtomicBoolean appended = new AtomicBoolean(false);
        entries.asMap().compute(fingerprint, (key, existing) -> {
            Deque<AuditLogEntry> list = existing == null ? new ArrayDeque<>() : existing;
            synchronized (list) {
                if (!list.contains(entry)) {
                    list.addLast(entry);
                    appended.set(true);
                    while (list.size() > maxEntriesPerClient) {
                        list.removeFirst();
                    }
                }
            }
            return list;
        });
        return appended.get();
    }

    @Override
    public List<AuditLogEntry> entries(String fingerprint) {
        Deque<AuditLogEntry> list = entries.getIfPresent(fingerprint);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    long clientCount() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
