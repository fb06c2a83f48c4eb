package com.khaounen.botguard.security.audit;

/**
 * One evaluated request. {@code timestamp} is in epoch seconds.
 */
public record AuditLogEntry(
        long timestamp,
        String ip,
        String userAgent,
        String httpVersion,
        String action
) {
}
