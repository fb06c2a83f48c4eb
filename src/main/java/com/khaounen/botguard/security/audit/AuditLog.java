package com.khaounen.botguard.security.audit;

import java.util.List;

/**
 * Append-only log of decisions, grouped by Beam ID.
 */
public interface AuditLog {

    /**
     * Appends {@code entry} to the list of {@code fingerprint} unless an identical entry is already there.
     *
     * @return whether the entry was appended
     */
    boolean append(String fingerprint, AuditLogEntry entry);

    List<AuditLogEntry> entries(String fingerprint);
}
