package com.khaounen.botguard.security.guard;

/**
 * Notified once per evaluated request, after the audit entry is written.
 */
@FunctionalInterface
public interface DecisionListener {
    void onDecision(Decision decision, GuardContext context);
}
