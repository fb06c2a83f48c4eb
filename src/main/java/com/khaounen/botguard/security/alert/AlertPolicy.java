package com.khaounen.botguard.security.alert;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.khaounen.botguard.security.guard.Decision;
import com.khaounen.botguard.security.guard.DecisionReason;
import com.khaounen.botguard.security.guard.GuardAction;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Picks the decisions worth an alert and holds back repeats from the same client.
 */
public class AlertPolicy {

    private static final String NO_BEAM = "-";

    private final Set<GuardAction> actions;
    private final Set<DecisionReason> reasons;
    private final Cache<String, Boolean> recentlyAlerted;

    public AlertPolicy(Set<GuardAction> actions, Set<DecisionReason> reasons, Duration throttle, long maxClients, Ticker ticker) {
        this.actions = actions == null || actions.isEmpty() ? EnumSet.noneOf(GuardAction.class) : EnumSet.copyOf(actions);
        this.reasons = reasons == null || reasons.isEmpty() ? EnumSet.noneOf(DecisionReason.class) : EnumSet.copyOf(reasons);
        this.recentlyAlerted = throttle == null || throttle.isZero() || throttle.isNegative()
                ? null
                : Caffeine.newBuilder()
                        .expireAfterWrite(throttle)
                        .maximumSize(maxClients)
                        .ticker(ticker)
                        .executor(Runnable::run)
                        .build();
    }

    public boolean admit(Decision decision) {
        if (!actions.contains(decision.action())) {
            return false;
        }
        if (!reasons.isEmpty() && !reasons.contains(decision.reason())) {
            return false;
        }
        if (recentlyAlerted == null) {
            return true;
        }
        String beam = decision.beamId() == null ? NO_BEAM : decision.beamId();
        return recentlyAlerted.asMap().putIfAbsent(beam, Boolean.TRUE) == null;
    }
}
