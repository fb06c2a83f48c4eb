package com.khaounen.botguard.security.alert;

import com.khaounen.botguard.security.guard.Decision;
import com.khaounen.botguard.security.guard.DecisionListener;
import com.khaounen.botguard.security.guard.GuardContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Turns admitted decisions into alerts and hands them to every channel. A failing
 * channel does not stop the others.
 */
@Slf4j
public class GuardAlertDispatcher implements DecisionListener {

    private final AlertPolicy policy;
    private final List<AlertChannel> channels;
    private final Clock clock;
    private final boolean anonymizeIp;

    public GuardAlertDispatcher(AlertPolicy policy, List<AlertChannel> channels, Clock clock, boolean anonymizeIp) {
        this.policy = policy;
        this.channels = List.copyOf(channels);
        this.clock = clock;
        this.anonymizeIp = anonymizeIp;
    }

    @Override
    public void onDecision(Decision decision, GuardContext context) {
        if (channels.isEmpty() || !policy.admit(decision)) {
            return;
        }
        GuardAlert alert = GuardAlert.of(decision, context, clock.instant(), anonymizeIp);
        for (AlertChannel channel : channels) {
            try {
                channel.publish(alert);
            } catch (RuntimeException ex) {
                log.warn("bot-guard {} alert failed: {}", channel.name(), ex.getMessage());
            }
        }
    }

    public List<AlertChannel> channels() {
        return channels;
    }
}
