package com.khaounen.botguard.security.alert;

import com.khaounen.botguard.config.BotGuardProperties;
import com.khaounen.botguard.security.fields.FieldResolver;
import com.khaounen.botguard.security.guard.Decision;
import com.khaounen.botguard.security.guard.DecisionReason;
import com.khaounen.botguard.security.guard.GuardAction;
import com.khaounen.botguard.security.guard.GuardContext;
import com.khaounen.botguard.security.reputation.ReputationAggregator;
import com.khaounen.botguard.security.reputation.ReputationCache;
import com.khaounen.botguard.security.settings.GuardSettings;
import com.khaounen.botguard.security.settings.SettingsResolver;
import com.khaounen.botguard.testutil.StubGuardRequest;
import com.khaounen.botguard.utils.DefaultFingerPrint;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GuardAlertDispatcherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private final AtomicLong nanos = new AtomicLong();
    private final List<GuardAlert> published = new ArrayList<>();
    private final AlertChannel recording = new AlertChannel() {
        @Override
        public String name() {
            return "recording";
        }

        @Override
        public void publish(GuardAlert alert) {
            published.add(alert);
        }
    };

    @Test
    void blockedRequestIsDescribed() {
        GuardAlertDispatcher dispatcher = dispatcher(policy(EnumSet.of(GuardAction.BLOCK), Set.of(), Duration.ZERO), true);

        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.TOR_EXIT, "beam"), context());

        assertEquals(1, published.size());
        GuardAlert alert = published.get(0);
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), alert.timestamp());
        assertEquals(DecisionReason.TOR_EXIT, alert.reason());
        assertEquals("8.8.8.0", alert.clientIp());
        assertEquals("/", alert.path());
    }

    @Test
    void rawAddressIsKeptWhenAnonymizingIsOff() {
        GuardAlertDispatcher dispatcher = dispatcher(policy(EnumSet.of(GuardAction.BLOCK), Set.of(), Duration.ZERO), false);

        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.MALICIOUS_IP, "beam"), context());

        assertEquals("8.8.8.8", published.get(0).clientIp());
    }

    @Test
    void onlyConfiguredActionsAndReasonsAlert() {
        AlertPolicy policy = policy(
                EnumSet.of(GuardAction.BLOCK, GuardAction.CHALLENGE),
                EnumSet.of(DecisionReason.MALICIOUS_IP, DecisionReason.TOR_EXIT),
                Duration.ZERO);
        GuardAlertDispatcher dispatcher = dispatcher(policy, true);

        dispatcher.onDecision(decision(GuardAction.ALLOW, DecisionReason.CLEAN, "a"), context());
        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.CRAWLER, "b"), context());
        dispatcher.onDecision(decision(GuardAction.CHALLENGE, DecisionReason.TOR_EXIT, "c"), context());
        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.MALICIOUS_IP, "d"), context());

        assertEquals(List.of("c", "d"), published.stream().map(GuardAlert::beamId).toList());
    }

    @Test
    void repeatedAlertsForOneClientAreThrottled() {
        GuardAlertDispatcher dispatcher = dispatcher(
                policy(EnumSet.of(GuardAction.BLOCK), Set.of(), Duration.ofMinutes(10)), true);

        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.TOR_EXIT, "beam"), context());
        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.TOR_EXIT, "beam"), context());
        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.TOR_EXIT, "other"), context());
        assertEquals(2, published.size());

        nanos.addAndGet(Duration.ofMinutes(11).toNanos());
        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.TOR_EXIT, "beam"), context());
        assertEquals(3, published.size());
    }

    @Test
    void failingChannelDoesNotStopTheOthers() {
        AlertChannel broken = new AlertChannel() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public void publish(GuardAlert alert) {
                throw new IllegalStateException("mail server down");
            }
        };
        GuardAlertDispatcher dispatcher = new GuardAlertDispatcher(
                policy(EnumSet.of(GuardAction.BLOCK), Set.of(), Duration.ZERO), List.of(broken, recording), CLOCK, true);

        dispatcher.onDecision(decision(GuardAction.BLOCK, DecisionReason.ACTION_BLOCK, "beam"), context());

        assertEquals(1, published.size());
    }

    @Test
    void webhookPayloadGroupsClientAndRequest() {
        GuardAlert alert = new GuardAlert(Instant.parse("2024-05-01T10:00:00Z"), GuardAction.BLOCK,
                DecisionReason.TOR_EXIT, "beam", "8.8.8.0", "ua", "www.example.com", "GET", "/login");

        Map<String, Object> payload = WebhookAlertChannel.payload(alert);

        assertEquals("block", payload.get("action"));
        assertEquals("tor_exit", payload.get("reason"));
        assertEquals(Map.of("ip", "8.8.8.0", "user_agent", "ua"), payload.get("client"));
        assertEquals(Map.of("method", "GET", "host", "www.example.com", "path", "/login"), payload.get("request"));
    }

    @Test
    void mailSubjectNamesTheOutcome() {
        GuardAlert alert = new GuardAlert(Instant.parse("2024-05-01T10:00:00Z"), GuardAction.BLOCK,
                DecisionReason.MALICIOUS_IP, "beam", null, "ua", "www.example.com", "GET", "/");
        MailAlertChannel channel = new MailAlertChannel(null, "guard@example.com", List.of("ops@example.com"), "[bot-guard]");

        String subject = channel.message(alert).getSubject();

        assertEquals("[bot-guard] block malicious_ip from unknown client", subject);
        assertTrue(channel.message(alert).getText().contains("request: GET www.example.com/"));
    }

    private AlertPolicy policy(Set<GuardAction> actions, Set<DecisionReason> reasons, Duration throttle) {
        return new AlertPolicy(actions, reasons, throttle, 1000, nanos::get);
    }

    private GuardAlertDispatcher dispatcher(AlertPolicy policy, boolean anonymizeIp) {
        return new GuardAlertDispatcher(policy, List.of(recording), CLOCK, anonymizeIp);
    }

    private static Decision decision(GuardAction action, DecisionReason reason, String beam) {
        return Decision.of(action, reason, beam, Map.of());
    }

    private static GuardContext context() {
        ReputationAggregator aggregator = new ReputationAggregator(List.of(), new ReputationCache());
        return new GuardContext(
                StubGuardRequest.browser(),
                new FieldResolver(List.of(), aggregator),
                new SettingsResolver(GuardSettings.from(new BotGuardProperties.Defaults()), List.of()),
                new DefaultFingerPrint()
        );
    }
}
