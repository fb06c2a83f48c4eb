package com.khaounen.botguard.security.guard;

import com.khaounen.botguard.security.audit.AuditLog;
import com.khaounen.botguard.security.audit.AuditLogEntry;
import com.khaounen.botguard.security.fields.FieldNames;
import com.khaounen.botguard.security.fields.FieldResolver;
import com.khaounen.botguard.security.reputation.ReputationAggregator;
import com.khaounen.botguard.security.reputation.ReputationKind;
import com.khaounen.botguard.security.reputation.ReputationListener;
import com.khaounen.botguard.security.settings.GuardSettings;
import com.khaounen.botguard.security.settings.SettingsAction;
import com.khaounen.botguard.security.settings.SettingsResolver;
import com.khaounen.botguard.utils.IpUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a request into an allow, block or challenge decision.
 * <p>
 * Checks run from the cheapest to the most expensive: the resolved action,
 * the user agent, the client address, the rate limit and finally the
 * networked reputation lookups. Every evaluation writes exactly one audit
 * entry and never throws.
 */
@Slf4j
public class DecisionEngine {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final SettingsResolver settingsResolver;
    private final FieldResolver fieldResolver;
    private final ReputationAggregator reputation;
    private final UserAgentInspector userAgentInspector;
    private final RateLimiter rateLimiter;
    private final FingerprintStrategy fingerprintStrategy;
    private final AuditLog auditLog;
    private final List<DecisionListener> listeners;
    private final Clock clock;

    public DecisionEngine(
            SettingsResolver settingsResolver,
            FieldResolver fieldResolver,
            ReputationAggregator reputation,
            UserAgentInspector userAgentInspector,
            RateLimiter rateLimiter,
            FingerprintStrategy fingerprintStrategy,
            AuditLog auditLog,
            List<DecisionListener> listeners,
            Clock clock
    ) {
        this.settingsResolver = settingsResolver;
        this.fieldResolver = fieldResolver;
        this.reputation = reputation;
        this.userAgentInspector = userAgentInspector;
        this.rateLimiter = rateLimiter;
        this.fingerprintStrategy = fingerprintStrategy;
        this.auditLog = auditLog;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.clock = clock;
    }

    public Decision evaluate(GuardRequest request) {
        GuardContext context = new GuardContext(request, fieldResolver, settingsResolver, fingerprintStrategy);
        Decision decision;
        try {
            GuardSettings settings = context.settings();
            DecisionReason reason = decide(context, settings);
            decision = Decision.of(actionFor(reason, settings), reason, context.fingerprint(), renderVariables(context, settings, reason));
        } catch (RuntimeException ex) {
            log.error("bot-guard evaluation failed, allowing request: {}", ex.getMessage(), ex);
            decision = Decision.of(GuardAction.ALLOW, DecisionReason.ERROR, safeFingerprint(context), Map.of());
        }
        record(decision, context);
        return decision;
    }

    private DecisionReason decide(GuardContext context, GuardSettings settings) {
        SettingsAction action = settings.getAction();
        if (action == SettingsAction.ALLOW) {
            return DecisionReason.ACTION_ALLOW;
        }
        if (action == SettingsAction.BLOCK) {
            return DecisionReason.ACTION_BLOCK;
        }
        if (action == SettingsAction.FIGHT) {
            return DecisionReason.ACTION_FIGHT;
        }

        Optional<DecisionReason> userAgentProblem =
                userAgentInspector.inspect(context.userAgent(), settings.isEnableCrawlerBlock());
        if (userAgentProblem.isPresent()) {
            return userAgentProblem.get();
        }

        String ip = context.clientIp();
        if (ip == null) {
            return DecisionReason.UNKNOWN_IP;
        }

        if (settings.isEnableRateLimit()
                && !rateLimiter.tryAcquire(context.fingerprint(), settings.getRateLimitRequests(), settings.getRateLimitWindow())) {
            return DecisionReason.RATE_LIMITED;
        }

        ReputationListener listener = (provider, kind, flaggedIp, raw) ->
                log.info("bot-guard provider {} flagged {} as {} {}", provider, flaggedIp, kind, raw);
        if (isFlagged(context, FieldNames.IS_IP_MALICIOUS, ip, settings, ReputationKind.MALICIOUS, listener)) {
            return DecisionReason.MALICIOUS_IP;
        }
        if (isFlagged(context, FieldNames.IS_IP_TOR, ip, settings, ReputationKind.TOR, listener)) {
            return DecisionReason.TOR_EXIT;
        }
        return DecisionReason.CLEAN;
    }

    /**
     * Reuses the field value when a rule already asked for it during settings resolution.
     */
    private boolean isFlagged(
            GuardContext context,
            String field,
            String ip,
            GuardSettings settings,
            ReputationKind kind,
            ReputationListener listener
    ) {
        Optional<Object> resolved = context.fields().peek(field);
        if (resolved.isPresent()) {
            return Boolean.TRUE.equals(resolved.get());
        }
        return reputation.classify(ip, settings.getThirdParties(), kind, listener);
    }

    static GuardAction actionFor(DecisionReason reason, GuardSettings settings) {
        switch (reason) {
            case ACTION_ALLOW:
            case CLEAN:
            case ERROR:
                return GuardAction.ALLOW;
            case ACTION_BLOCK:
                return GuardAction.BLOCK;
            case ACTION_FIGHT:
                return GuardAction.CHALLENGE;
            default:
                return settings.getAction() == SettingsAction.BLOCK_IF_SUSPICIOUS
                        ? GuardAction.BLOCK
                        : GuardAction.CHALLENGE;
        }
    }

    private Map<String, Object> renderVariables(GuardContext context, GuardSettings settings, DecisionReason reason) {
        GuardRequest request = context.request();
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("domain", nullToEmpty(context.fields().get(FieldNames.DOMAIN).orElse(null)));
        vars.put("path", nullToEmpty(request.path()));
        vars.put("beam_id", nullToEmpty(context.fingerprint()));
        vars.put("client_ip", nullToEmpty(context.clientIp()));
        vars.put("client_user_agent", nullToEmpty(context.userAgent()));
        vars.put("timestamp", TIMESTAMP_FORMAT.format(clock.instant()));
        vars.put("theme", settings.getTheme());
        vars.put("language", settings.getLanguage());
        vars.put("captcha_type", settings.getCaptchaType());
        vars.put("hardness", settings.getHardness());
        vars.put("reason", reason.name().toLowerCase(Locale.ROOT));
        return vars;
    }

    private void record(Decision decision, GuardContext context) {
        try {
            appendAudit(decision, context);
        } catch (RuntimeException ex) {
            log.warn("bot-guard audit append failed: {}", ex.getMessage());
        }

        log.info(
                "bot-guard decision action={} reason={} beam={} ip={} path={}",
                decision.action(),
                decision.reason(),
                decision.beamId(),
                context.clientIp(),
                context.request().path()
        );

        for (DecisionListener listener : listeners) {
            try {
                listener.onDecision(decision, context);
            } catch (RuntimeException ex) {
                log.warn("bot-guard decision listener {} failed: {}", listener.getClass().getSimpleName(), ex.getMessage());
            }
        }
    }

    private void appendAudit(Decision decision, GuardContext context) {
        if (auditLog == null) {
            return;
        }
        String ip = context.clientIp();
        boolean anonymous = settingsResolver.defaults().isStoreAnonymously();
        try {
            anonymous = context.settings().isStoreAnonymously();
        } catch (RuntimeException ex) {
            log.debug("bot-guard settings unavailable for audit, using defaults: {}", ex.getMessage());
        }
        if (anonymous && ip != null) {
            ip = IpUtils.anonymize(ip);
        }
        AuditLogEntry entry = new AuditLogEntry(
                clock.instant().getEpochSecond(),
                ip,
                context.userAgent(),
                context.request().protocol(),
                decision.action().name().toLowerCase(Locale.ROOT)
        );
        auditLog.append(nullToEmpty(decision.beamId()), entry);
    }

    private static String safeFingerprint(GuardContext context) {
        try {
            return context.fingerprint();
        } catch (RuntimeException ex) {
            return "";
        }
    }

    private static String nullToEmpty(Object value) {
        return value == null ? "" : value.toString();
    }
}
