package com.khaounen.botguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.khaounen.botguard.security.alert.AlertChannel;
import com.khaounen.botguard.security.alert.AlertPolicy;
import com.khaounen.botguard.security.alert.GuardAlertDispatcher;
import com.khaounen.botguard.security.alert.GuardAlertProperties;
import com.khaounen.botguard.security.alert.MailAlertChannel;
import com.khaounen.botguard.security.alert.WebhookAlertChannel;
import com.khaounen.botguard.security.audit.AuditLog;
import com.khaounen.botguard.security.audit.FileAuditLog;
import com.khaounen.botguard.security.audit.InMemoryAuditLog;
import com.khaounen.botguard.security.fields.FieldResolver;
import com.khaounen.botguard.security.fields.GeoIpProvider;
import com.khaounen.botguard.security.filters.BotGuardFilter;
import com.khaounen.botguard.security.guard.DecisionEngine;
import com.khaounen.botguard.security.guard.DecisionListener;
import com.khaounen.botguard.security.guard.DecisionRenderer;
import com.khaounen.botguard.security.guard.DefaultDecisionRenderer;
import com.khaounen.botguard.security.guard.FingerprintStrategy;
import com.khaounen.botguard.security.guard.RateLimiter;
import com.khaounen.botguard.security.guard.UserAgentInspector;
import com.khaounen.botguard.security.reputation.ExoneratorReputationProvider;
import com.khaounen.botguard.security.reputation.GeoIpReputationProvider;
import com.khaounen.botguard.security.reputation.IpApiReputationProvider;
import com.khaounen.botguard.security.reputation.IpIntelReputationProvider;
import com.khaounen.botguard.security.reputation.ReputationAggregator;
import com.khaounen.botguard.security.reputation.ReputationCache;
import com.khaounen.botguard.security.reputation.ReputationProvider;
import com.khaounen.botguard.security.reputation.TorDnsblReputationProvider;
import com.khaounen.botguard.security.rules.GuardRule;
import com.khaounen.botguard.security.settings.GuardSettings;
import com.khaounen.botguard.security.settings.SettingsResolver;
import com.khaounen.botguard.utils.DefaultFingerPrint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties({BotGuardProperties.class, GuardAlertProperties.class})
public class BotGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FingerprintStrategy fingerprintStrategy() {
        return new DefaultFingerPrint();
    }

    @Bean
    @ConditionalOnMissingBean
    public SettingsResolver botGuardSettingsResolver(BotGuardProperties properties) {
        GuardSettings defaults = GuardSettings.from(properties.getDefaults());
        List<GuardRule> rules = new ArrayList<>();
        for (BotGuardProperties.RuleDefinition definition : properties.getRules()) {
            rules.add(GuardRule.compile(definition.getWhen(), definition.getSet()));
        }
        return new SettingsResolver(defaults, rules);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReputationCache botGuardReputationCache(BotGuardProperties properties) {
        return new ReputationCache(properties.getReputation().getCacheTtl(), Ticker.systemTicker());
    }

    @Bean(name = "botGuardHttpClient")
    @ConditionalOnMissingBean(name = "botGuardHttpClient")
    public HttpClient botGuardHttpClient(BotGuardProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getReputation().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public IpApiReputationProvider ipApiReputationProvider(
            BotGuardProperties properties,
            @Qualifier("botGuardHttpClient") HttpClient httpClient,
            ObjectProvider<ObjectMapper> objectMapperProvider
    ) {
        BotGuardProperties.Reputation reputation = properties.getReputation();
        return new IpApiReputationProvider(
                httpClient,
                objectMapperProvider.getIfAvailable(ObjectMapper::new),
                reputation.getIpapiUrl(),
                reputation.getReadTimeout()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public IpIntelReputationProvider ipIntelReputationProvider(
            BotGuardProperties properties,
            @Qualifier("botGuardHttpClient") HttpClient httpClient
    ) {
        BotGuardProperties.Reputation reputation = properties.getReputation();
        return new IpIntelReputationProvider(
                httpClient,
                reputation.getIpintelUrl(),
                reputation.getIpintelContact(),
                reputation.getIpintelScoreThreshold(),
                reputation.getReadTimeout()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public TorDnsblReputationProvider torDnsblReputationProvider(BotGuardProperties properties) {
        BotGuardProperties.Reputation reputation = properties.getReputation();
        return new TorDnsblReputationProvider(
                reputation.getTorDnsblDomain(),
                reputation.getTorDnsblSentinel(),
                reputation.getReadTimeout()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ExoneratorReputationProvider exoneratorReputationProvider(
            BotGuardProperties properties,
            @Qualifier("botGuardHttpClient") HttpClient httpClient
    ) {
        BotGuardProperties.Reputation reputation = properties.getReputation();
        return new ExoneratorReputationProvider(
                httpClient,
                reputation.getExoneratorUrl(),
                reputation.getExoneratorTimeout()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public GeoIpReputationProvider geoIpReputationProvider(ObjectProvider<GeoIpProvider> geoIpProviders) {
        return new GeoIpReputationProvider(geoIpProviders.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ReputationAggregator reputationAggregator(
            ObjectProvider<ReputationProvider> providers,
            ReputationCache cache
    ) {
        return new ReputationAggregator(providers.orderedStream().collect(Collectors.toList()), cache);
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldResolver botGuardFieldResolver(
            ObjectProvider<GeoIpProvider> geoIpProviders,
            ReputationAggregator reputationAggregator
    ) {
        return new FieldResolver(geoIpProviders.orderedStream().collect(Collectors.toList()), reputationAggregator);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditLog botGuardAuditLog(BotGuardProperties properties, ObjectProvider<ObjectMapper> objectMapperProvider) {
        BotGuardProperties.Audit audit = properties.getAudit();
        String file = audit.getFile();
        if (file == null || file.isBlank()) {
            return new InMemoryAuditLog(
                    audit.getMemoryRetention(),
                    audit.getMemoryMaxClients(),
                    audit.getMaxEntriesPerClient(),
                    Ticker.systemTicker()
            );
        }
        log.info("bot-guard audit log writing to {}", file);
        return new FileAuditLog(Paths.get(file), objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public UserAgentInspector userAgentInspector() {
        return new UserAgentInspector();
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter botGuardRateLimiter(ObjectProvider<RedisTemplate<String, Long>> redisTemplateProvider) {
        return new RateLimiter(redisTemplateProvider, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardAlertDispatcher guardAlertDispatcher(
            GuardAlertProperties properties,
            @Qualifier("botGuardHttpClient") HttpClient httpClient,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        List<AlertChannel> channels = new ArrayList<>();
        GuardAlertProperties.Webhook webhook = properties.getWebhook();
        if (webhook.isEnabled()) {
            if (webhook.getUrl() == null || webhook.getUrl().isBlank()) {
                throw new BotGuardConfigurationException("bot-guard.alert.webhook.url is required when the webhook is enabled");
            }
            URI url;
            try {
                url = URI.create(webhook.getUrl().trim());
            } catch (IllegalArgumentException ex) {
                throw new BotGuardConfigurationException("bot-guard.alert.webhook.url is not a valid URI", ex);
            }
            channels.add(new WebhookAlertChannel(
                    httpClient,
                    objectMapperProvider.getIfAvailable(ObjectMapper::new),
                    url,
                    webhook.getTimeout()
            ));
        }
        GuardAlertProperties.Mail mail = properties.getMail();
        if (mail.isEnabled()) {
            JavaMailSender sender = mailSenderProvider.getIfAvailable();
            if (sender == null || mail.getFrom() == null || mail.getFrom().isBlank() || mail.getTo().isEmpty()) {
                throw new BotGuardConfigurationException(
                        "bot-guard.alert.mail needs a JavaMailSender bean, a from address and at least one recipient");
            }
            channels.add(new MailAlertChannel(sender, mail.getFrom(), mail.getTo(), mail.getSubjectPrefix()));
        }
        if (!channels.isEmpty()) {
            log.info("bot-guard alerts enabled on {} for actions {}", channels.stream().map(AlertChannel::name).toList(),
                    properties.getActions());
        }
        AlertPolicy policy = new AlertPolicy(
                properties.getActions(),
                properties.getReasons(),
                properties.getThrottle(),
                properties.getThrottleMaxClients(),
                Ticker.systemTicker()
        );
        return new GuardAlertDispatcher(policy, channels, Clock.systemUTC(), properties.isAnonymizeIp());
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionEngine decisionEngine(
            BotGuardProperties properties,
            SettingsResolver settingsResolver,
            FieldResolver fieldResolver,
            ReputationAggregator reputationAggregator,
            UserAgentInspector userAgentInspector,
            RateLimiter rateLimiter,
            FingerprintStrategy fingerprintStrategy,
            AuditLog auditLog,
            ObjectProvider<DecisionListener> listeners
    ) {
        return new DecisionEngine(
                settingsResolver,
                fieldResolver,
                reputationAggregator,
                userAgentInspector,
                rateLimiter,
                fingerprintStrategy,
                properties.getAudit().isEnabled() ? auditLog : null,
                listeners.orderedStream().collect(Collectors.toList()),
                Clock.systemUTC()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionRenderer decisionRenderer() {
        return new DefaultDecisionRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public BotGuardFilter botGuardFilter(
            BotGuardProperties properties,
            DecisionEngine engine,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            DecisionRenderer renderer
    ) {
        return new BotGuardFilter(properties, engine, objectMapperProvider.getIfAvailable(ObjectMapper::new), renderer);
    }
}
