package com.khaounen.botguard.config;

import com.khaounen.botguard.security.alert.AlertChannel;
import com.khaounen.botguard.security.alert.GuardAlertDispatcher;
import com.khaounen.botguard.security.audit.AuditLog;
import com.khaounen.botguard.security.audit.FileAuditLog;
import com.khaounen.botguard.security.audit.InMemoryAuditLog;
import com.khaounen.botguard.security.filters.BotGuardFilter;
import com.khaounen.botguard.security.guard.DecisionEngine;
import com.khaounen.botguard.security.reputation.ReputationAggregator;
import com.khaounen.botguard.security.reputation.ReputationProvider;
import com.khaounen.botguard.security.settings.SettingsResolver;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class BotGuardAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BotGuardAutoConfiguration.class));

    @Test
    void registersTheWholePipeline() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(DecisionEngine.class);
            assertThat(context).hasSingleBean(BotGuardFilter.class);
            assertThat(context).hasSingleBean(ReputationAggregator.class);
            assertThat(context).getBean(AuditLog.class).isInstanceOf(InMemoryAuditLog.class);
            assertThat(context.getBeansOfType(ReputationProvider.class)).hasSize(5);
        });
    }

    @Test
    void rulesAreCompiledFromProperties() {
        runner.withPropertyValues(
                "bot-guard.rules[0].when=path startswith /admin",
                "bot-guard.rules[0].set.action=fight",
                "bot-guard.rules[1].when=is_ip_tor == true",
                "bot-guard.rules[1].set.hardness=3"
        ).run(context -> assertThat(context.getBean(SettingsResolver.class).referencedFields())
                .containsExactly("path", "is_ip_tor"));
    }

    @Test
    void unknownOverrideKeyFailsStartup() {
        runner.withPropertyValues(
                "bot-guard.rules[0].when=path == /",
                "bot-guard.rules[0].set.colour=blue"
        ).run(context -> assertThat(context).hasFailed());
    }

    @Test
    void auditFileSelectsFileLog() {
        runner.withPropertyValues("bot-guard.audit.file=target/bot-guard-audit.json")
                .run(context -> assertThat(context)
                        .getBean(AuditLog.class)
                        .isInstanceOf(FileAuditLog.class));
    }

    @Test
    void alertsHaveNoChannelsByDefault() {
        runner.run(context -> assertThat(context.getBean(GuardAlertDispatcher.class).channels()).isEmpty());
    }

    @Test
    void enabledWebhookBecomesAChannel() {
        runner.withPropertyValues(
                "bot-guard.alert.webhook.enabled=true",
                "bot-guard.alert.webhook.url=https://hooks.example.com/bot-guard",
                "bot-guard.alert.reasons=tor_exit,malicious_ip"
        ).run(context -> assertThat(context.getBean(GuardAlertDispatcher.class).channels())
                .extracting(AlertChannel::name)
                .containsExactly("webhook"));
    }

    @Test
    void mailAlertsWithoutSenderFailStartup() {
        runner.withPropertyValues(
                "bot-guard.alert.mail.enabled=true",
                "bot-guard.alert.mail.from=guard@example.com",
                "bot-guard.alert.mail.to=ops@example.com"
        ).run(context -> assertThat(context).hasFailed());
    }
}
