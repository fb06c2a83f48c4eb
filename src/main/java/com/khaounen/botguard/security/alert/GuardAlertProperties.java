package com.khaounen.botguard.security.alert;

import com.khaounen.botguard.security.guard.DecisionReason;
import com.khaounen.botguard.security.guard.GuardAction;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "bot-guard.alert")
public class GuardAlertProperties {

    private Set<GuardAction> actions = EnumSet.of(GuardAction.BLOCK);
    /** Empty means every reason. */
    private Set<DecisionReason> reasons = new LinkedHashSet<>();
    /** Quiet period per Beam ID after an alert; zero alerts on every decision. */
    private Duration throttle = Duration.ofMinutes(10);
    private long throttleMaxClients = 10_000;
    private boolean anonymizeIp = true;
    private Webhook webhook = new Webhook();
    private Mail mail = new Mail();

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url;
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Mail {
        private boolean enabled = false;
        private String from;
        private List<String> to = new ArrayList<>();
        private String subjectPrefix = "[bot-guard]";
    }
}
