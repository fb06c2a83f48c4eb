package com.khaounen.botguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "bot-guard")
public class BotGuardProperties {

    private boolean enabled = false;
    private Defaults defaults = new Defaults();
    private List<RuleDefinition> rules = new ArrayList<>();
    private Reputation reputation = new Reputation();
    private Audit audit = new Audit();

    /**
     * Baseline value for every recognized setting. Rules overlay these per request.
     */
    @Data
    public static class Defaults {
        private String action = "auto";
        private String captchaType = "oneclick";
        private Integer hardness = 1;
        private Duration verificationAge = Duration.ofHours(1);
        private Boolean storeAnonymously = true;
        private String dataset = "keys";
        private Integer datasetMinSize = 20;
        private Integer datasetMaxSize = 100;
        private Boolean enableRateLimit = false;
        private Integer rateLimitRequests = 15;
        private Duration rateLimitWindow = Duration.ofSeconds(300);
        private Boolean enableCrawlerBlock = false;
        private Boolean crawlerHints = true;
        private String theme = "light";
        private String language = "en";
        private Boolean debug = false;
        private List<String> thirdParties = new ArrayList<>(
                List.of("ipapi", "ipintel", "hostnameresolve", "exonerator", "geoip")
        );
    }

    @Data
    public static class RuleDefinition {
        private String when;
        private Map<String, String> set = new LinkedHashMap<>();
    }

    @Data
    public static class Reputation {
        private Duration cacheTtl = Duration.ofHours(8);
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(2);
        private Duration exoneratorTimeout = Duration.ofSeconds(3);
        private String ipapiUrl = "http://ip-api.com/json/";
        private String ipintelUrl = "https://check.getipintel.net/check.php";
        private String ipintelContact;
        private double ipintelScoreThreshold = 0.90;
        private String exoneratorUrl = "https://metrics.torproject.org/exonerator.html";
        private String torDnsblDomain = "dnsel.torproject.org";
        private String torDnsblSentinel = "127.0.0.2";
    }

    @Data
    public static class Audit {
        private boolean enabled = true;
        private String file;
        private Duration memoryRetention = Duration.ofHours(1);
        private long memoryMaxClients = 10_000;
        private int maxEntriesPerClient = 100;
    }
}
