package com.khaounen.botguard.security.guard;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Local user-agent checks that run before any network lookup.
 */
public class UserAgentInspector {

    static final int MAX_LENGTH = 1024;

    // product/version followed by optional comments, e.g. "Mozilla/5.0 (X11; Linux x86_64) ..."
    private static final Pattern STRUCTURE = Pattern.compile(
            "^[A-Za-z][A-Za-z0-9!#$%&'*+.^_`|~-]*/[A-Za-z0-9][^\\s]*(\\s.*)?$"
    );

    static final List<String> CRAWLER_SIGNATURES = List.of(
            "bot", "crawl", "spider", "slurp", "archiver", "facebookexternalhit", "mediapartners",
            "bingpreview", "yandex", "baidu", "duckduckgo", "ahrefs", "semrush", "mj12", "petalbot",
            "bytespider", "gptbot", "ccbot", "python-requests", "python-urllib", "aiohttp", "curl/",
            "wget/", "httpclient", "okhttp", "go-http-client", "libwww", "scrapy", "headlesschrome",
            "phantomjs", "selenium", "puppeteer", "playwright"
    );

    public Optional<DecisionReason> inspect(String userAgent, boolean blockCrawlers) {
        if (!isWellFormed(userAgent)) {
            return Optional.of(DecisionReason.INVALID_USER_AGENT);
        }
        if (blockCrawlers && isCrawler(userAgent)) {
            return Optional.of(DecisionReason.CRAWLER);
        }
        return Optional.empty();
    }

    public boolean isWellFormed(String userAgent) {
        if (userAgent == null || userAgent.isBlank() || userAgent.length() > MAX_LENGTH) {
            return false;
        }
        return STRUCTURE.matcher(userAgent.trim()).matches();
    }

    public boolean isCrawler(String userAgent) {
        if (userAgent == null) {
            return false;
        }
        String normalized = userAgent.toLowerCase(Locale.ROOT);
        return CRAWLER_SIGNATURES.stream().anyMatch(normalized::contains);
    }
}
