package com.khaounen.botguard.security.reputation;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Map;

/**
 * getipintel.net lookup. The service answers with a proxy/VPN probability between
 * 0 and 1; negative answers are error codes.
 */
@Slf4j
public class IpIntelReputationProvider implements ReputationProvider {

    public static final String NAME = "ipintel";

    /**
     * Probability above which an address counts as malicious.
     */
    public static final double DEFAULT_SCORE_THRESHOLD = 0.90;

    private static final String CONTACT_ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final HttpClient client;
    private final String baseUrl;
    private final String contact;
    private final double scoreThreshold;
    private final Duration timeout;

    public IpIntelReputationProvider(HttpClient client, String baseUrl, String contact, double scoreThreshold, Duration timeout) {
        if (scoreThreshold < 0 || scoreThreshold > 1) {
            throw new IllegalArgumentException("ipintel score threshold must be between 0 and 1");
        }
        this.client = client;
        this.baseUrl = baseUrl;
        this.contact = contact == null || contact.isBlank() ? randomContact() : contact;
        this.scoreThreshold = scoreThreshold;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ReputationKind kind() {
        return ReputationKind.MALICIOUS;
    }

    @Override
    public ProviderResult check(String ip) {
        try {
            String url = baseUrl
                    + "?ip=" + URLEncoder.encode(ip, StandardCharsets.UTF_8)
                    + "&contact=" + URLEncoder.encode(contact, StandardCharsets.UTF_8);
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<String> response = LookupDeadline.after(timeout)
                    .send(client, request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("bot-guard ipintel returned status {} for {}", response.statusCode(), ip);
                return ProviderResult.unknown();
            }
            return classify(response.body(), scoreThreshold);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ProviderResult.unknown();
        } catch (IOException | RuntimeException ex) {
            log.warn("bot-guard ipintel lookup failed for {}: {}", ip, ex.getMessage());
            return ProviderResult.unknown();
        }
    }

    static ProviderResult classify(String body, double scoreThreshold) {
        if (body == null) {
            return ProviderResult.unknown();
        }
        double score;
        try {
            score = Double.parseDouble(body.trim());
        } catch (NumberFormatException ex) {
            return ProviderResult.unknown();
        }
        if (score < 0 || score > 1 || Double.isNaN(score)) {
            return ProviderResult.unknown();
        }
        Verdict verdict = score > scoreThreshold ? Verdict.FLAGGED : Verdict.CLEAN;
        return new ProviderResult(verdict, Map.of("score", score));
    }

    private static String randomContact() {
        SecureRandom random = new SecureRandom();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            sb.append(CONTACT_ALPHABET.charAt(random.nextInt(CONTACT_ALPHABET.length())));
        }
        return sb.append("@gmail.com").toString();
    }
}
