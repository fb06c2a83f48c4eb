package com.khaounen.botguard.security.reputation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ip-api.com lookup: flags proxies, hosting ranges and ISPs from {@link HostingNetworks}.
 */
@Slf4j
public class IpApiReputationProvider implements ReputationProvider {

    public static final String NAME = "ipapi";

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration timeout;

    public IpApiReputationProvider(HttpClient client, ObjectMapper objectMapper, String baseUrl, Duration timeout) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
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
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + URLEncoder.encode(ip, StandardCharsets.UTF_8) + "?fields=proxy,hosting,isp"))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<String> response = LookupDeadline.after(timeout)
                    .send(client, request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("bot-guard ipapi returned status {} for {}", response.statusCode(), ip);
                return ProviderResult.unknown();
            }
            return classify(objectMapper.readTree(response.body()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ProviderResult.unknown();
        } catch (IOException | RuntimeException ex) {
            log.warn("bot-guard ipapi lookup failed for {}: {}", ip, ex.getMessage());
            return ProviderResult.unknown();
        }
    }

    static ProviderResult classify(JsonNode data) {
        if (data == null || !data.isObject() || !data.has("proxy") || !data.has("hosting")) {
            return ProviderResult.unknown();
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("proxy", data.get("proxy").asBoolean(false));
        raw.put("hosting", data.get("hosting").asBoolean(false));
        JsonNode isp = data.get("isp");
        if (isp != null && isp.isTextual()) {
            raw.put("isp", isp.asText());
        }

        boolean flagged = (isp != null && isp.isTextual() && HostingNetworks.matches(isp.asText()))
                || data.get("proxy").asBoolean(false)
                || data.get("hosting").asBoolean(false);
        return new ProviderResult(flagged ? Verdict.FLAGGED : Verdict.CLEAN, raw);
    }
}
