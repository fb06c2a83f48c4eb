package com.khaounen.botguard.security.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Posts each alert as JSON without waiting for the receiver.
 */
@Slf4j
public class WebhookAlertChannel implements AlertChannel {

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final URI url;
    private final Duration timeout;

    public WebhookAlertChannel(HttpClient client, ObjectMapper objectMapper, URI url, Duration timeout) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.url = url;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void publish(GuardAlert alert) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(payload(alert));
        } catch (JsonProcessingException ex) {
            log.warn("bot-guard webhook alert could not be serialized: {}", ex.getMessage());
            return;
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(url)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .whenComplete((response, failure) -> {
                    if (failure != null) {
                        log.warn("bot-guard webhook alert to {} failed: {}", url.getHost(), failure.getMessage());
                    } else if (response.statusCode() / 100 != 2) {
                        log.warn("bot-guard webhook alert to {} answered {}", url.getHost(), response.statusCode());
                    }
                });
    }

    static Map<String, Object> payload(GuardAlert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", alert.timestamp().toString());
        payload.put("action", alert.action().name().toLowerCase(Locale.ROOT));
        payload.put("reason", alert.reason().name().toLowerCase(Locale.ROOT));
        payload.put("beam_id", alert.beamId());
        Map<String, Object> client = new LinkedHashMap<>();
        client.put("ip", alert.clientIp());
        client.put("user_agent", alert.userAgent());
        payload.put("client", client);
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("method", alert.method());
        request.put("host", alert.host());
        request.put("path", alert.path());
        payload.put("request", request);
        return payload;
    }
}
