package com.khaounen.botguard.security.reputation;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Tor exit lookup through the ExoneraTor web service, for any address family.
 * The page is read in small chunks and the read stops as soon as the positive
 * marker shows up, so a hit does not wait for the full page.
 */
@Slf4j
public class ExoneratorReputationProvider implements ReputationProvider {

    public static final String NAME = "exonerator";

    static final String POSITIVE_MARKER = "Result is positive";
    static final int CHUNK_SIZE = 128;

    private final HttpClient client;
    private final String baseUrl;
    private final Duration timeout;
    private final Clock clock;

    public ExoneratorReputationProvider(HttpClient client, String baseUrl, Duration timeout) {
        this(client, baseUrl, timeout, Clock.systemUTC());
    }

    public ExoneratorReputationProvider(HttpClient client, String baseUrl, Duration timeout, Clock clock) {
        this.client = client;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ReputationKind kind() {
        return ReputationKind.TOR;
    }

    @Override
    public ProviderResult check(String ip) {
        LookupDeadline deadline = LookupDeadline.after(timeout);
        // the service publishes relay lists with a delay of a day or two
        LocalDate day = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(2);
        String url = baseUrl
                + "?ip=" + URLEncoder.encode(ip, StandardCharsets.UTF_8)
                + "&timestamp=" + day
                + "&lang=en";
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Range", "bytes=0-")
                .GET()
                .build();
        try {
            HttpResponse<InputStream> response = deadline.send(client, request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() != 200 && response.statusCode() != 206) {
                    log.debug("bot-guard exonerator returned status {} for {}", response.statusCode(), ip);
                    return ProviderResult.unknown();
                }
                ScheduledFuture<?> watchdog = deadline.closeWhenPassed(body);
                try {
                    Verdict verdict = scan(body, deadline.nanos());
                    return verdict == Verdict.FLAGGED
                            ? new ProviderResult(verdict, Map.of("marker", POSITIVE_MARKER))
                            : ProviderResult.of(verdict);
                } finally {
                    watchdog.cancel(false);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ProviderResult.unknown();
        } catch (IOException | RuntimeException ex) {
            if (deadline.passed()) {
                log.debug("bot-guard exonerator lookup for {} ran out of time", ip);
            } else {
                log.warn("bot-guard exonerator lookup failed for {}: {}", ip, ex.getMessage());
            }
            return ProviderResult.unknown();
        }
    }

    /**
     * Reads the page chunk by chunk until the marker appears, the page ends or the deadline passes.
     */
    static Verdict scan(InputStream body, long deadlineNanos) throws IOException {
        Reader reader = new InputStreamReader(body, StandardCharsets.UTF_8);
        StringBuilder page = new StringBuilder();
        char[] chunk = new char[CHUNK_SIZE];
        int read;
        while ((read = reader.read(chunk)) != -1) {
            int searchFrom = Math.max(0, page.length() - POSITIVE_MARKER.length());
            page.append(chunk, 0, read);
            if (page.indexOf(POSITIVE_MARKER, searchFrom) >= 0) {
                return Verdict.FLAGGED;
            }
            if (System.nanoTime() > deadlineNanos) {
                return Verdict.UNKNOWN;
            }
        }
        return Verdict.CLEAN;
    }
}
