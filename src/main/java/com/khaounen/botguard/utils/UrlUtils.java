package com.khaounen.botguard.utils;

import com.khaounen.botguard.security.guard.GuardRequest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Scheme as the client saw it: {@code X-Forwarded-Proto} when it names http or https,
     * otherwise the transport of this hop.
     */
    public static String scheme(GuardRequest request) {
        String forwarded = request.header("X-Forwarded-Proto");
        if (forwarded != null) {
            String normalized = forwarded.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("http") || normalized.equals("https")) {
                return normalized;
            }
        }
        return request.secure() ? "https" : "http";
    }

    public static String url(GuardRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append(scheme(request)).append("://").append(nullToEmpty(request.host()));
        sb.append(nullToEmpty(request.path()));
        Map<String, String> args = request.queryArgs();
        if (args != null && !args.isEmpty()) {
            sb.append('?').append(args.entrySet().stream()
                    .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                    .collect(Collectors.joining("&")));
        }
        return sb.toString();
    }

    /**
     * Strips the port from a Host header value; IPv6 brackets are removed too.
     */
    public static String hostname(String host) {
        if (host == null || host.isBlank()) {
            return "";
        }
        String trimmed = host.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("[")) {
            int end = trimmed.indexOf(']');
            return end > 0 ? trimmed.substring(1, end) : trimmed;
        }
        int colon = trimmed.indexOf(':');
        if (colon >= 0 && colon == trimmed.lastIndexOf(':')) {
            return trimmed.substring(0, colon);
        }
        return trimmed;
    }

    /**
     * Registrable part of a host name, approximated as its last two labels.
     */
    public static String domain(String hostname) {
        if (hostname == null || hostname.isEmpty() || isIpLiteral(hostname)) {
            return nullToEmpty(hostname);
        }
        String[] labels = hostname.split("\\.");
        if (labels.length <= 2) {
            return hostname;
        }
        return labels[labels.length - 2] + "." + labels[labels.length - 1];
    }

    public static String subdomain(String hostname) {
        if (hostname == null || hostname.isEmpty() || isIpLiteral(hostname)) {
            return "";
        }
        String[] labels = hostname.split("\\.");
        if (labels.length <= 2) {
            return "";
        }
        return String.join(".", Arrays.copyOfRange(labels, 0, labels.length - 2));
    }

    private static boolean isIpLiteral(String hostname) {
        return IpUtils.isIpv4(hostname) || hostname.contains(":");
    }

    private static String encode(String value) {
        return URLEncoder.encode(nullToEmpty(value), StandardCharsets.UTF_8);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
