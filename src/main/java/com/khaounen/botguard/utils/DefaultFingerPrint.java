package com.khaounen.botguard.utils;

import com.khaounen.botguard.security.guard.FingerprintStrategy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

public class DefaultFingerPrint implements FingerprintStrategy {

    static final int BEAM_ID_LENGTH = 16;

    @Override
    public String generate(String ip, String userAgent) {
        String raw = String.join("|", ip == null ? "0" : ip, normalizeUa(userAgent));
        return sha256(raw).substring(0, BEAM_ID_LENGTH);
    }

    private static String normalizeUa(String ua) {
        if (ua == null) return "ua-null";
        return ua.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static String sha256(String raw) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(raw.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("Fingerprint error", e);
        }
    }
}
