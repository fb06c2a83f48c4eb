package com.khaounen.botguard.security.guard;

@FunctionalInterface
public interface FingerprintStrategy {
    String generate(String ip, String userAgent);
}
