package com.khaounen.botguard.security.reputation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies an address by asking the selected providers in order.
 * <p>
 * The first {@link Verdict#FLAGGED} answer wins and later providers are not
 * consulted. Providers answering {@link Verdict#UNKNOWN} are skipped over.
 * Last-resort providers (the local GeoIP classification) run after all others.
 * Every definite provider verdict and the combined outcome are cached in the
 * shared {@link ReputationCache}.
 */
@Slf4j
public class ReputationAggregator {

    private final Map<String, ReputationProvider> providers;
    private final ReputationCache cache;

    public ReputationAggregator(List<ReputationProvider> providers, ReputationCache cache) {
        this.providers = new LinkedHashMap<>();
        for (ReputationProvider provider : providers) {
            String name = normalize(provider.name());
            if (this.providers.putIfAbsent(name, provider) != null) {
                log.warn("bot-guard reputation provider {} registered twice, keeping the first", name);
            }
        }
        this.cache = cache;
    }

    public boolean classify(String ip, List<String> providerNames, ReputationKind kind) {
        return classify(ip, providerNames, kind, ReputationListener.NONE);
    }

    /**
     * @param providerNames enabled providers, in priority order
     * @return whether any provider flagged the address; unknown answers count as not flagged
     */
    public boolean classify(String ip, List<String> providerNames, ReputationKind kind, ReputationListener listener) {
        if (ip == null || ip.isBlank() || providerNames == null || providerNames.isEmpty()) {
            return false;
        }
        List<ReputationProvider> selected = select(providerNames, kind);
        String combinedKey = combinedKey(kind, selected);
        Verdict cached = cache.get(combinedKey, ip);
        if (cached != null) {
            log.debug("bot-guard {} classification of {} served from cache: {}", kind, ip, cached);
            return cached == Verdict.FLAGGED;
        }

        boolean answered = false;
        for (ReputationProvider provider : selected) {
            if (!provider.supports(ip)) {
                continue;
            }
            Verdict verdict = check(provider, ip, kind, listener == null ? ReputationListener.NONE : listener);
            if (verdict == Verdict.FLAGGED) {
                cache.put(combinedKey, ip, Verdict.FLAGGED);
                return true;
            }
            answered |= verdict.isDefinite();
        }
        if (answered) {
            cache.put(combinedKey, ip, Verdict.CLEAN);
        }
        return false;
    }

    private Verdict check(ReputationProvider provider, String ip, ReputationKind kind, ReputationListener listener) {
        String name = normalize(provider.name());
        Verdict cached = cache.get(name, ip);
        if (cached != null) {
            log.debug("bot-guard provider {} verdict for {} served from cache: {}", name, ip, cached);
            return cached;
        }

        ProviderResult result;
        try {
            result = provider.check(ip);
        } catch (RuntimeException ex) {
            log.warn("bot-guard provider {} failed for {}: {}", name, ip, ex.getMessage());
            result = ProviderResult.unknown();
        }
        if (result == null) {
            result = ProviderResult.unknown();
        }

        Verdict verdict = result.verdict();
        cache.put(name, ip, verdict);
        if (verdict == Verdict.FLAGGED) {
            try {
                listener.onFlagged(name, kind, ip, result.rawFields());
            } catch (RuntimeException ex) {
                log.warn("bot-guard reputation listener failed: {}", ex.getMessage());
            }
        }
        return verdict;
    }

    private List<ReputationProvider> select(List<String> providerNames, ReputationKind kind) {
        List<ReputationProvider> ordered = new ArrayList<>();
        List<ReputationProvider> lastResort = new ArrayList<>();
        for (String providerName : providerNames) {
            ReputationProvider provider = providers.get(normalize(providerName));
            if (provider == null || provider.kind() != kind || ordered.contains(provider) || lastResort.contains(provider)) {
                continue;
            }
            if (provider.lastResort()) {
                lastResort.add(provider);
            } else {
                ordered.add(provider);
            }
        }
        ordered.addAll(lastResort);
        return ordered;
    }

    private static String combinedKey(ReputationKind kind, List<ReputationProvider> selected) {
        StringBuilder sb = new StringBuilder("combined:").append(kind.name().toLowerCase(Locale.ROOT));
        for (ReputationProvider provider : selected) {
            sb.append(':').append(normalize(provider.name()));
        }
        return sb.toString();
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
