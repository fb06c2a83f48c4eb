package com.khaounen.botguard.security.fields;

import com.khaounen.botguard.security.guard.GuardRequest;
import com.khaounen.botguard.security.reputation.ReputationAggregator;
import com.khaounen.botguard.security.reputation.ReputationKind;
import com.khaounen.botguard.utils.UrlUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the {@link FieldMap} of a request. The base fields come straight from
 * the request; reputation and GeoIP fields are produced only when a rule asks
 * for them.
 */
@Slf4j
public class FieldResolver {

    public static final String GEOIP = "geoip";

    private final List<GeoIpProvider> geoIpProviders;
    private final ReputationAggregator reputation;

    public FieldResolver(List<GeoIpProvider> geoIpProviders, ReputationAggregator reputation) {
        this.geoIpProviders = geoIpProviders == null ? List.of() : List.copyOf(geoIpProviders);
        this.reputation = reputation;
    }

    /**
     * @param clientIp    resolved client address, {@code null} when unknown
     * @param thirdParties enabled providers, in priority order
     */
    public FieldMap resolve(GuardRequest request, String clientIp, List<String> thirdParties) {
        return new FieldMap(baseFields(request, clientIp), (name, fields) -> load(name, fields, clientIp, thirdParties));
    }

    static Map<String, Object> baseFields(GuardRequest request, String clientIp) {
        String hostname = UrlUtils.hostname(request.host());
        Object json = request.jsonBody();

        Map<String, Object> base = new LinkedHashMap<>();
        base.put(FieldNames.HOST, request.host());
        base.put(FieldNames.NETLOC, request.host());
        base.put(FieldNames.HOSTNAME, hostname);
        base.put(FieldNames.DOMAIN, UrlUtils.domain(hostname));
        base.put(FieldNames.SUBDOMAIN, UrlUtils.subdomain(hostname));
        base.put(FieldNames.PATH, request.path());
        base.put(FieldNames.METHOD, request.method());
        base.put(FieldNames.SCHEME, UrlUtils.scheme(request));
        base.put(FieldNames.ARGS, request.queryArgs() == null ? Map.of() : request.queryArgs());
        base.put(FieldNames.IS_JSON, json != null);
        base.put(FieldNames.JSON, json == null ? Map.of() : json);
        base.put(FieldNames.URL, UrlUtils.url(request));
        base.put(FieldNames.IP, clientIp);
        base.put(FieldNames.USER_AGENT, request.userAgent());
        return base;
    }

    private Object load(String name, FieldMap fields, String clientIp, List<String> thirdParties) {
        if (clientIp == null) {
            return null;
        }
        if (FieldNames.IS_IP_MALICIOUS.equals(name)) {
            return reputation.classify(clientIp, thirdParties, ReputationKind.MALICIOUS);
        }
        if (FieldNames.IS_IP_TOR.equals(name)) {
            return reputation.classify(clientIp, thirdParties, ReputationKind.TOR);
        }
        if (thirdParties == null || !thirdParties.contains(GEOIP)) {
            return null;
        }
        for (GeoIpProvider provider : geoIpProviders) {
            if (!provider.fields().contains(name)) {
                continue;
            }
            Optional<Map<String, Object>> record = provider.lookup(clientIp);
            if (record.isEmpty()) {
                continue;
            }
            fields.merge(record.get());
            Object value = record.get().get(name);
            if (value != null) {
                log.debug("bot-guard field {} resolved by {}", name, provider.getClass().getSimpleName());
                return value;
            }
        }
        return null;
    }
}
