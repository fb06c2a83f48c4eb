package com.khaounen.botguard.security.reputation;

import com.khaounen.botguard.security.fields.GeoIpProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Local fallback classification from GeoIP/ASN data: anonymous-network flags and
 * hosting-operator organisation names.
 */
public class GeoIpReputationProvider implements ReputationProvider {

    public static final String NAME = "geoip";

    static final List<String> ORGANISATION_FIELDS = List.of("asn_org", "as_name", "isp", "organization");
    static final List<String> ANONYMOUS_FIELDS = List.of(
            "is_anonymous", "is_anonymous_proxy", "is_anonymous_vpn", "is_hosting_provider",
            "is_public_proxy", "is_residential_proxy", "is_tor_exit_node"
    );

    private final List<GeoIpProvider> geoIpProviders;

    public GeoIpReputationProvider(List<GeoIpProvider> geoIpProviders) {
        this.geoIpProviders = List.copyOf(geoIpProviders);
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
    public boolean lastResort() {
        return true;
    }

    @Override
    public ProviderResult check(String ip) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (GeoIpProvider provider : geoIpProviders) {
            Optional<Map<String, Object>> record = provider.lookup(ip);
            record.ifPresent(values -> values.forEach(data::putIfAbsent));
        }
        if (data.isEmpty()) {
            return ProviderResult.unknown();
        }
        return classify(data);
    }

    static ProviderResult classify(Map<String, Object> data) {
        for (String field : ANONYMOUS_FIELDS) {
            if (Boolean.TRUE.equals(data.get(field)) || "true".equals(String.valueOf(data.get(field)))) {
                return new ProviderResult(Verdict.FLAGGED, Map.of(field, true));
            }
        }
        for (String field : ORGANISATION_FIELDS) {
            Object value = data.get(field);
            if (value instanceof String organisation && HostingNetworks.matches(organisation)) {
                return new ProviderResult(Verdict.FLAGGED, Map.of(field, organisation));
            }
        }
        return ProviderResult.of(Verdict.CLEAN);
    }
}
