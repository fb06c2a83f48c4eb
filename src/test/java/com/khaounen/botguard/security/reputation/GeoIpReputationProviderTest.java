package com.khaounen.botguard.security.reputation;

import com.khaounen.botguard.security.fields.GeoIpProvider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoIpReputationProviderTest {

    @Test
    void anonymousNetworkFlagIsFlagged() {
        assertEquals(Verdict.FLAGGED, GeoIpReputationProvider.classify(Map.of("is_anonymous_vpn", true)).verdict());
        assertEquals(Verdict.FLAGGED, GeoIpReputationProvider.classify(Map.of("is_hosting_provider", "true")).verdict());
    }

    @Test
    void hostingOrganisationIsFlagged() {
        assertEquals(Verdict.FLAGGED, GeoIpReputationProvider.classify(Map.of("asn_org", "DIGITALOCEAN-ASN")).verdict());
    }

    @Test
    void ordinaryNetworkIsClean() {
        assertEquals(Verdict.CLEAN, GeoIpReputationProvider.classify(
                Map.of("asn_org", "Comcast Cable Communications", "is_anonymous", false)).verdict());
    }

    @Test
    void noGeoDataIsUnknown() {
        GeoIpProvider empty = new GeoIpProvider() {
            @Override
            public Set<String> fields() {
                return Set.of("asn_org");
            }

            @Override
            public Optional<Map<String, Object>> lookup(String ip) {
                return Optional.empty();
            }
        };
        GeoIpReputationProvider provider = new GeoIpReputationProvider(List.of(empty));

        assertEquals(Verdict.UNKNOWN, provider.check("8.8.8.8").verdict());
        assertTrue(provider.lastResort());
    }
}
