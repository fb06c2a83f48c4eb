package com.khaounen.botguard.security.reputation;

import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IpIntelReputationProviderTest {

    private static final double THRESHOLD = IpIntelReputationProvider.DEFAULT_SCORE_THRESHOLD;

    @Test
    void scoreAboveThresholdIsFlagged() {
        assertEquals(Verdict.FLAGGED, IpIntelReputationProvider.classify("0.99", THRESHOLD).verdict());
        assertEquals(Verdict.FLAGGED, IpIntelReputationProvider.classify("1\n", THRESHOLD).verdict());
    }

    @Test
    void scoreAtOrBelowThresholdIsClean() {
        assertEquals(Verdict.CLEAN, IpIntelReputationProvider.classify("0.90", THRESHOLD).verdict());
        assertEquals(Verdict.CLEAN, IpIntelReputationProvider.classify("0", THRESHOLD).verdict());
    }

    @Test
    void errorCodesAndGarbageAreUnknown() {
        assertEquals(Verdict.UNKNOWN, IpIntelReputationProvider.classify("-3", THRESHOLD).verdict());
        assertEquals(Verdict.UNKNOWN, IpIntelReputationProvider.classify("95", THRESHOLD).verdict());
        assertEquals(Verdict.UNKNOWN, IpIntelReputationProvider.classify("<html>", THRESHOLD).verdict());
        assertEquals(Verdict.UNKNOWN, IpIntelReputationProvider.classify(null, THRESHOLD).verdict());
    }

    @Test
    void thresholdOutsideProbabilityScaleIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new IpIntelReputationProvider(
                HttpClient.newHttpClient(), "https://check.getipintel.net/check.php", null, 90, Duration.ofSeconds(2)));
    }
}
