package com.khaounen.botguard.security.reputation;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExoneratorReputationProviderTest {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    @Test
    void stopsReadingOnceMarkerIsSeen() throws Exception {
        String head = "<html><body>" + "x".repeat(300) + "<h3>Result is positive</h3>";
        EndlessStream body = new EndlessStream(head.getBytes(StandardCharsets.UTF_8));

        assertEquals(Verdict.FLAGGED, ExoneratorReputationProvider.scan(body, NO_DEADLINE));
    }

    @Test
    void markerSplitAcrossChunksIsFound() throws Exception {
        int offset = ExoneratorReputationProvider.CHUNK_SIZE - 5;
        String page = "y".repeat(offset) + "Result is positive" + "z".repeat(50);

        assertEquals(Verdict.FLAGGED, ExoneratorReputationProvider.scan(stream(page), NO_DEADLINE));
    }

    @Test
    void completePageWithoutMarkerIsClean() throws Exception {
        String page = "<html>" + "n".repeat(1000) + "Result is negative</html>";

        assertEquals(Verdict.CLEAN, ExoneratorReputationProvider.scan(stream(page), NO_DEADLINE));
    }

    @Test
    void passedDeadlineIsUnknown() throws Exception {
        String page = "n".repeat(1000);

        assertEquals(Verdict.UNKNOWN, ExoneratorReputationProvider.scan(stream(page), System.nanoTime() - 1));
    }

    @Test
    void stalledPageIsAbandonedAtTheDeadline() throws Exception {
        try (StallingServer server = new StallingServer("text/html", "<html><body>", Duration.ofSeconds(8), "</body></html>")) {
            ExoneratorReputationProvider provider = new ExoneratorReputationProvider(
                    HttpClient.newHttpClient(), server.url("/exonerator.html"), Duration.ofSeconds(1));

            long started = System.nanoTime();
            Verdict verdict = provider.check("1.2.3.4").verdict();
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

            assertEquals(Verdict.UNKNOWN, verdict);
            assertTrue(elapsedMillis < 4000, "lookup took " + elapsedMillis + "ms");
        }
    }

    @Test
    void markerBeforeStallIsFlaggedWithoutWaiting() throws Exception {
        String head = "<html><body>" + "x".repeat(200) + "<h3>Result is positive</h3>";
        try (StallingServer server = new StallingServer("text/html", head, Duration.ofSeconds(8), "</body></html>")) {
            ExoneratorReputationProvider provider = new ExoneratorReputationProvider(
                    HttpClient.newHttpClient(), server.url("/exonerator.html"), Duration.ofSeconds(3));

            long started = System.nanoTime();
            Verdict verdict = provider.check("1.2.3.4").verdict();
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

            assertEquals(Verdict.FLAGGED, verdict);
            assertTrue(elapsedMillis < 3000, "lookup took " + elapsedMillis + "ms");
        }
    }

    private static InputStream stream(String page) {
        return new ByteArrayInputStream(page.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Serves a prefix followed by filler and fails once far more than the prefix was read.
     */
    private static final class EndlessStream extends InputStream {
        private static final int LIMIT = 1 << 20;

        private final byte[] prefix;
        private int served;

        private EndlessStream(byte[] prefix) {
            this.prefix = prefix;
        }

        @Override
        public int read() throws IOException {
            if (served >= LIMIT) {
                throw new IOException("read past the marker");
            }
            int b = served < prefix.length ? prefix[served] : 'f';
            served++;
            return b;
        }
    }
}
