package com.khaounen.botguard.security.reputation;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Time budget of one provider lookup. The request timeout of {@link HttpClient} stops
 * at the response headers, so the budget covers the body as well.
 */
@Slf4j
final class LookupDeadline {

    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(task -> {
        Thread thread = new Thread(task, "bot-guard-lookup-watchdog");
        thread.setDaemon(true);
        return thread;
    });

    private final long deadlineNanos;

    private LookupDeadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    static LookupDeadline after(Duration budget) {
        return new LookupDeadline(System.nanoTime() + budget.toNanos());
    }

    long remainingNanos() {
        return Math.max(0, deadlineNanos - System.nanoTime());
    }

    boolean passed() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    long nanos() {
        return deadlineNanos;
    }

    /**
     * Sends {@code request} and waits for the response handled by {@code handler}, giving up
     * and cancelling the exchange when the budget runs out.
     */
    <T> HttpResponse<T> send(HttpClient client, HttpRequest request, HttpResponse.BodyHandler<T> handler)
            throws IOException, InterruptedException {
        CompletableFuture<HttpResponse<T>> pending = client.sendAsync(request, handler);
        try {
            return pending.get(remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            pending.cancel(true);
            throw new HttpTimeoutException("no complete response from " + request.uri().getHost() + " in time");
        } catch (InterruptedException ex) {
            pending.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IOException(cause);
        }
    }

    /**
     * Closes {@code stream} once the budget runs out, which fails a read blocked on it.
     * Cancel the returned handle when the stream is done with.
     */
    ScheduledFuture<?> closeWhenPassed(Closeable stream) {
        return WATCHDOG.schedule(() -> {
            try {
                stream.close();
            } catch (IOException ex) {
                log.debug("bot-guard could not close timed out response: {}", ex.getMessage());
            }
        }, remainingNanos(), TimeUnit.NANOSECONDS);
    }
}
