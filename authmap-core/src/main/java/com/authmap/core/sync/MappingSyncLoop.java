package com.authmap.core.sync;

import com.authmap.core.parse.MappingDocumentParser;
import com.authmap.core.parse.ParsedMappings;
import com.authmap.core.store.MappingStore;
import com.authmap.watch.spi.ConfigResource;
import com.authmap.watch.spi.WatchClient;
import com.authmap.watch.spi.WatchEvent;
import com.authmap.watch.spi.WatchHealthSink;
import com.authmap.watch.spi.WatchOpenException;
import com.authmap.watch.spi.WatchStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a {@link MappingStore} in step with the watched resource on a dedicated thread.
 *
 * <p>State machine: {@code DISCONNECTED -> WATCHING -> (DISCONNECTED | STOPPED)}. A closed stream is
 * the normal "watch expired" path and is reopened indefinitely. Events of one stream are applied
 * strictly in order. The stop signal is checked before every open; {@link #stop()} also closes the
 * current stream so the loop reaches that checkpoint without interrupting an event in flight.
 *
 * <p>A stream that throws is treated like one that closed: it is closed and reopened after a backoff.
 * When the first open fails and {@link SyncSettings#failFastOnInitialOpen()} is set, or the thread
 * hits an unexpected failure outside a stream, the loop ends in {@link SyncState#FAILED} and
 * {@link #termination()} completes exceptionally with a {@link SyncFatalException}; the owner decides
 * how to terminate the process.
 */
public class MappingSyncLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MappingSyncLoop.class);

    static final String THREAD_NAME = "authmap-sync";

    private final WatchClient client;
    private final MappingDocumentParser parser;
    private final MappingStore store;
    private final WatchHealthSink health;
    private final SyncSettings settings;
    private final ReconnectBackoff backoff;

    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.DISCONNECTED);
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private volatile WatchStream current;

    public MappingSyncLoop(
            WatchClient client,
            MappingDocumentParser parser,
            MappingStore store,
            WatchHealthSink health,
            SyncSettings settings) {
        this.client = Objects.requireNonNull(client, "client");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.store = Objects.requireNonNull(store, "store");
        this.health = (health == null) ? WatchHealthSink.NOOP : health;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.backoff = new ReconnectBackoff(
                settings.initialBackoff(), settings.maxBackoff(), settings.backoffMultiplier());
    }

    /** Starts the background thread. Later calls are no-ops. */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::run, THREAD_NAME);
        thread.setDaemon(true);
        thread.start();
        log.info("Mapping sync started for resource={}", settings.resourceName());
    }

    /** Raises the one-shot stop signal. Idempotent. */
    public void stop() {
        if (stopSignal.getCount() == 0) {
            return;
        }
        stopSignal.countDown();
        if (started.compareAndSet(false, true)) {
            // never started: nothing to unwind
            finish(SyncState.STOPPED, null);
            return;
        }
        WatchStream stream = current;
        if (stream != null) {
            stream.close();
        }
        log.info("Mapping sync stop requested for resource={}", settings.resourceName());
    }

    @Override
    public void close() {
        stop();
    }

    /** Blocks until the loop has ended (stopped or failed). Returns false on timeout. */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        try {
            termination.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (ExecutionException ex) {
            return true;
        } catch (TimeoutException ex) {
            return false;
        }
    }

    /** Completes normally on stop, exceptionally with {@link SyncFatalException} on fatal failure. */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    public SyncState state() {
        return state.get();
    }

    public String resourceName() {
        return settings.resourceName();
    }

    void run() {
        try {
            watchUntilStopped();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.info("Mapping sync interrupted; stopping");
        } catch (RuntimeException | Error ex) {
            log.error("Mapping sync for resource={} failed unexpectedly", settings.resourceName(), ex);
            finish(
                    SyncState.FAILED,
                    new SyncFatalException("Mapping sync for " + settings.resourceName() + " failed unexpectedly", ex));
            if (ex instanceof Error err) {
                throw err;
            }
            return;
        }
        finish(SyncState.STOPPED, null);
    }

    private void watchUntilStopped() throws InterruptedException {
        boolean firstAttempt = true;
        while (!stopRequested()) {
            state.set(SyncState.DISCONNECTED);
            WatchStream stream;
            try {
                stream = client.open(settings.resourceName());
            } catch (WatchOpenException | RuntimeException ex) {
                health.watchOpened(false);
                if (firstAttempt && settings.failFastOnInitialOpen()) {
                    log.error("Unable to establish watch on resource={}; giving up", settings.resourceName(), ex);
                    finish(
                            SyncState.FAILED,
                            new SyncFatalException("Unable to establish watch on " + settings.resourceName(), ex));
                    return;
                }
                firstAttempt = false;
                Duration delay = backoff.nextDelay();
                log.warn(
                        "Unable to re-establish watch on resource={}: {}. Retrying in {} ms",
                        settings.resourceName(),
                        ex.getMessage(),
                        delay.toMillis());
                pause(delay);
                continue;
            }

            firstAttempt = false;
            current = stream;
            int delivered = 0;
            boolean broken = false;
            try {
                health.watchOpened(true);
                state.set(SyncState.WATCHING);
                log.info("Watch established on resource={}", settings.resourceName());
                if (stopRequested()) {
                    stream.close();
                }
                try {
                    delivered = consume(stream);
                } catch (RuntimeException ex) {
                    broken = true;
                    log.warn("Watch stream for resource={} failed", settings.resourceName(), ex);
                }
            } finally {
                current = null;
                closeStream(stream);
            }

            if (stopRequested()) {
                return;
            }
            Duration delay;
            if (!broken && delivered > 0) {
                backoff.reset();
                delay = backoff.initialDelay();
            } else {
                delay = backoff.nextDelay();
            }
            log.warn(
                    "Watch channel closed for resource={} after {} event(s); reopening in {} ms",
                    settings.resourceName(),
                    delivered,
                    delay.toMillis());
            pause(delay);
        }
    }

    private void closeStream(WatchStream stream) {
        try {
            stream.close();
        } catch (RuntimeException ex) {
            log.warn("Failed to close watch stream for resource={}", settings.resourceName(), ex);
        }
    }

    private int consume(WatchStream stream) throws InterruptedException {
        int delivered = 0;
        Optional<WatchEvent> next;
        while ((next = stream.next()).isPresent()) {
            delivered++;
            WatchEvent event = next.get();
            try {
                apply(event);
            } catch (RuntimeException ex) {
                log.error("Failed to apply {} event for resource={}", event.type(), settings.resourceName(), ex);
            }
        }
        return delivered;
    }

    void apply(WatchEvent event) {
        switch (event.type()) {
            case ERROR -> log.error("Received a watch error: {}", event.message());
            case DELETED -> {
                log.info("Resetting mappings on delete of resource={}", settings.resourceName());
                store.clear();
            }
            case ADDED, MODIFIED -> applyUpdate(event);
        }
    }

    private void applyUpdate(WatchEvent event) {
        ConfigResource resource = event.resource();
        if (resource == null || !settings.resourceName().equals(resource.name())) {
            log.debug(
                    "Ignoring {} event for resource={}",
                    event.type(),
                    resource == null ? "<none>" : resource.name());
            return;
        }
        log.info("Received {} watch event for resource={}", event.type(), resource.name());
        ParsedMappings parsed = parser.parse(resource.data());
        parsed.failure()
                .ifPresent(err -> log.error(
                        "There was an error parsing resource={}; only saving data that was good",
                        resource.name(),
                        err));
        store.replace(parsed.users(), parsed.roles(), parsed.accounts());
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0;
    }

    private void pause(Duration delay) throws InterruptedException {
        if (!delay.isZero()) {
            stopSignal.await(delay.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    // First terminal outcome wins.
    private void finish(SyncState terminal, SyncFatalException failure) {
        if (termination.isDone()) {
            return;
        }
        state.set(terminal);
        if (failure == null) {
            termination.complete(null);
        } else {
            termination.completeExceptionally(failure);
        }
    }
}
