package com.authmap.spring.autoconfigure;

import com.authmap.core.sync.MappingSyncLoop;
import com.authmap.core.sync.SyncFatalException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Ties the sync loop to the application context: started after the context refreshes, stopped on
 * close, and a fatal loop failure is handed to the {@link SyncFailureHandler}.
 */
@Slf4j
@RequiredArgsConstructor
public class MappingSyncLifecycle implements SmartLifecycle {

    private final MappingSyncLoop loop;
    private final SyncFailureHandler failureHandler;
    private final Duration shutdownTimeout;

    private volatile boolean running;

    @Override
    public void start() {
        loop.termination().whenComplete((ignored, err) -> {
            if (err != null) {
                Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                SyncFatalException fatal = cause instanceof SyncFatalException sfe
                        ? sfe
                        : new SyncFatalException("Mapping sync ended unexpectedly", cause);
                failureHandler.onFatal(fatal);
            }
        });
        loop.start();
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        loop.stop();
        try {
            if (!loop.awaitTermination(shutdownTimeout)) {
                log.warn("Mapping sync did not stop within {}", shutdownTimeout);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
