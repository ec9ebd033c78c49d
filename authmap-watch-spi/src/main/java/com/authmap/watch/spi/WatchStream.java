package com.authmap.watch.spi;

import java.util.Optional;

/**
 * Ordered, pull-style view of one open watch.
 *
 * <p>{@link #next()} blocks until the next event arrives and returns empty once the stream is
 * exhausted (server closed it, it expired, or {@link #close()} was called). After the first empty
 * result every further call returns empty.
 */
public interface WatchStream extends AutoCloseable {

    Optional<WatchEvent> next() throws InterruptedException;

    /** Ends the stream; a blocked {@link #next()} returns empty. Idempotent. */
    @Override
    void close();
}
