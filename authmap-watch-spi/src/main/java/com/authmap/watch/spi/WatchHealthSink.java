package com.authmap.watch.spi;

/**
 * Receives the outcome of every watch-open attempt. Implementations publish it as the
 * {@code watch_health{result=success|fail}} gauge.
 */
public interface WatchHealthSink {

    WatchHealthSink NOOP = success -> {};

    void watchOpened(boolean success);
}
