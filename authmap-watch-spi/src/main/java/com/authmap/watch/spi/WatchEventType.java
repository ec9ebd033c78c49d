package com.authmap.watch.spi;

/** Kinds of change notification a watch stream can deliver. */
public enum WatchEventType {
    ADDED,
    MODIFIED,
    DELETED,
    ERROR
}
