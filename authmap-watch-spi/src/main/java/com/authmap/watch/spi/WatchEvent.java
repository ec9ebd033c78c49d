package com.authmap.watch.spi;

import java.util.Map;
import java.util.Objects;

/**
 * One notification from a watch stream.
 *
 * <p>{@code resource} is present for ADDED/MODIFIED (and usually DELETED); {@code message} carries the
 * transport's description for ERROR events.
 */
public record WatchEvent(WatchEventType type, ConfigResource resource, String message) {

    public WatchEvent {
        Objects.requireNonNull(type, "type");
    }

    public static WatchEvent added(String name, Map<String, String> data) {
        return new WatchEvent(WatchEventType.ADDED, new ConfigResource(name, data), null);
    }

    public static WatchEvent modified(String name, Map<String, String> data) {
        return new WatchEvent(WatchEventType.MODIFIED, new ConfigResource(name, data), null);
    }

    public static WatchEvent deleted(String name) {
        return new WatchEvent(WatchEventType.DELETED, new ConfigResource(name, Map.of()), null);
    }

    public static WatchEvent error(String message) {
        return new WatchEvent(WatchEventType.ERROR, null, message);
    }
}
