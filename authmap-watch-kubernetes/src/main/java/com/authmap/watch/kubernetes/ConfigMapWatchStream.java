package com.authmap.watch.kubernetes;

import com.authmap.watch.spi.ConfigResource;
import com.authmap.watch.spi.WatchEvent;
import com.authmap.watch.spi.WatchEventType;
import com.authmap.watch.spi.WatchStream;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges fabric8's callback {@link Watcher} to the ordered pull {@link WatchStream}. Callbacks are
 * queued in arrival order; the stream ends when the watch closes, with or without a cause.
 */
class ConfigMapWatchStream implements WatchStream, Watcher<ConfigMap> {
    private static final Logger log = LoggerFactory.getLogger(ConfigMapWatchStream.class);
    private static final Object END = new Object();

    private final String resourceName;
    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    // guarded by this; nothing is queued behind END
    private boolean ended;
    private volatile Watch watch;

    ConfigMapWatchStream(String resourceName) {
        this.resourceName = resourceName;
    }

    void attach(Watch watch) {
        boolean alreadyEnded;
        synchronized (this) {
            this.watch = watch;
            alreadyEnded = ended;
        }
        if (alreadyEnded) {
            watch.close();
        }
    }

    @Override
    public void eventReceived(Action action, ConfigMap configMap) {
        switch (action) {
            case ADDED -> offer(new WatchEvent(WatchEventType.ADDED, toResource(configMap), null));
            case MODIFIED -> offer(new WatchEvent(WatchEventType.MODIFIED, toResource(configMap), null));
            case DELETED -> offer(new WatchEvent(WatchEventType.DELETED, toResource(configMap), null));
            case ERROR -> offer(WatchEvent.error("watch error on configmap " + resourceName));
            default -> log.debug("Ignoring {} event on configmap {}", action, resourceName);
        }
    }

    @Override
    public void onClose(WatcherException cause) {
        offer(WatchEvent.error(cause.getMessage()));
        end();
    }

    @Override
    public void onClose() {
        end();
    }

    @Override
    public Optional<WatchEvent> next() throws InterruptedException {
        Object item = queue.take();
        if (item == END) {
            queue.offer(END);
            return Optional.empty();
        }
        return Optional.of((WatchEvent) item);
    }

    @Override
    public void close() {
        end();
        Watch current = watch;
        if (current != null) {
            current.close();
        }
    }

    private synchronized void offer(WatchEvent event) {
        if (!ended) {
            queue.offer(event);
        }
    }

    private synchronized void end() {
        if (!ended) {
            ended = true;
            queue.offer(END);
        }
    }

    private static ConfigResource toResource(ConfigMap configMap) {
        if (configMap == null) {
            return null;
        }
        String name = configMap.getMetadata() == null ? null : configMap.getMetadata().getName();
        return new ConfigResource(name, configMap.getData());
    }
}
