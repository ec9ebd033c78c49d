package com.authmap.testkit;

import com.authmap.watch.spi.WatchEvent;
import com.authmap.watch.spi.WatchStream;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watch stream driven by the test: events are emitted with {@link #emit(WatchEvent)} and the stream
 * ends on {@link #end()} or {@link #close()}. {@link #failWith(RuntimeException)} makes a later
 * {@link #next()} throw, like a transport dropping the connection mid-stream.
 */
public class ScriptedWatchStream implements WatchStream {
    private static final Object END = new Object();

    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private boolean ended;
    private final AtomicBoolean closed = new AtomicBoolean();

    /** Stream that yields the given events and then ends. */
    public static ScriptedWatchStream of(WatchEvent... events) {
        ScriptedWatchStream stream = new ScriptedWatchStream();
        for (WatchEvent event : events) {
            stream.emit(event);
        }
        stream.end();
        return stream;
    }

    public ScriptedWatchStream emit(WatchEvent event) {
        enqueue(event);
        return this;
    }

    /** The {@link #next()} call that reaches this point throws {@code failure}. */
    public ScriptedWatchStream failWith(RuntimeException failure) {
        enqueue(failure);
        return this;
    }

    /** Simulates the server closing the watch. */
    public synchronized void end() {
        if (!ended) {
            ended = true;
            queue.offer(END);
        }
    }

    private synchronized void enqueue(Object item) {
        if (!ended) {
            queue.offer(item);
        }
    }

    @Override
    public Optional<WatchEvent> next() throws InterruptedException {
        Object item = queue.take();
        if (item == END) {
            queue.offer(END);
            return Optional.empty();
        }
        if (item instanceof RuntimeException failure) {
            throw failure;
        }
        return Optional.of((WatchEvent) item);
    }

    @Override
    public void close() {
        closed.set(true);
        end();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
