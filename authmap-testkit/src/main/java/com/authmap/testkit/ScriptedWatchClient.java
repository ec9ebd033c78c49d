package com.authmap.testkit;

import com.authmap.watch.spi.WatchClient;
import com.authmap.watch.spi.WatchOpenException;
import com.authmap.watch.spi.WatchStream;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double that hands out scripted open outcomes in order. Once the script is exhausted every
 * further open succeeds with an idle stream that stays open until closed.
 */
public class ScriptedWatchClient implements WatchClient {
    private final ConcurrentLinkedQueue<Object> script = new ConcurrentLinkedQueue<>();
    private final List<String> openedNames = new CopyOnWriteArrayList<>();
    private final List<ScriptedWatchStream> issued = new CopyOnWriteArrayList<>();

    public ScriptedWatchClient thenStream(ScriptedWatchStream stream) {
        script.add(stream);
        return this;
    }

    public ScriptedWatchClient thenFail(String message) {
        script.add(new WatchOpenException(message));
        return this;
    }

    @Override
    public WatchStream open(String resourceName) throws WatchOpenException {
        openedNames.add(resourceName);
        Object next = script.poll();
        if (next instanceof WatchOpenException failure) {
            throw failure;
        }
        ScriptedWatchStream stream = (next == null) ? new ScriptedWatchStream() : (ScriptedWatchStream) next;
        issued.add(stream);
        return stream;
    }

    /** Number of open attempts, failed ones included. */
    public int openAttempts() {
        return openedNames.size();
    }

    public List<String> openedNames() {
        return Collections.unmodifiableList(openedNames);
    }

    /** Streams successfully handed out, in order. */
    public List<ScriptedWatchStream> issuedStreams() {
        return Collections.unmodifiableList(issued);
    }

    public ScriptedWatchStream lastStream() {
        return issued.isEmpty() ? null : issued.get(issued.size() - 1);
    }
}
