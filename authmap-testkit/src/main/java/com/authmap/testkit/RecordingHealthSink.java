package com.authmap.testkit;

import com.authmap.watch.spi.WatchHealthSink;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Test double that records every watch-open outcome in order. */
public class RecordingHealthSink implements WatchHealthSink {
    private final List<Boolean> outcomes = new CopyOnWriteArrayList<>();

    @Override
    public void watchOpened(boolean success) {
        outcomes.add(success);
    }

    public List<Boolean> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public void clear() {
        outcomes.clear();
    }
}
