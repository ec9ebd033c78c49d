package com.authmap.spring.autoconfigure;

import com.authmap.watch.spi.WatchHealthSink;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes {@code watch.health{result=success|fail}}. A series is registered the first time its
 * result is reported: success sets 1.0 on the success series, failure sets 0.0 on the fail series.
 */
public class MicrometerWatchHealthSink implements WatchHealthSink {
    static final String RESULT_TAG = "result";
    static final String SUCCESS = "success";
    static final String FAILURE = "fail";
    static final double SUCCESS_UNIT = 1.0;
    static final double FAILURE_UNIT = 0.0;

    private final MeterRegistry registry;
    private final String gaugeName;
    private final Map<String, AtomicReference<Double>> series = new ConcurrentHashMap<>();

    public MicrometerWatchHealthSink(MeterRegistry registry, String gaugeName) {
        this.registry = registry;
        this.gaugeName = gaugeName;
    }

    @Override
    public void watchOpened(boolean success) {
        if (success) {
            gauge(SUCCESS).set(SUCCESS_UNIT);
        } else {
            gauge(FAILURE).set(FAILURE_UNIT);
        }
    }

    private AtomicReference<Double> gauge(String result) {
        return series.computeIfAbsent(result, r -> registry.gauge(
                gaugeName, Tags.of(RESULT_TAG, r), new AtomicReference<Double>(Double.NaN), AtomicReference::get));
    }
}
