package com.voicerelay.common;

import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.LongAdder;

/**
 * Latency tracking using HdrHistogram.
 * Record nanos from any thread; report percentiles periodically.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Histogram histogram;
    private final LongAdder count = new LongAdder();
    private final String name;

    public LatencyStats(String name) {
        this.name = name;
        // max 10 minutes, 3 sig figs
        this.histogram = new Histogram(600_000_000_000L, 3);
    }

    public void record(long latencyNanos) {
        synchronized (histogram) {
            histogram.recordValue(Math.min(Math.max(latencyNanos, 0), histogram.getHighestTrackableValue()));
        }
        count.increment();
    }

    public long count() {
        return count.sum();
    }

    public void logAndReset() {
        long total = count.sumThenReset();
        if (total == 0) return;
        synchronized (histogram) {
            log.info("[metrics] {} count={} p50={}ms p99={}ms max={}ms",
                    name, total,
                    histogram.getValueAtPercentile(50) / 1_000_000,
                    histogram.getValueAtPercentile(99) / 1_000_000,
                    histogram.getMaxValue() / 1_000_000);
            histogram.reset();
        }
    }
}
