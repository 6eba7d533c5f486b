package com.jwsphere.querystream.internal;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Meters shared by all streams of one query type.  Streams are short lived
 * and numerous, so meters are tagged by query type only.
 */
public class QueryStreamMetrics {

    public static final String LIVE = "live";
    public static final String FETCH = "fetch";
    public static final String BUFFERED = "buffered";

    private final Counter emitted;
    private final Counter dropped;
    private final Counter failed;
    private final Counter cancelled;
    private final Timer gateWait;

    private QueryStreamMetrics(MeterRegistry registry, String queryType) {
        this.emitted = Counter.builder("ax.query.emitted")
                .baseUnit("items")
                .description("The number of items delivered to subscribers")
                .tag("querytype", queryType)
                .register(registry);
        this.dropped = Counter.builder("ax.query.dropped")
                .baseUnit("items")
                .description("The number of items discarded by an overflow strategy")
                .tag("querytype", queryType)
                .register(registry);
        this.failed = Counter.builder("ax.query.failed")
                .baseUnit("streams")
                .description("The number of streams terminated by an error")
                .tag("querytype", queryType)
                .register(registry);
        this.cancelled = Counter.builder("ax.query.cancelled")
                .baseUnit("streams")
                .description("The number of streams cancelled by their subscriber")
                .tag("querytype", queryType)
                .register(registry);
        this.gateWait = Timer.builder("ax.query.gate.wait")
                .description("The time a producing thread waits for a result to be accepted")
                .tag("querytype", queryType)
                .register(registry);
    }

    public static QueryStreamMetrics register(MeterRegistry registry, String queryType) {
        return new QueryStreamMetrics(registry, queryType);
    }

    void recordEmitted() {
        emitted.increment();
    }

    void recordDropped(long items) {
        dropped.increment(items);
    }

    void recordFailed() {
        failed.increment();
    }

    void recordCancelled() {
        cancelled.increment();
    }

    void recordGateWait(long nanos) {
        gateWait.record(nanos, TimeUnit.NANOSECONDS);
    }

}
