package com.jwsphere.querystream;

import io.micrometer.core.instrument.MeterRegistry;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Flow control settings of a query stream.
 */
public class QueryStreamConfig {

    public static final int DEFAULT_BUFFER_SIZE = 1024;
    public static final OverflowStrategy DEFAULT_OVERFLOW_STRATEGY = OverflowStrategy.DROP_HEAD;
    public static final long DEFAULT_GATE_TIMEOUT_MILLIS = 3000L;

    private final int bufferSize;
    private final OverflowStrategy overflowStrategy;
    private final long gateTimeoutNanos;

    @Nullable
    private final MeterRegistry meterRegistry;

    private QueryStreamConfig(int bufferSize, OverflowStrategy overflowStrategy, long gateTimeoutNanos,
                              @Nullable MeterRegistry meterRegistry) {
        this.bufferSize = bufferSize;
        this.overflowStrategy = overflowStrategy;
        this.gateTimeoutNanos = gateTimeoutNanos;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Bounds the number of undelivered items held by a stream.
     */
    public QueryStreamConfig withBufferSize(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be strictly positive.");
        }
        return new QueryStreamConfig(bufferSize, overflowStrategy, gateTimeoutNanos, meterRegistry);
    }

    public QueryStreamConfig withOverflowStrategy(OverflowStrategy overflowStrategy) {
        Objects.requireNonNull(overflowStrategy, "Overflow strategy must be non-null.");
        return new QueryStreamConfig(bufferSize, overflowStrategy, gateTimeoutNanos, meterRegistry);
    }

    /**
     * Bounds how long a thread producing results for a one-shot query waits for
     * the subscriber to accept the previous result.  Exceeding it fails the stream.
     */
    public QueryStreamConfig withGateTimeout(long timeout, TimeUnit unit) {
        if (timeout <= 0) {
            throw new IllegalArgumentException("Gate timeout must be strictly positive.");
        }
        return new QueryStreamConfig(bufferSize, overflowStrategy, unit.toNanos(timeout), meterRegistry);
    }

    public QueryStreamConfig withMeterRegistry(MeterRegistry meterRegistry) {
        Objects.requireNonNull(meterRegistry, "Meter registry must be non-null.");
        return new QueryStreamConfig(bufferSize, overflowStrategy, gateTimeoutNanos, meterRegistry);
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public OverflowStrategy getOverflowStrategy() {
        return overflowStrategy;
    }

    public long getGateTimeout(TimeUnit unit) {
        return unit.convert(gateTimeoutNanos, TimeUnit.NANOSECONDS);
    }

    public Optional<MeterRegistry> getMeterRegistry() {
        return Optional.ofNullable(meterRegistry);
    }

    public static QueryStreamConfig create() {
        return new QueryStreamConfig(DEFAULT_BUFFER_SIZE, DEFAULT_OVERFLOW_STRATEGY,
                TimeUnit.MILLISECONDS.toNanos(DEFAULT_GATE_TIMEOUT_MILLIS), null);
    }

    @Override
    public String toString() {
        return "QueryStreamConfig{" +
                "bufferSize=" + bufferSize +
                ", overflowStrategy=" + overflowStrategy +
                ", gateTimeoutNanos=" + gateTimeoutNanos +
                '}';
    }

}
