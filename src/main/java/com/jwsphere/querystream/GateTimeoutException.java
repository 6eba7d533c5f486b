package com.jwsphere.querystream;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Indicates that a thread producing results for a one-shot query waited
 * longer than the configured gate timeout for the subscriber to accept
 * the previous result.
 *
 * @author Jonathan Wonders
 */
public class GateTimeoutException extends RuntimeException {

    private final long timeoutNanos;

    public GateTimeoutException(long timeout, TimeUnit unit) {
        super("Result was not accepted within " + Duration.ofNanos(unit.toNanos(timeout)) + ".");
        this.timeoutNanos = unit.toNanos(timeout);
    }

    public long getTimeout(TimeUnit unit) {
        return unit.convert(timeoutNanos, TimeUnit.NANOSECONDS);
    }

}
