package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.GateTimeoutException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Paces the thread executing a one-shot query to the rate at which the
 * subscriber accepts results.  Each result is forwarded to the state machine,
 * after which the producing thread waits for a permit that is released once
 * the subscriber has accepted that result.  Permits released ahead of time
 * accumulate, so a result accepted before the producer starts waiting does
 * not hold it back.
 *
 * A producing thread that waits longer than the gate timeout fails the stream
 * with a {@link GateTimeoutException} and is told to stop fetching.
 *
 * @author Jonathan Wonders
 */
public final class ResultGate<T> implements FetchListener<T> {

    private final FetchStateMachine<T> machine;
    private final long timeoutNanos;
    private final QueryStreamMetrics metrics;

    private final Semaphore permits = new Semaphore(0);
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private volatile boolean finished = false;

    ResultGate(FetchStateMachine<T> machine, long timeout, TimeUnit unit, QueryStreamMetrics metrics) {
        this.machine = machine;
        this.timeoutNanos = unit.toNanos(timeout);
        this.metrics = metrics;
    }

    @Override
    public boolean onResult(T item) {
        if (finished) {
            return false;
        }
        machine.onItem(item);
        long start = System.nanoTime();
        try {
            if (!Managed.tryAcquire(permits, timeoutNanos, TimeUnit.NANOSECONDS)) {
                if (!finished) {
                    finished = true;
                    machine.onError(new GateTimeoutException(timeoutNanos, TimeUnit.NANOSECONDS));
                }
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = true;
            machine.onError(e);
            return false;
        } finally {
            metrics.recordGateWait(System.nanoTime() - start);
        }
        return !finished;
    }

    @Override
    public void onEnd() {
        if (ended.compareAndSet(false, true)) {
            machine.onEnd();
        }
    }

    @Override
    public void onError(Throwable error) {
        machine.onError(error);
        finish();
    }

    @Override
    public void release() {
        permits.release();
    }

    @Override
    public void finish() {
        if (!finished) {
            finished = true;
            permits.release();
        }
    }

    boolean isFinished() {
        return finished;
    }

    int availablePermits() {
        return permits.availablePermits();
    }

}
