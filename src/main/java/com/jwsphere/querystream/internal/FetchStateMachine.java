package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.BufferOverflowException;
import com.jwsphere.querystream.QueryStreamConfig;
import com.jwsphere.querystream.QuerySubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Bridges the results of a one-shot query to a demand-driven subscriber.
 *
 * Results arrive from the thread executing the query through a
 * {@link FetchListener}.  A gated listener holds that thread until each
 * result has been accepted, so at most one result is ever buffered; a
 * buffering listener never holds it, leaving the overflow strategy to
 * bound the buffer.  The end of the results completes the subscriber once
 * every buffered result has been delivered.
 */
public final class FetchStateMachine<T> extends AbstractQueryStateMachine<T> {

    private static final Logger LOG = LoggerFactory.getLogger(FetchStateMachine.class);

    public enum Phase {
        FETCHING,
        DRAINING,
        COMPLETED,
        FAILED
    }

    private final OverflowBuffer<T> buffer;

    // assigned by the factory methods before the machine is published
    private FetchListener<T> listener;

    private volatile Phase phase = Phase.FETCHING;

    private FetchStateMachine(QuerySubscriber<? super T> subscriber, QueryStreamConfig config, QueryStreamMetrics metrics) {
        super(subscriber, metrics);
        this.buffer = new OverflowBuffer<>(config.getBufferSize(), config.getOverflowStrategy(), metrics::recordDropped);
    }

    /**
     * Creates a machine whose listener holds the producing thread until each result is accepted.
     */
    public static <T> FetchStateMachine<T> gated(QuerySubscriber<? super T> subscriber,
                                                 QueryStreamConfig config,
                                                 QueryStreamMetrics metrics) {
        FetchStateMachine<T> machine = new FetchStateMachine<>(subscriber, config, metrics);
        long timeout = config.getGateTimeout(TimeUnit.NANOSECONDS);
        machine.listener = new ResultGate<>(machine, timeout, TimeUnit.NANOSECONDS, metrics);
        return machine;
    }

    /**
     * Creates a machine whose listener never holds the producing thread.
     */
    public static <T> FetchStateMachine<T> buffered(QuerySubscriber<? super T> subscriber,
                                                    QueryStreamConfig config,
                                                    QueryStreamMetrics metrics) {
        FetchStateMachine<T> machine = new FetchStateMachine<>(subscriber, config, metrics);
        machine.listener = new BufferingResultListener<>(machine);
        return machine;
    }

    public FetchListener<T> listener() {
        return listener;
    }

    public Phase getPhase() {
        return phase;
    }

    List<T> bufferedItems() {
        return buffer.snapshot();
    }

    void onItem(T item) {
        submit(() -> handleItem(item));
    }

    void onEnd() {
        submit(this::handleEnd);
    }

    void onError(Throwable error) {
        submit(() -> handleError(error));
    }

    private void handleItem(T item) {
        if (phase != Phase.FETCHING) {
            return;
        }
        if (!drain()) {
            return;
        }
        if (hasDemand()) {
            deliver(item);
        } else if (buffer.offer(item) == OverflowBuffer.Outcome.OVERFLOWED) {
            LOG.warn("Query buffer of size {} overflowed", buffer.capacity());
            terminateExceptionally(new BufferOverflowException(buffer.capacity()));
        }
    }

    private void handleEnd() {
        if (phase != Phase.FETCHING) {
            return;
        }
        moveTo(Phase.DRAINING);
        completeIfDrained();
    }

    private void handleError(Throwable error) {
        if (isTerminal()) {
            return;
        }
        terminateExceptionally(error);
    }

    @Override
    protected void handleRequest(long elements) {
        if (isTerminal()) {
            return;
        }
        addDemand(elements);
        if (drain()) {
            completeIfDrained();
        }
    }

    @Override
    protected void handleCancel() {
        if (isTerminal()) {
            return;
        }
        buffer.clear();
        listener.finish();
        metrics.recordCancelled();
        moveTo(Phase.COMPLETED);
        signalComplete();
    }

    /**
     * @return whether the stream is still healthy
     */
    private boolean drain() {
        while (hasDemand() && !buffer.isEmpty()) {
            if (!deliver(buffer.poll())) {
                return false;
            }
        }
        return true;
    }

    private boolean deliver(T item) {
        RuntimeException failure = emit(item);
        if (failure != null) {
            terminateExceptionally(failure);
            return false;
        }
        listener.release();
        return true;
    }

    private void completeIfDrained() {
        if (phase == Phase.DRAINING && buffer.isEmpty()) {
            moveTo(Phase.COMPLETED);
            signalComplete();
        }
    }

    private void terminateExceptionally(Throwable error) {
        buffer.clear();
        listener.finish();
        moveTo(Phase.FAILED);
        signalError(error);
    }

    private boolean isTerminal() {
        return phase == Phase.COMPLETED || phase == Phase.FAILED;
    }

    private void moveTo(Phase next) {
        LOG.debug("Query moved from {} to {}", phase, next);
        phase = next;
    }

}
