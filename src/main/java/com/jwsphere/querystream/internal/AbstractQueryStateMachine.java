package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.QuerySubscriber;
import com.jwsphere.querystream.QuerySubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

/**
 * The subscription side shared by the state machines behind every query
 * stream.  All events, whether raised by the query engine or by the
 * subscriber, are processed one at a time through a {@link SerialMailbox},
 * so subclasses evaluate their transitions without further locking.
 *
 * This class owns the outstanding demand of the subscriber and guarantees
 * that at most one terminal signal is delivered.
 *
 * @param <T> the type of item delivered to the subscriber
 */
public abstract class AbstractQueryStateMachine<T> implements QuerySubscription {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractQueryStateMachine.class);

    private final SerialMailbox mailbox = new SerialMailbox();
    private final QuerySubscriber<? super T> subscriber;

    protected final QueryStreamMetrics metrics;

    @GuardedBy("mailbox")
    private long demand = 0;

    @GuardedBy("mailbox")
    private boolean terminated = false;

    protected AbstractQueryStateMachine(QuerySubscriber<? super T> subscriber, QueryStreamMetrics metrics) {
        this.subscriber = subscriber;
        this.metrics = metrics;
    }

    /**
     * Hands this subscription to the subscriber.  Must be called once, before
     * the query is issued.
     */
    public void start() {
        subscriber.onSubscribe(this);
    }

    @Override
    public final void request(long elements) {
        if (elements <= 0) {
            throw new IllegalArgumentException("Number of requested elements must be strictly positive, was " + elements);
        }
        submit(() -> handleRequest(elements));
    }

    @Override
    public final void cancel() {
        submit(this::handleCancel);
    }

    protected final void submit(Runnable event) {
        mailbox.submit(event);
    }

    protected abstract void handleRequest(long elements);

    protected abstract void handleCancel();

    protected final void addDemand(long elements) {
        demand = addWithoutOverflow(demand, elements);
    }

    protected final boolean hasDemand() {
        return demand > 0;
    }

    protected final long demand() {
        return demand;
    }

    /**
     * Delivers an item to the subscriber, consuming one unit of demand.
     *
     * @return the exception thrown by the subscriber, or {@code null} if the item was accepted
     */
    @Nullable
    protected final RuntimeException emit(T item) {
        if (demand <= 0 || terminated) {
            throw new IllegalStateException("Cannot emit without outstanding demand");
        }
        demand--;
        try {
            subscriber.onNext(item);
            metrics.recordEmitted();
            return null;
        } catch (RuntimeException e) {
            LOG.warn("Subscriber failed to accept an item, terminating stream", e);
            return e;
        }
    }

    protected final void signalComplete() {
        if (!terminated) {
            terminated = true;
            subscriber.onComplete();
        }
    }

    protected final void signalError(Throwable error) {
        if (!terminated) {
            terminated = true;
            metrics.recordFailed();
            subscriber.onError(error);
        }
    }

    private static long addWithoutOverflow(long left, long right) {
        long sum = left + right;
        if (((left ^ sum) & (right ^ sum)) < 0L) {
            return Long.MAX_VALUE;
        } else {
            return sum;
        }
    }

}
