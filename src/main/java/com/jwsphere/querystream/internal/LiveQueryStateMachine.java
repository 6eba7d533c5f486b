package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.BufferOverflowException;
import com.jwsphere.querystream.LiveQueryEvent;
import com.jwsphere.querystream.LiveResultListener;
import com.jwsphere.querystream.QueryEngine;
import com.jwsphere.querystream.QueryStreamConfig;
import com.jwsphere.querystream.QuerySubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Bridges the change events of a live query to a demand-driven subscriber.
 *
 * The database pushes events on its own notification thread, which must not
 * be blocked, so events that cannot be delivered are buffered under the
 * configured overflow strategy.  The token identifying the live subscription
 * arrives asynchronously, either from the subscribe call or along with an
 * event, and nothing is delivered until it is known so that a cancellation
 * can always be turned into an unsubscribe.
 *
 * <pre>
 * AWAITING_TOKEN --token/event--&gt; ACTIVE --cancel--&gt; COMPLETED
 *       |                          |
 *       +--cancel--&gt; CANCELLED --token/event--&gt; COMPLETED
 *
 * AWAITING_TOKEN, ACTIVE --error/overflow--&gt; FAILED
 * </pre>
 *
 * A live query never completes on its own.  Every token that becomes known
 * after cancellation has been requested is unsubscribed exactly once.
 *
 * @author Jonathan Wonders
 */
public final class LiveQueryStateMachine<T> extends AbstractQueryStateMachine<LiveQueryEvent<T>>
        implements LiveResultListener<T> {

    private static final Logger LOG = LoggerFactory.getLogger(LiveQueryStateMachine.class);

    public enum Phase {
        AWAITING_TOKEN,
        ACTIVE,
        CANCELLED,
        COMPLETED,
        FAILED
    }

    private final QueryEngine<T> engine;

    private final State completed = new Terminated(Phase.COMPLETED);
    private final State failed = new Terminated(Phase.FAILED);

    private volatile State state;

    public LiveQueryStateMachine(QuerySubscriber<? super LiveQueryEvent<T>> subscriber,
                                 QueryEngine<T> engine,
                                 QueryStreamConfig config,
                                 QueryStreamMetrics metrics) {
        super(subscriber, metrics);
        this.engine = engine;
        this.state = new AwaitingToken(new OverflowBuffer<>(
                config.getBufferSize(), config.getOverflowStrategy(), metrics::recordDropped));
    }

    /**
     * Reports the token of the live subscription once the subscribe call has completed.
     */
    public void onToken(int token) {
        submit(() -> transition(state.onToken(token)));
    }

    @Override
    public void onLiveResult(int token, LiveQueryEvent<T> event) {
        submit(() -> transition(state.onEvent(token, event)));
    }

    @Override
    public void onError(Throwable error) {
        submit(() -> transition(state.onError(error)));
    }

    @Override
    protected void handleRequest(long elements) {
        transition(state.onRequest(elements));
    }

    @Override
    protected void handleCancel() {
        transition(state.onCancel());
    }

    public Phase getPhase() {
        return state.phase();
    }

    /**
     * A copy of the events awaiting demand.
     */
    List<LiveQueryEvent<T>> bufferedEvents() {
        return state.buffered();
    }

    private void transition(State next) {
        State previous = state;
        if (next != previous) {
            state = next;
            if (previous.phase() != next.phase()) {
                LOG.debug("Live query moved from {} to {}", previous.phase(), next.phase());
            }
        }
    }

    private void unsubscribe(int token) {
        LOG.debug("Unsubscribing live query with token {}", token);
        try {
            engine.activateOnCurrentThread();
            engine.unsubscribe(token);
        } catch (RuntimeException e) {
            LOG.warn("Failed to unsubscribe live query with token {}", token, e);
        }
    }

    private State complete() {
        signalComplete();
        return completed;
    }

    private State fail(Throwable error) {
        signalError(error);
        return failed;
    }

    private abstract class State {

        abstract Phase phase();

        State onToken(int token) {
            return this;
        }

        State onEvent(int token, LiveQueryEvent<T> event) {
            return this;
        }

        State onRequest(long elements) {
            return this;
        }

        State onCancel() {
            return this;
        }

        State onError(Throwable error) {
            return this;
        }

        List<LiveQueryEvent<T>> buffered() {
            return Collections.emptyList();
        }

    }

    /**
     * Every event carries the token, so the first event to arrive before the
     * subscribe call reports the token moves the machine to ACTIVE with that
     * event buffered rather than delivered.
     */
    private final class AwaitingToken extends State {

        private final OverflowBuffer<LiveQueryEvent<T>> buffer;

        AwaitingToken(OverflowBuffer<LiveQueryEvent<T>> buffer) {
            this.buffer = buffer;
        }

        @Override
        Phase phase() {
            return Phase.AWAITING_TOKEN;
        }

        @Override
        State onToken(int token) {
            return new Active(buffer, token);
        }

        @Override
        State onEvent(int token, LiveQueryEvent<T> event) {
            return new Active(buffer, token).enqueue(event);
        }

        @Override
        State onRequest(long elements) {
            addDemand(elements);
            return this;
        }

        @Override
        State onCancel() {
            // no token to unsubscribe with yet
            metrics.recordCancelled();
            return new Cancelled();
        }

        @Override
        State onError(Throwable error) {
            buffer.clear();
            return fail(error);
        }

        @Override
        List<LiveQueryEvent<T>> buffered() {
            return buffer.snapshot();
        }

    }

    private final class Active extends State {

        private final OverflowBuffer<LiveQueryEvent<T>> buffer;
        private final int token;

        Active(OverflowBuffer<LiveQueryEvent<T>> buffer, int token) {
            this.buffer = buffer;
            this.token = token;
        }

        @Override
        Phase phase() {
            return Phase.ACTIVE;
        }

        @Override
        State onToken(int token) {
            if (token != this.token) {
                LOG.warn("Ignoring token {} for live query already registered with token {}", token, this.token);
            }
            return this;
        }

        @Override
        State onEvent(int token, LiveQueryEvent<T> event) {
            State next = drain();
            if (next != this) {
                return next;
            }
            if (hasDemand()) {
                RuntimeException failure = emit(event);
                return failure == null ? this : abandon(failure);
            }
            return enqueue(event);
        }

        @Override
        State onRequest(long elements) {
            addDemand(elements);
            return drain();
        }

        @Override
        State onCancel() {
            buffer.clear();
            metrics.recordCancelled();
            unsubscribe(token);
            return complete();
        }

        @Override
        State onError(Throwable error) {
            buffer.clear();
            return fail(error);
        }

        @Override
        List<LiveQueryEvent<T>> buffered() {
            return buffer.snapshot();
        }

        State enqueue(LiveQueryEvent<T> event) {
            if (buffer.offer(event) == OverflowBuffer.Outcome.OVERFLOWED) {
                LOG.warn("Live query buffer of size {} overflowed", buffer.capacity());
                return abandon(new BufferOverflowException(buffer.capacity()));
            }
            return this;
        }

        private State drain() {
            while (hasDemand() && !buffer.isEmpty()) {
                RuntimeException failure = emit(buffer.poll());
                if (failure != null) {
                    return abandon(failure);
                }
            }
            return this;
        }

        /**
         * Terminates a healthy live subscription because of a local failure.
         */
        private State abandon(Throwable error) {
            buffer.clear();
            unsubscribe(token);
            return fail(error);
        }

    }

    private final class Cancelled extends State {

        @Override
        Phase phase() {
            return Phase.CANCELLED;
        }

        @Override
        State onToken(int token) {
            unsubscribe(token);
            return complete();
        }

        @Override
        State onEvent(int token, LiveQueryEvent<T> event) {
            unsubscribe(token);
            return complete();
        }

    }

    private final class Terminated extends State {

        private final Phase phase;

        Terminated(Phase phase) {
            this.phase = phase;
        }

        @Override
        Phase phase() {
            return phase;
        }

    }

}
