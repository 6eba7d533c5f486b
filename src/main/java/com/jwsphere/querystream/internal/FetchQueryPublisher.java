package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.QueryEngine;
import com.jwsphere.querystream.QueryPublisher;
import com.jwsphere.querystream.QueryRequest;
import com.jwsphere.querystream.QueryStreamConfig;
import com.jwsphere.querystream.QuerySubscriber;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.jwsphere.querystream.internal.MoreCompletableFutures.unwrap;

/**
 * Executes a one-shot query for every subscriber.  The query runs on the
 * executor since a gated query holds its thread while the subscriber
 * catches up.
 */
public class FetchQueryPublisher<T> implements QueryPublisher<T> {

    private final QueryEngine<T> engine;
    private final QueryRequest request;
    private final QueryStreamConfig config;
    private final Executor executor;
    private final QueryStreamMetrics metrics;
    private final boolean gated;

    public FetchQueryPublisher(QueryEngine<T> engine, QueryRequest request, QueryStreamConfig config,
                               Executor executor, QueryStreamMetrics metrics, boolean gated) {
        this.engine = engine;
        this.request = request;
        this.config = config;
        this.executor = executor;
        this.metrics = metrics;
        this.gated = gated;
    }

    @Override
    public void subscribe(QuerySubscriber<? super T> subscriber) {
        Objects.requireNonNull(subscriber, "Subscriber must be non-null.");
        FetchStateMachine<T> machine = gated
                ? FetchStateMachine.gated(subscriber, config, metrics)
                : FetchStateMachine.buffered(subscriber, config, metrics);
        machine.start();
        FetchListener<T> listener = machine.listener();
        try {
            executor.execute(() -> fetch(listener));
        } catch (RejectedExecutionException e) {
            listener.onError(e);
        }
    }

    private void fetch(FetchListener<T> listener) {
        try {
            engine.activateOnCurrentThread();
            engine.fetch(request, listener).whenComplete((ignored, error) -> {
                if (error != null) {
                    listener.onError(unwrap(error));
                } else {
                    listener.onEnd();
                }
            });
        } catch (RuntimeException e) {
            listener.onError(e);
        }
    }

}
