package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.LiveQueryEvent;
import com.jwsphere.querystream.QueryEngine;
import com.jwsphere.querystream.QueryPublisher;
import com.jwsphere.querystream.QueryRequest;
import com.jwsphere.querystream.QueryStreamConfig;
import com.jwsphere.querystream.QuerySubscriber;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.jwsphere.querystream.internal.MoreCompletableFutures.unwrap;

/**
 * Registers a new live query for every subscriber.  Registration is issued
 * from the executor so that subscribing never waits on the database.
 */
public class LiveQueryPublisher<T> implements QueryPublisher<LiveQueryEvent<T>> {

    private final QueryEngine<T> engine;
    private final QueryRequest request;
    private final QueryStreamConfig config;
    private final Executor executor;
    private final QueryStreamMetrics metrics;

    public LiveQueryPublisher(QueryEngine<T> engine, QueryRequest request, QueryStreamConfig config,
                              Executor executor, QueryStreamMetrics metrics) {
        this.engine = engine;
        this.request = request;
        this.config = config;
        this.executor = executor;
        this.metrics = metrics;
    }

    @Override
    public void subscribe(QuerySubscriber<? super LiveQueryEvent<T>> subscriber) {
        Objects.requireNonNull(subscriber, "Subscriber must be non-null.");
        LiveQueryStateMachine<T> machine = new LiveQueryStateMachine<>(subscriber, engine, config, metrics);
        machine.start();
        try {
            executor.execute(() -> register(machine));
        } catch (RejectedExecutionException e) {
            machine.onError(e);
        }
    }

    private void register(LiveQueryStateMachine<T> machine) {
        CompletionStage<Integer> token;
        try {
            engine.activateOnCurrentThread();
            token = engine.subscribe(request, machine);
        } catch (RuntimeException e) {
            machine.onError(e);
            return;
        }
        token.whenComplete((registered, error) -> {
            if (error != null) {
                machine.onError(unwrap(error));
            } else {
                machine.onToken(registered);
            }
        });
    }

}
