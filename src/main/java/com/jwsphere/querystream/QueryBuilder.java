package com.jwsphere.querystream;

import java.util.concurrent.Executor;

public interface QueryBuilder<T> {

    /**
     * Bounds the number of results of a one-shot query.
     */
    QueryBuilder<T> limit(int limit);

    QueryBuilder<T> fetchPlan(String fetchPlan);

    /**
     * Positional arguments bound to the query.  Arguments must be non-null.
     */
    QueryBuilder<T> arguments(Object... arguments);

    QueryBuilder<T> config(QueryStreamConfig config);

    /**
     * The executor used to issue the query.  One-shot queries hold an executor
     * thread while the subscriber catches up.
     */
    QueryBuilder<T> executor(Executor executor);

    /**
     * Builds a one-shot query whose executing thread is paced to the subscriber,
     * waiting up to the configured gate timeout for each result to be accepted.
     */
    QueryPublisher<T> build();

    /**
     * Builds a one-shot query whose executing thread is never held back.  Results
     * the subscriber has not asked for are buffered under the configured overflow
     * strategy.
     */
    QueryPublisher<T> buildBuffered();

    /**
     * Builds a live query delivering every change matching the query until
     * the subscriber cancels.
     */
    QueryPublisher<LiveQueryEvent<T>> buildLive();

}
