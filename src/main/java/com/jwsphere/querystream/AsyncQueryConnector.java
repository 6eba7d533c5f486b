package com.jwsphere.querystream;

import com.jwsphere.querystream.internal.QueryBuilderImpl;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * A wrapper around a {@link QueryEngine} that exposes its queries and live
 * queries as demand-driven streams.
 *
 * @author Jonathan Wonders
 */
public class AsyncQueryConnector<T> {

    private final QueryEngine<T> engine;
    private final Executor executor;
    private final MeterRegistry defaultRegistry = new SimpleMeterRegistry();

    private AsyncQueryConnector(QueryEngine<T> engine, Executor executor) {
        this.engine = Objects.requireNonNull(engine);
        this.executor = Objects.requireNonNull(executor);
    }

    public QueryEngine<T> getEngine() {
        return engine;
    }

    public QueryBuilder<T> createQueryBuilder(String query) {
        return new QueryBuilderImpl<>(engine, query, executor, defaultRegistry);
    }

    public QueryBuilder<T> createQueryBuilder(String query, Executor executor) {
        return new QueryBuilderImpl<>(engine, query, executor, defaultRegistry);
    }

    /**
     * A one-shot query returning at most {@code limit} results, paced to its subscriber.
     */
    public QueryPublisher<T> query(String query, int limit) {
        return createQueryBuilder(query).limit(limit).build();
    }

    public QueryPublisher<LiveQueryEvent<T>> liveQuery(String query) {
        return createQueryBuilder(query).buildLive();
    }

    public QueryPublisher<LiveQueryEvent<T>> liveQuery(String query, QueryStreamConfig config) {
        return createQueryBuilder(query).config(config).buildLive();
    }

    public static <T> AsyncQueryConnector<T> wrap(QueryEngine<T> engine) {
        return wrap(engine, ForkJoinPool.commonPool());
    }

    public static <T> AsyncQueryConnector<T> wrap(QueryEngine<T> engine, Executor defaultExecutor) {
        return new AsyncQueryConnector<>(engine, defaultExecutor);
    }

}
