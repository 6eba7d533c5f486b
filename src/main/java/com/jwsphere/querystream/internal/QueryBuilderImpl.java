package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.LiveQueryEvent;
import com.jwsphere.querystream.QueryBuilder;
import com.jwsphere.querystream.QueryEngine;
import com.jwsphere.querystream.QueryPublisher;
import com.jwsphere.querystream.QueryRequest;
import com.jwsphere.querystream.QueryStreamConfig;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.Executor;

public class QueryBuilderImpl<T> implements QueryBuilder<T> {

    private final QueryEngine<T> engine;
    private final MeterRegistry defaultRegistry;

    private QueryRequest request;
    private QueryStreamConfig config = QueryStreamConfig.create();
    private Executor executor;

    public QueryBuilderImpl(QueryEngine<T> engine, String query, Executor executor, MeterRegistry defaultRegistry) {
        this.engine = engine;
        this.request = QueryRequest.of(query);
        this.executor = executor;
        this.defaultRegistry = defaultRegistry;
    }

    @Override
    public QueryBuilder<T> limit(int limit) {
        request = request.withLimit(limit);
        return this;
    }

    @Override
    public QueryBuilder<T> fetchPlan(String fetchPlan) {
        request = request.withFetchPlan(fetchPlan);
        return this;
    }

    @Override
    public QueryBuilder<T> arguments(Object... arguments) {
        request = request.withArguments(Arrays.asList(arguments));
        return this;
    }

    @Override
    public QueryBuilder<T> config(QueryStreamConfig config) {
        this.config = Objects.requireNonNull(config, "Config must be non-null.");
        return this;
    }

    @Override
    public QueryBuilder<T> executor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "Executor must be non-null.");
        return this;
    }

    @Override
    public QueryPublisher<T> build() {
        return new FetchQueryPublisher<>(engine, request, config, executor, metrics(QueryStreamMetrics.FETCH), true);
    }

    @Override
    public QueryPublisher<T> buildBuffered() {
        return new FetchQueryPublisher<>(engine, request, config, executor, metrics(QueryStreamMetrics.BUFFERED), false);
    }

    @Override
    public QueryPublisher<LiveQueryEvent<T>> buildLive() {
        return new LiveQueryPublisher<>(engine, request, config, executor, metrics(QueryStreamMetrics.LIVE));
    }

    private QueryStreamMetrics metrics(String queryType) {
        return QueryStreamMetrics.register(config.getMeterRegistry().orElse(defaultRegistry), queryType);
    }

}
