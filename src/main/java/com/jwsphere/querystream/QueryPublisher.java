package com.jwsphere.querystream;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collector;

/**
 * A query publisher behaves as an observable source of query results.
 * Every subscription issues the query anew and is served to exactly one
 * subscriber.
 *
 * @author Jonathan Wonders
 */
public interface QueryPublisher<T> /* extends Flow.Publisher<T> */ {

    void subscribe(QuerySubscriber<? super T> subscriber);

    default <R> CompletableFuture<R> collect(Collector<? super T, ?, R> collector) {
        CollectingQuerySubscriber<T, R> subscriber = CollectingQuerySubscriber.collect(collector);
        subscribe(subscriber);
        return subscriber;
    }

    default CompletableFuture<List<T>> toList() {
        CollectingQuerySubscriber<T, List<T>> subscriber = CollectingQuerySubscriber.toList();
        subscribe(subscriber);
        return subscriber;
    }

}
