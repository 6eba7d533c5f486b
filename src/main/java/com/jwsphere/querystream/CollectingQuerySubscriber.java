package com.jwsphere.querystream;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;
import java.util.stream.Collectors;

/**
 * A query subscriber that is also the future of its collected results.
 * Every result is requested up front and folded into the collector as it
 * is delivered.
 *
 * <p>
 * The future completes when the stream completes.  A stream cancelled
 * through its subscription completes normally, so the future then holds
 * whatever was collected up to the cancellation.  Cancelling the future
 * itself cancels the query; for a live query, which never completes on its
 * own, that is the way to stop it and release its subscription.
 * </p>
 *
 * <p>
 * A collector that throws, such as {@link #toMap(Function, Function)} on a
 * duplicate key, terminates the stream and fails the future with that exception.
 * </p>
 *
 * @author Jonathan Wonders
 */
public class CollectingQuerySubscriber<T, R> extends CompletableFuture<R> implements QuerySubscriber<T> {

    private final Accumulation<T, ?, R> accumulation;

    private volatile QuerySubscription subscription;

    private CollectingQuerySubscriber(Collector<? super T, ?, R> collector) {
        this.accumulation = new Accumulation<>(collector);
    }

    @Override
    public void onSubscribe(QuerySubscription subscription) {
        this.subscription = subscription;
        if (isCancelled()) {
            subscription.cancel();
        } else {
            subscription.request(Long.MAX_VALUE);
        }
    }

    @Override
    public void onNext(T item) {
        accumulation.add(item);
    }

    @Override
    public void onError(Throwable t) {
        completeExceptionally(t);
    }

    @Override
    public void onComplete() {
        complete(accumulation.result());
    }

    /**
     * Cancels the future and the query feeding it.
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        QuerySubscription current = subscription;
        if (current != null) {
            current.cancel();
        }
        return cancelled;
    }

    public static <T, R> CollectingQuerySubscriber<T, R> collect(Collector<? super T, ?, R> collector) {
        return new CollectingQuerySubscriber<>(collector);
    }

    public static <T, C extends Collection<T>> CollectingQuerySubscriber<T, C> toCollection(Supplier<C> supplier) {
        return new CollectingQuerySubscriber<>(Collectors.toCollection(supplier));
    }

    public static <T> CollectingQuerySubscriber<T, List<T>> toList() {
        return toCollection(ArrayList::new);
    }

    /**
     * Collects results into a map, failing the stream on a duplicate key.
     */
    public static <T, K, V> CollectingQuerySubscriber<T, Map<K, V>> toMap(
            Function<? super T, K> toKey, Function<? super T, V> toValue) {
        return toMap(toKey, toValue, (left, right) -> {
            throw new IllegalStateException(String.format("Query returned duplicate key for values %s and %s", left, right));
        });
    }

    public static <T, K, V> CollectingQuerySubscriber<T, Map<K, V>> toMap(
            Function<? super T, K> toKey,
            Function<? super T, V> toValue,
            BinaryOperator<V> mergeStrategy) {
        return new CollectingQuerySubscriber<>(Collectors.toMap(toKey, toValue, mergeStrategy));
    }

    /**
     * Binds the collector's intermediate type.  Only touched from stream
     * signals, which are delivered one at a time.
     */
    private static final class Accumulation<T, A, R> {

        private final Collector<? super T, A, R> collector;
        private final A container;

        Accumulation(Collector<? super T, A, R> collector) {
            this.collector = collector;
            this.container = collector.supplier().get();
        }

        void add(T item) {
            collector.accumulator().accept(container, item);
        }

        R result() {
            return collector.finisher().apply(container);
        }

    }

}
