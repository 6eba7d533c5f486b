package com.jwsphere.querystream;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Exposes a query publisher as a blocking iterator.  The underlying
 * subscription requests a single item at a time and only after the
 * previous item has been handed to the caller, so the stream never
 * runs ahead of iteration.
 *
 * Closing the iterator cancels the subscription.
 */
public class BlockingQueryIterator<T> implements Iterator<T>, AutoCloseable {

    private static final Object DONE = new Object();

    private final BlockingSubscriber<T> subscriber;

    private Object next;
    private boolean outstanding;
    private boolean finished;

    private BlockingQueryIterator(BlockingSubscriber<T> subscriber) {
        this.subscriber = subscriber;
    }

    public static <T> BlockingQueryIterator<T> open(QueryPublisher<T> publisher) {
        Objects.requireNonNull(publisher);
        BlockingSubscriber<T> subscriber = new BlockingSubscriber<>();
        publisher.subscribe(subscriber);
        return new BlockingQueryIterator<>(subscriber);
    }

    /**
     * @throws QueryStreamException if the stream terminated with an error
     *         or the calling thread was interrupted while waiting.
     */
    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        if (!outstanding) {
            subscriber.subscription().request(1);
            outstanding = true;
        }
        Object signal;
        try {
            signal = subscriber.queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryStreamException("Interrupted while waiting for the next result.", e);
        }
        outstanding = false;
        if (signal == DONE) {
            finished = true;
            return false;
        }
        if (signal instanceof Failure) {
            finished = true;
            throw new QueryStreamException(((Failure) signal).cause);
        }
        next = signal;
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T item = (T) next;
        next = null;
        return item;
    }

    @Override
    public void close() {
        subscriber.subscription().cancel();
    }

    private static final class Failure {

        private final Throwable cause;

        Failure(Throwable cause) {
            this.cause = cause;
        }

    }

    /**
     * Hands signals to the iterating thread.  The queue is unbounded since at
     * most one item is ever outstanding, and a bounded hand-off would block
     * whichever thread is delivering signals, which can be the iterating thread.
     */
    private static final class BlockingSubscriber<T> implements QuerySubscriber<T> {

        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();

        private volatile QuerySubscription subscription;

        QuerySubscription subscription() {
            if (subscription == null) {
                throw new IllegalStateException("Subscriber must be initialized");
            }
            return subscription;
        }

        @Override
        public void onSubscribe(QuerySubscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void onNext(T item) {
            queue.add(item);
        }

        @Override
        public void onError(Throwable throwable) {
            queue.add(new Failure(throwable));
        }

        @Override
        public void onComplete() {
            queue.add(DONE);
        }

    }

}
