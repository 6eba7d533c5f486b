package com.jwsphere.querystream;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapts query publishers to the Reactive Streams {@link Publisher} contract.
 */
public final class ReactivePublishers {

    private ReactivePublishers() {
        // hiding implicit default constructor
    }

    public static <T> Publisher<T> toPublisher(QueryPublisher<T> publisher) {
        Objects.requireNonNull(publisher);
        return subscriber -> {
            Objects.requireNonNull(subscriber, "Subscriber must be non-null.");
            publisher.subscribe(new SubscriberAdapter<>(subscriber));
        };
    }

    /**
     * Differs from a query subscriber in two ways: a cancelled subscriber
     * receives no terminal signal, and a non-positive request cancels the
     * stream and signals an {@link IllegalArgumentException} rather than
     * throwing.
     */
    private static final class SubscriberAdapter<T> implements QuerySubscriber<T> {

        private final Subscriber<? super T> subscriber;
        private final AtomicBoolean done = new AtomicBoolean(false);

        SubscriberAdapter(Subscriber<? super T> subscriber) {
            this.subscriber = subscriber;
        }

        @Override
        public void onSubscribe(QuerySubscription subscription) {
            subscriber.onSubscribe(new Subscription() {
                @Override
                public void request(long n) {
                    if (n <= 0) {
                        // claimed before cancelling, since cancellation completes the query stream
                        if (done.compareAndSet(false, true)) {
                            subscription.cancel();
                            subscriber.onError(new IllegalArgumentException(
                                    "Number of requested elements must be strictly positive, was " + n));
                        }
                        return;
                    }
                    subscription.request(n);
                }

                @Override
                public void cancel() {
                    done.set(true);
                    subscription.cancel();
                }
            });
        }

        @Override
        public void onNext(T item) {
            if (!done.get()) {
                subscriber.onNext(item);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            if (done.compareAndSet(false, true)) {
                subscriber.onError(throwable);
            }
        }

        @Override
        public void onComplete() {
            if (done.compareAndSet(false, true)) {
                subscriber.onComplete();
            }
        }

    }

}
