package com.jwsphere.querystream;

/**
 * Receives the results of a query stream.  At most one of {@code onError}
 * or {@code onComplete} is called, after which no further calls are made.
 *
 * @param <T> the type of item delivered by the stream
 */
public interface QuerySubscriber<T> /* extends Flow.Subscriber<T> */ {

    default void onSubscribe(QuerySubscription subscription) {
        // simple case, no flow control
        subscription.request(Long.MAX_VALUE);
    }

    /**
     * Called with the next result of the query.  Never called more times
     * than have been requested through the subscription.
     */
    default void onNext(T item) {
    }

    /**
     * Called upon exceptional termination of the stream.  After {@code onError}
     * is called, there will be no more calls to {@code onNext}.
     */
    default void onError(Throwable throwable) {
    }

    /**
     * Called upon completion or cancellation of the stream.  Indicates that no more
     * calls will be made to {@link QuerySubscriber#onNext(Object)}.
     */
    default void onComplete() {
    }

}
