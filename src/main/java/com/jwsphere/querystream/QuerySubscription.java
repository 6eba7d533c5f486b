package com.jwsphere.querystream;

public interface QuerySubscription /* extends Flow.Subscription */ {

    /**
     * <p>
     * Permits the stream to call {@link QuerySubscriber#onNext(Object)}
     * up to {@code elements} additional times.  Requests are additive and the
     * outstanding demand saturates at {@code Long.MAX_VALUE}.  This method may
     * be called from any thread, including from within a call to
     * {@link QuerySubscriber#onNext(Object)}.
     * </p>
     *
     * <p>
     * Items produced while there is no outstanding demand are buffered or dropped
     * according to the stream's {@link OverflowStrategy}, or, for one-shot queries,
     * hold back the thread producing them.
     * </p>
     *
     * @throws IllegalArgumentException if {@code elements} is not strictly positive.
     *         The stream itself is unaffected.
     */
    void request(long elements);

    /**
     * Requests cancellation of the stream.  May be called safely from any thread,
     * any number of times, including after the stream has terminated.
     *
     * Once cancellation has been accepted no more items are delivered and the
     * subscriber is completed normally.  A live query is unsubscribed as soon as
     * its token is known, which may be after this call returns.
     */
    void cancel();

}
