package com.jwsphere.querystream;

import java.util.concurrent.CompletionStage;

/**
 * The database side of a query stream.  A query engine executes queries
 * and pushes their results to listeners; the streams built on top of it
 * turn those pushes into demand-driven delivery.
 *
 * The connection behind an engine is assumed to be unsafe for implicit
 * sharing between threads.  Before issuing any command from one of its own
 * threads, the stream calls {@link #activateOnCurrentThread()} to hand the
 * connection over explicitly.
 *
 * @author Jonathan Wonders
 */
public interface QueryEngine<T> {

    /**
     * Registers a live query.  The returned stage completes with the token
     * identifying the live subscription once the database has registered it,
     * or exceptionally if the query could not be registered.
     */
    CompletionStage<Integer> subscribe(QueryRequest request, LiveResultListener<T> listener);

    /**
     * Requests that the live subscription with the given token stops
     * delivering events.  Best effort; any outcome is ignored.
     */
    void unsubscribe(int token);

    /**
     * Executes a one-shot query, calling the listener on the executing thread
     * for each result until the results are exhausted, the limit is reached or
     * the listener asks to stop.  The returned stage completes once execution
     * has finished.
     */
    CompletionStage<Void> fetch(QueryRequest request, ResultListener<T> listener);

    /**
     * Makes the underlying connection usable from the calling thread.
     */
    default void activateOnCurrentThread() {
    }

}
