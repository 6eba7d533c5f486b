package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.ResultListener;

/**
 * The listener handed to the query engine for a one-shot query, together
 * with the controls the stream uses to pace and stop the producing thread.
 */
public interface FetchListener<T> extends ResultListener<T> {

    /**
     * Reports that the query failed.  The producing thread, if held, is released.
     */
    void onError(Throwable error);

    /**
     * Called once for every result the subscriber has accepted.
     */
    void release();

    /**
     * Stops accepting results and releases a held producing thread.  Idempotent
     * and callable from any thread.
     */
    void finish();

}
