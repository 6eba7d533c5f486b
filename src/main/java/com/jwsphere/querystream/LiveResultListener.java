package com.jwsphere.querystream;

/**
 * Receives change events of a live query, typically on a notification
 * thread owned by the database.  Implementations must not block.
 */
public interface LiveResultListener<T> {

    /**
     * Called with every change matching the live query.  The token of the
     * live subscription accompanies every event, so an event may reveal the
     * token before the subscribe call itself has reported it.
     */
    void onLiveResult(int token, LiveQueryEvent<T> event);

    /**
     * Called if the live subscription fails.  No more events follow.
     */
    void onError(Throwable error);

}
