package com.jwsphere.querystream;

/**
 * Receives the results of a one-shot query on the thread executing it.
 */
public interface ResultListener<T> {

    /**
     * Called once per result, in result order.
     *
     * @return whether the query engine should keep fetching results
     */
    boolean onResult(T item);

    /**
     * Called once after the last result has been delivered.
     */
    void onEnd();

}
