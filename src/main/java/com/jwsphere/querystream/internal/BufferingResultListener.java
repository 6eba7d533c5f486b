package com.jwsphere.querystream.internal;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forwards the results of a one-shot query without ever holding back the
 * producing thread.  Results the subscriber has not asked for are buffered
 * by the state machine under its overflow strategy.
 */
public final class BufferingResultListener<T> implements FetchListener<T> {

    private final FetchStateMachine<T> machine;
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private volatile boolean finished = false;

    BufferingResultListener(FetchStateMachine<T> machine) {
        this.machine = machine;
    }

    @Override
    public boolean onResult(T item) {
        if (finished) {
            return false;
        }
        machine.onItem(item);
        return !finished;
    }

    @Override
    public void onEnd() {
        if (ended.compareAndSet(false, true)) {
            machine.onEnd();
        }
    }

    @Override
    public void onError(Throwable error) {
        machine.onError(error);
        finish();
    }

    @Override
    public void release() {
        // nothing is held back
    }

    @Override
    public void finish() {
        finished = true;
    }

}
