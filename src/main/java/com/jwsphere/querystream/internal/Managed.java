package com.jwsphere.querystream.internal;

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * This class contains utilities to support managed blocking of threads
 * belonging to ForkJoinPool's.
 *
 * One-shot queries run on the connector's executor, which defaults to the
 * common pool, and their threads block while waiting for results to be
 * accepted.  Waiting in the context of a managed block informs the pool that
 * it may need to create additional threads if all are currently blocked.
 * Outside of a ForkJoinPool the wait is performed directly.
 */
public class Managed {

    private Managed() {
        // hiding implicit default constructor
    }

    /**
     * Acquires a single permit, waiting up to the given timeout.
     *
     * @return whether the permit was acquired
     */
    public static boolean tryAcquire(Semaphore permits, long timeout, TimeUnit unit) throws InterruptedException {
        if (permits.tryAcquire()) {
            return true;
        }
        PermitBlocker blocker = new PermitBlocker(permits, unit.toNanos(timeout));
        ForkJoinPool.managedBlock(blocker);
        return blocker.acquired;
    }

    private static final class PermitBlocker implements ForkJoinPool.ManagedBlocker {

        private final Semaphore permits;
        private final long timeoutNanos;

        private volatile boolean acquired;
        private volatile boolean done;

        PermitBlocker(Semaphore permits, long timeoutNanos) {
            this.permits = permits;
            this.timeoutNanos = timeoutNanos;
        }

        @Override
        public boolean block() throws InterruptedException {
            acquired = permits.tryAcquire(timeoutNanos, TimeUnit.NANOSECONDS);
            done = true;
            return true;
        }

        @Override
        public boolean isReleasable() {
            if (done) {
                return true;
            }
            if (permits.tryAcquire()) {
                acquired = true;
                done = true;
            }
            return done;
        }

    }

}
