package com.jwsphere.querystream.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Processes submitted events one at a time, in submission order, without
 * a dedicated thread.  The thread that submits into an idle mailbox drains
 * it, including any events submitted by other threads or by the events
 * themselves while it is draining.  An event submitted from within another
 * event therefore runs after that event has finished, never nested inside it.
 *
 * State touched only from within events needs no further synchronization;
 * the work-in-progress counter orders each drain after the previous one.
 *
 * @author Jonathan Wonders
 */
public final class SerialMailbox {

    private static final Logger LOG = LoggerFactory.getLogger(SerialMailbox.class);

    private final Queue<Runnable> events = new ConcurrentLinkedQueue<>();
    private final AtomicInteger wip = new AtomicInteger();

    /**
     * Runs the event now if the mailbox is idle, otherwise queues it behind the
     * events already submitted.  A runtime exception thrown by an event is logged
     * and draining continues.  An {@link Error} is rethrown to the draining thread
     * only after every queued event has run and the mailbox is idle again.
     */
    public void submit(Runnable event) {
        events.offer(event);
        if (wip.getAndIncrement() != 0) {
            return;
        }
        Error fatal = null;
        int missed = 1;
        while (true) {
            Runnable next;
            while ((next = events.poll()) != null) {
                try {
                    next.run();
                } catch (RuntimeException e) {
                    LOG.error("Event failed while draining mailbox", e);
                } catch (Error e) {
                    // the counter must be settled before the error leaves the drain loop
                    LOG.error("Event failed fatally while draining mailbox", e);
                    if (fatal == null) {
                        fatal = e;
                    } else if (fatal != e) {
                        fatal.addSuppressed(e);
                    }
                }
            }
            missed = wip.addAndGet(-missed);
            if (missed == 0) {
                break;
            }
        }
        if (fatal != null) {
            throw fatal;
        }
    }

}
