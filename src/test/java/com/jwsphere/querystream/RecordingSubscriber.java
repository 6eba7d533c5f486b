package com.jwsphere.querystream;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Records every signal it receives.  Requests nothing on subscription
 * unless an initial request is given.
 */
public class RecordingSubscriber<T> implements QuerySubscriber<T> {

    private final long initialRequest;

    private final List<T> items = new CopyOnWriteArrayList<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private final AtomicInteger completions = new AtomicInteger();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile QuerySubscription subscription;

    public RecordingSubscriber() {
        this(0);
    }

    public RecordingSubscriber(long initialRequest) {
        this.initialRequest = initialRequest;
    }

    @Override
    public void onSubscribe(QuerySubscription subscription) {
        this.subscription = subscription;
        if (initialRequest > 0) {
            subscription.request(initialRequest);
        }
    }

    @Override
    public void onNext(T item) {
        items.add(item);
    }

    @Override
    public void onError(Throwable throwable) {
        errors.add(throwable);
        terminated.countDown();
    }

    @Override
    public void onComplete() {
        completions.incrementAndGet();
        terminated.countDown();
    }

    public QuerySubscription getSubscription() {
        return subscription;
    }

    public void request(long elements) {
        subscription.request(elements);
    }

    public void cancel() {
        subscription.cancel();
    }

    public List<T> getItems() {
        return items;
    }

    public List<Throwable> getErrors() {
        return errors;
    }

    public int getCompletions() {
        return completions.get();
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    public void awaitTerminated() throws InterruptedException {
        assertTrue(terminated.await(5, TimeUnit.SECONDS), "Stream did not terminate");
    }

    public void awaitItems(int count) throws InterruptedException {
        await(() -> items.size() >= count);
    }

    public static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5 seconds");
            }
            Thread.sleep(5);
        }
    }

}
