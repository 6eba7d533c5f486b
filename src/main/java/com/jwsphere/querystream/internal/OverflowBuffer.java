package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.OverflowStrategy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongConsumer;

/**
 * A bounded FIFO buffer of undelivered items that applies an
 * {@link OverflowStrategy} when an item is offered while it is full.
 * Not thread safe; owned by a single state machine.
 */
public final class OverflowBuffer<T> {

    public enum Outcome {
        /** The item was appended without dropping anything. */
        BUFFERED,
        /** The buffer was full and the strategy dropped one or more items. */
        DROPPED,
        /** The buffer was full under {@link OverflowStrategy#FAIL}; the buffer was cleared. */
        OVERFLOWED
    }

    private final ArrayDeque<T> items;
    private final int capacity;
    private final OverflowStrategy strategy;
    private final LongConsumer dropListener;

    public OverflowBuffer(int capacity, OverflowStrategy strategy, LongConsumer dropListener) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be strictly positive.");
        }
        this.items = new ArrayDeque<>(Math.min(capacity, 64));
        this.capacity = capacity;
        this.strategy = strategy;
        this.dropListener = dropListener;
    }

    public Outcome offer(T item) {
        if (items.size() < capacity) {
            items.addLast(item);
            return Outcome.BUFFERED;
        }
        switch (strategy) {
            case DROP_HEAD:
                items.pollFirst();
                items.addLast(item);
                dropListener.accept(1);
                return Outcome.DROPPED;
            case DROP_TAIL:
                items.pollLast();
                items.addLast(item);
                dropListener.accept(1);
                return Outcome.DROPPED;
            case DROP_BUFFER:
                dropListener.accept(items.size());
                items.clear();
                items.addLast(item);
                return Outcome.DROPPED;
            case DROP_NEW:
                dropListener.accept(1);
                return Outcome.DROPPED;
            case FAIL:
                dropListener.accept(items.size() + 1L);
                items.clear();
                return Outcome.OVERFLOWED;
            default:
                throw new IllegalStateException("Unknown overflow strategy " + strategy);
        }
    }

    public T poll() {
        return items.pollFirst();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        items.clear();
    }

    public List<T> snapshot() {
        return new ArrayList<>(items);
    }

}
