package com.jwsphere.querystream;

import java.util.Objects;

/**
 * A change to a record matched by a live query.
 */
public final class LiveQueryEvent<T> {

    public enum Operation {
        CREATED,
        UPDATED,
        DELETED
    }

    private final Operation operation;
    private final T record;

    private LiveQueryEvent(Operation operation, T record) {
        this.operation = Objects.requireNonNull(operation);
        this.record = Objects.requireNonNull(record);
    }

    public static <T> LiveQueryEvent<T> of(Operation operation, T record) {
        return new LiveQueryEvent<>(operation, record);
    }

    public static <T> LiveQueryEvent<T> created(T record) {
        return of(Operation.CREATED, record);
    }

    public static <T> LiveQueryEvent<T> updated(T record) {
        return of(Operation.UPDATED, record);
    }

    public static <T> LiveQueryEvent<T> deleted(T record) {
        return of(Operation.DELETED, record);
    }

    public Operation getOperation() {
        return operation;
    }

    public T getRecord() {
        return record;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LiveQueryEvent<?> that = (LiveQueryEvent<?>) o;
        return operation == that.operation && record.equals(that.record);
    }

    @Override
    public int hashCode() {
        return 31 * operation.hashCode() + record.hashCode();
    }

    @Override
    public String toString() {
        return "LiveQueryEvent{" +
                "operation=" + operation +
                ", record=" + record +
                '}';
    }

}
