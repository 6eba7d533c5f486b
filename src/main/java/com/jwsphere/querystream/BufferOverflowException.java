package com.jwsphere.querystream;

/**
 * Indicates that an item arrived while the buffer of a stream configured
 * with {@link OverflowStrategy#FAIL} was full and no demand was outstanding.
 *
 * @author Jonathan Wonders
 */
public class BufferOverflowException extends RuntimeException {

    private final int capacity;

    public BufferOverflowException(int capacity) {
        super("Buffer of size " + capacity + " has overflowed");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

}
