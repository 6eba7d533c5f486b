package com.jwsphere.querystream;

/**
 * Strategies to deal with an item that arrives while the buffer of a
 * stream is full and the subscriber has no outstanding demand.
 */
public enum OverflowStrategy {

    /**
     * Remove the oldest buffered item and append the new one.
     */
    DROP_HEAD,

    /**
     * Replace the newest buffered item with the new one.
     */
    DROP_TAIL,

    /**
     * Discard every buffered item so the buffer contains only the new one.
     */
    DROP_BUFFER,

    /**
     * Discard the new item, leaving the buffer unchanged.
     */
    DROP_NEW,

    /**
     * Terminate the stream with a {@link BufferOverflowException}, discarding the buffer.
     */
    FAIL

}
