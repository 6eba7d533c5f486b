package com.jwsphere.querystream;

/**
 * Rethrows the terminal error of a stream to a caller that consumes the
 * stream by blocking.
 */
public class QueryStreamException extends RuntimeException {

    public QueryStreamException(Throwable cause) {
        super(cause);
    }

    public QueryStreamException(String message, Throwable cause) {
        super(message, cause);
    }

}
