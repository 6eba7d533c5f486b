package com.jwsphere.querystream.internal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class MoreCompletableFutures {

    private MoreCompletableFutures() {
        // hiding implicit default constructor
    }

    /**
     * Strips the wrappers added by completion stages so subscribers see
     * the failure reported by the query engine.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static <T> CompletableFuture<T> immediatelyFailed(Throwable t) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(t);
        return future;
    }

}
