package com.jwsphere.querystream;

import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;

import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.*;

public class CollectingQuerySubscriberTest {

    private final AsyncQueryConnector<String> connector =
            AsyncQueryConnector.wrap(InMemoryQueryEngine.of("pear", "apple", "fig"), MoreExecutors.directExecutor());

    @Test
    public void testToCollection() throws Exception {
        CollectingQuerySubscriber<String, TreeSet<String>> subscriber =
                CollectingQuerySubscriber.toCollection(TreeSet::new);
        connector.query("select from Fruit", 10).subscribe(subscriber);

        assertEquals("[apple, fig, pear]", subscriber.get().toString());
    }

    @Test
    public void testToMap() throws Exception {
        CollectingQuerySubscriber<String, Map<Integer, String>> subscriber =
                CollectingQuerySubscriber.toMap(String::length, s -> s);
        connector.query("select from Fruit", 2).subscribe(subscriber);

        Map<Integer, String> byLength = subscriber.get();
        assertEquals(2, byLength.size());
        assertEquals("apple", byLength.get(5));
    }

    @Test
    public void testToMapRejectsDuplicateKeys() {
        AsyncQueryConnector<String> duplicates =
                AsyncQueryConnector.wrap(InMemoryQueryEngine.of("ab", "cd"), MoreExecutors.directExecutor());
        CollectingQuerySubscriber<String, Map<Integer, String>> subscriber =
                CollectingQuerySubscriber.toMap(String::length, s -> s);
        duplicates.query("select from Fruit", 10).subscribe(subscriber);

        ExecutionException e = assertThrows(ExecutionException.class, subscriber::get);
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    public void testToMapWithMerge() throws Exception {
        AsyncQueryConnector<String> duplicates =
                AsyncQueryConnector.wrap(InMemoryQueryEngine.of("ab", "cd"), MoreExecutors.directExecutor());
        CollectingQuerySubscriber<String, Map<Integer, String>> subscriber =
                CollectingQuerySubscriber.toMap(String::length, s -> s, (left, right) -> left + right);
        duplicates.query("select from Fruit", 10).subscribe(subscriber);

        assertEquals("abcd", subscriber.get().get(2));
    }

    @Test
    public void testCancellingFutureCancelsLiveQuery() {
        InMemoryQueryEngine<String> engine = InMemoryQueryEngine.of();
        AsyncQueryConnector<String> live = AsyncQueryConnector.wrap(engine, MoreExecutors.directExecutor());
        CollectingQuerySubscriber<LiveQueryEvent<String>, List<LiveQueryEvent<String>>> subscriber =
                CollectingQuerySubscriber.toList();

        live.liveQuery("live select from Fruit").subscribe(subscriber);
        engine.registerLiveQuery(3);
        engine.push(3, LiveQueryEvent.created("kiwi"));
        assertFalse(subscriber.isDone());

        assertTrue(subscriber.cancel(true));

        assertTrue(subscriber.isCancelled());
        assertEquals(singletonList(3), engine.getUnsubscribed());
    }

    @Test
    public void testFutureCancelledBeforeSubscribing() {
        InMemoryQueryEngine<String> engine = InMemoryQueryEngine.of();
        AsyncQueryConnector<String> live = AsyncQueryConnector.wrap(engine, MoreExecutors.directExecutor());
        CollectingQuerySubscriber<LiveQueryEvent<String>, List<LiveQueryEvent<String>>> subscriber =
                CollectingQuerySubscriber.toList();

        subscriber.cancel(false);
        live.liveQuery("live select from Fruit").subscribe(subscriber);
        engine.registerLiveQuery(8);
        engine.push(8, LiveQueryEvent.created("kiwi"));

        assertTrue(subscriber.isCancelled());
        assertEquals(singletonList(8), engine.getUnsubscribed());
    }

}
