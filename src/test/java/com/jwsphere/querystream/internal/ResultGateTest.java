package com.jwsphere.querystream.internal;

import com.jwsphere.querystream.GateTimeoutException;
import com.jwsphere.querystream.QueryStreamConfig;
import com.jwsphere.querystream.RecordingSubscriber;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.log4j.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.*;

public class ResultGateTest {

    private static final Logger LOG = Logger.getLogger(ResultGateTest.class);

    private ExecutorService producer;
    private SimpleMeterRegistry registry;

    @BeforeEach
    public void setUp() {
        producer = Executors.newSingleThreadExecutor();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    public void tearDown() {
        producer.shutdownNow();
    }

    private FetchStateMachine<String> gated(RecordingSubscriber<String> subscriber, long timeoutMillis) {
        QueryStreamConfig config = QueryStreamConfig.create().withGateTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
        FetchStateMachine<String> machine = FetchStateMachine.gated(subscriber, config,
                QueryStreamMetrics.register(registry, QueryStreamMetrics.FETCH));
        machine.start();
        return machine;
    }

    @Test
    public void testProducerWaitsUntilResultIsAccepted() throws Exception {
        RecordingSubscriber<String> subscriber = new RecordingSubscriber<>();
        FetchStateMachine<String> machine = gated(subscriber, 10_000);
        ResultGate<String> gate = (ResultGate<String>) machine.listener();

        CompletableFuture<Boolean> first = CompletableFuture.supplyAsync(() -> gate.onResult("a"), producer);
        RecordingSubscriber.await(() -> machine.bufferedItems().size() == 1);

        Thread.sleep(50);
        assertFalse(first.isDone());
        assertEquals(singletonList("a"), machine.bufferedItems());

        subscriber.request(1);
        assertTrue(first.get(5, TimeUnit.SECONDS));
        assertEquals(singletonList("a"), subscriber.getItems());
        assertTrue(machine.bufferedItems().isEmpty());
    }

    @Test
    public void testAcceptedResultDoesNotHoldProducer() {
        RecordingSubscriber<String> subscriber = new RecordingSubscriber<>(2);
        FetchStateMachine<String> machine = gated(subscriber, 10_000);
        FetchListener<String> gate = machine.listener();

        assertTrue(gate.onResult("a"));
        assertTrue(gate.onResult("b"));
        gate.onEnd();

        assertEquals(Arrays.asList("a", "b"), subscriber.getItems());
        assertEquals(1, subscriber.getCompletions());
        assertEquals(FetchStateMachine.Phase.COMPLETED, machine.getPhase());
    }

    @Test
    public void testCancelReleasesWaitingProducer() throws Exception {
        RecordingSubscriber<String> subscriber = new RecordingSubscriber<>();
        FetchStateMachine<String> machine = gated(subscriber, 10_000);
        ResultGate<String> gate = (ResultGate<String>) machine.listener();

        CompletableFuture<Boolean> first = CompletableFuture.supplyAsync(() -> gate.onResult("a"), producer);
        RecordingSubscriber.await(() -> machine.bufferedItems().size() == 1);

        subscriber.cancel();

        assertFalse(first.get(5, TimeUnit.SECONDS));
        assertTrue(gate.isFinished());
        assertFalse(gate.onResult("b"));
        assertTrue(subscriber.getItems().isEmpty());
        assertEquals(1, subscriber.getCompletions());
    }

    @Test
    public void testTimeoutFailsStream() throws Exception {
        RecordingSubscriber<String> subscriber = new RecordingSubscriber<>();
        FetchStateMachine<String> machine = gated(subscriber, 50);
        ResultGate<String> gate = (ResultGate<String>) machine.listener();

        assertFalse(CompletableFuture.supplyAsync(() -> gate.onResult("a"), producer).get(5, TimeUnit.SECONDS));

        subscriber.awaitTerminated();
        assertEquals(1, subscriber.getErrors().size());
        GateTimeoutException error = (GateTimeoutException) subscriber.getErrors().get(0);
        LOG.info("Gate timed out: " + error.getMessage());
        assertEquals(50, error.getTimeout(TimeUnit.MILLISECONDS));
        assertEquals(FetchStateMachine.Phase.FAILED, machine.getPhase());
        assertTrue(subscriber.getItems().isEmpty());
        assertEquals(1, registry.get("ax.query.gate.wait").timer().count());
    }

    @Test
    public void testEndIsForwardedOnce() {
        RecordingSubscriber<String> subscriber = new RecordingSubscriber<>(1);
        FetchStateMachine<String> machine = gated(subscriber, 10_000);
        FetchListener<String> gate = machine.listener();

        gate.onEnd();
        gate.onEnd();
        gate.onError(new IllegalStateException("late"));

        assertEquals(1, subscriber.getCompletions());
        assertTrue(subscriber.getErrors().isEmpty());
    }

    @Test
    public void testEarlyReleasesAccumulate() {
        RecordingSubscriber<String> subscriber = new RecordingSubscriber<>();
        FetchStateMachine<String> machine = gated(subscriber, 10_000);
        ResultGate<String> gate = (ResultGate<String>) machine.listener();

        gate.release();
        gate.release();
        assertEquals(2, gate.availablePermits());

        // neither result is accepted yet, but the producer is not held back
        assertTrue(gate.onResult("a"));
        assertEquals(1, gate.availablePermits());
        assertEquals(singletonList("a"), machine.bufferedItems());
    }

}
