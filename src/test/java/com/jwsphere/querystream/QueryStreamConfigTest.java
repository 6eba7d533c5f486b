package com.jwsphere.querystream;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class QueryStreamConfigTest {

    @Test
    public void testDefaults() {
        QueryStreamConfig config = QueryStreamConfig.create();
        assertEquals(QueryStreamConfig.DEFAULT_BUFFER_SIZE, config.getBufferSize());
        assertEquals(OverflowStrategy.DROP_HEAD, config.getOverflowStrategy());
        assertEquals(3, config.getGateTimeout(TimeUnit.SECONDS));
        assertFalse(config.getMeterRegistry().isPresent());
    }

    @Test
    public void testCopiesOnModification() {
        QueryStreamConfig defaults = QueryStreamConfig.create();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        QueryStreamConfig config = defaults
                .withBufferSize(16)
                .withOverflowStrategy(OverflowStrategy.FAIL)
                .withGateTimeout(250, TimeUnit.MILLISECONDS)
                .withMeterRegistry(registry);

        assertEquals(16, config.getBufferSize());
        assertEquals(OverflowStrategy.FAIL, config.getOverflowStrategy());
        assertEquals(250, config.getGateTimeout(TimeUnit.MILLISECONDS));
        assertSame(registry, config.getMeterRegistry().get());

        assertEquals(QueryStreamConfig.DEFAULT_BUFFER_SIZE, defaults.getBufferSize());
        assertEquals(OverflowStrategy.DROP_HEAD, defaults.getOverflowStrategy());
    }

    @Test
    public void testRejectsInvalidValues() {
        QueryStreamConfig config = QueryStreamConfig.create();
        assertThrows(IllegalArgumentException.class, () -> config.withBufferSize(0));
        assertThrows(IllegalArgumentException.class, () -> config.withGateTimeout(0, TimeUnit.SECONDS));
        assertThrows(NullPointerException.class, () -> config.withOverflowStrategy(null));
    }

}
