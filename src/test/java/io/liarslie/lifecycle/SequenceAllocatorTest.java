package io.liarslie.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceAllocatorTest {
    @Test
    void sequencesShouldStartAtConfiguredValuesAndMoveForward() {
        SequenceAllocator sequence = new SequenceAllocator(1, 5000);

        assertEquals(1, sequence.nextAgentId());
        assertEquals(2, sequence.nextAgentId());
        assertEquals(5000, sequence.nextPort());
        assertEquals(5001, sequence.nextPort());
    }

    @Test
    void concurrentAllocationShouldNeverRepeatAnId() throws Exception {
        SequenceAllocator sequence = new SequenceAllocator(1, 5000);
        Set<Integer> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 1000; i++) {
                pool.execute(() -> ids.add(sequence.nextAgentId()));
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(1000, ids.size());
    }

    @Test
    void portRangeShouldBeBounded() {
        SequenceAllocator sequence = new SequenceAllocator(1, 65535);

        assertEquals(65535, sequence.nextPort());
        assertThrows(IllegalStateException.class, sequence::nextPort);
        assertThrows(IllegalArgumentException.class, () -> new SequenceAllocator(0, 5000));
        assertThrows(IllegalArgumentException.class, () -> new SequenceAllocator(1, 70000));
    }
}
