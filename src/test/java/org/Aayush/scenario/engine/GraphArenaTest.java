package org.Aayush.scenario.engine;

import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.testutil.ScenarioFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Arena Tests")
class GraphArenaTest {

    @Test
    @DisplayName("Loader runs once and later lookups return the same instance")
    void testComputeIfAbsent() {
        GraphArena arena = new GraphArena();
        AtomicInteger loads = new AtomicInteger();

        Graph first = arena.computeIfAbsent("line", id -> {
            loads.incrementAndGet();
            return ScenarioFixtures.linePath();
        });
        Graph second = arena.computeIfAbsent("line", id -> {
            loads.incrementAndGet();
            return ScenarioFixtures.disconnected();
        });

        assertSame(first, second);
        assertEquals(1, loads.get());
        assertSame(first, arena.get("line").orElseThrow());
    }

    @Test
    @DisplayName("Publishing never replaces an existing graph")
    void testPublish() {
        GraphArena arena = new GraphArena();
        Graph line = ScenarioFixtures.linePath();

        assertSame(line, arena.publish("net", line));
        assertSame(line, arena.publish("net", ScenarioFixtures.diamond()));
        assertEquals(1, arena.size());
    }

    @Test
    @DisplayName("Eviction removes the graph so the next load runs again")
    void testEvict() {
        GraphArena arena = new GraphArena();
        arena.publish("net", ScenarioFixtures.linePath());

        assertTrue(arena.evict("net"));
        assertFalse(arena.evict("net"));
        assertTrue(arena.get("net").isEmpty());

        Graph reloaded = arena.computeIfAbsent("net", id -> ScenarioFixtures.diamond());
        assertEquals(ScenarioFixtures.diamond().nodeCount(), reloaded.nodeCount());
    }

    @Test
    @DisplayName("Concurrent first access shares one loaded graph")
    void testConcurrentLoad() throws Exception {
        GraphArena arena = new GraphArena();
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Graph>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return arena.computeIfAbsent("shared", id -> {
                        loads.incrementAndGet();
                        return ScenarioFixtures.diamond();
                    });
                }));
            }
            start.countDown();
            Graph expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Graph> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, loads.get());
    }
}
