package xyz.vvrf.reactor.flow.cache.invalidation;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;
import xyz.vvrf.reactor.flow.cache.FlowCache;
import xyz.vvrf.reactor.flow.cache.backend.LocalCacheBackend;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;
import xyz.vvrf.reactor.flow.test.util.MutableClock;

import java.time.Duration;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class CacheInvalidatorTest {

    private MutableClock clock;
    private FlowCache cache;
    private CacheInvalidator invalidator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = FlowCache.builder()
                .local(new LocalCacheBackend(1000, clock))
                .clock(clock)
                .metrics(new MetricsCollector(new SimpleMeterRegistry(), clock))
                .keyPrefix("inv")
                .ioScheduler(Schedulers.immediate())
                .build();
        invalidator = new CacheInvalidator(cache, clock);
    }

    @AfterEach
    void tearDown() {
        invalidator.close();
        cache.close();
    }

    @Test
    void triggerInvalidatesAllItsPatterns() {
        cache.set("mutation:EGFR", 1);
        cache.set("mutation:KRAS", 2);
        cache.set("summary:EGFR", 3);
        cache.set("trial:NCT001", 4);
        invalidator.registerTrigger("mutation_updated", "mutation:*", "summary:*");

        assertEquals(3, invalidator.fire("mutation_updated"));
        assertTrue(cache.containsKey("trial:NCT001"));
        assertEquals(1, cache.size());
        assertTrue(invalidator.getTriggers().contains("mutation_updated"));

        InvalidationStats stats = invalidator.getStats();
        assertEquals(1, stats.getTriggersFired());
        assertEquals(3, stats.getPatternInvalidations());
    }

    @Test
    void ruleUsesContext() {
        cache.set("mutation:EGFR:L858R", 1);
        cache.set("mutation:KRAS:G12C", 2);
        invalidator.registerRule("gene_updated",
                ctx -> Collections.singletonList("mutation:" + ctx.get("gene") + ":*"));

        assertEquals(1, invalidator.fire("gene_updated", Collections.singletonMap("gene", "EGFR")));
        assertTrue(cache.containsKey("mutation:KRAS:G12C"));
    }

    @Test
    void unknownTriggerRemovesNothing() {
        cache.set("a", 1);
        assertEquals(0, invalidator.fire("nobody"));
        assertEquals(1, cache.size());
        assertEquals(0, invalidator.getStats().getTriggersFired());
    }

    @Test
    void oldEntriesAreRemovedByAge() {
        cache.set("old", 1, Duration.ZERO);
        clock.advance(Duration.ofMinutes(10));
        cache.set("new", 2, Duration.ZERO);

        assertEquals(1, invalidator.invalidateOlderThan(Duration.ofMinutes(5)));
        assertFalse(cache.containsKey("old"));
        assertTrue(cache.containsKey("new"));
        assertEquals(1, invalidator.getStats().getAgeInvalidations());
    }

    @Test
    void lowHitEntriesAreEvictedLeastUsedFirst() {
        cache.set("hot", 1);
        cache.set("warm", 2);
        cache.set("cold", 3);
        for (int i = 0; i < 5; i++) {
            cache.get("hot", Integer.class);
        }
        cache.get("warm", Integer.class);

        assertEquals(1, invalidator.evictLowHitEntries(2, 1));
        assertFalse(cache.containsKey("cold"));
        assertTrue(cache.containsKey("warm"));

        assertEquals(1, invalidator.evictLowHitEntries(2, 10));
        assertTrue(cache.containsKey("hot"));
        assertEquals(2, invalidator.getStats().getUsageEvictions());
    }

    @Test
    void capacityIsEnforced() {
        for (int i = 0; i < 5; i++) {
            cache.set("k" + i, i);
        }
        cache.get("k0", Integer.class);
        cache.get("k1", Integer.class);

        assertEquals(0, invalidator.enforceCapacity(10));
        assertEquals(3, invalidator.enforceCapacity(2));
        assertTrue(cache.containsKey("k0"));
        assertTrue(cache.containsKey("k1"));
        assertEquals(2, cache.size());
    }

    @Test
    void scheduledAgeSweep() {
        VirtualTimeScheduler vts = VirtualTimeScheduler.create();
        cache.set("entry", 1, Duration.ZERO);
        invalidator.scheduleAgeSweep(Duration.ofMinutes(1), Duration.ofMinutes(30), vts);

        vts.advanceTimeBy(Duration.ofMinutes(1));
        assertTrue(cache.containsKey("entry"));

        clock.advance(Duration.ofHours(1));
        vts.advanceTimeBy(Duration.ofMinutes(1));
        assertFalse(cache.containsKey("entry"));
        assertEquals(1, invalidator.getStats().getTotalInvalidations());
        vts.dispose();
    }
}
