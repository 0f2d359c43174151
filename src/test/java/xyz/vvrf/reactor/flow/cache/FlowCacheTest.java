package xyz.vvrf.reactor.flow.cache;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.cache.backend.LocalCacheBackend;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;
import xyz.vvrf.reactor.flow.test.util.MutableClock;
import xyz.vvrf.reactor.flow.test.util.ToggleableBackend;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.vvrf.reactor.flow.metrics.MetricsCollector.tags;

class FlowCacheTest {

    public static class Trial {
        public String id;
        public int phase;

        public Trial() {
        }

        Trial(String id, int phase) {
            this.id = id;
            this.phase = phase;
        }
    }

    private MutableClock clock;
    private MetricsCollector metrics;
    private ToggleableBackend remote;
    private FlowCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        metrics = new MetricsCollector(new SimpleMeterRegistry(), clock);
        remote = new ToggleableBackend();
        cache = FlowCache.builder()
                .primary(remote)
                .local(new LocalCacheBackend(1000, clock))
                .clock(clock)
                .metrics(metrics)
                .keyPrefix("test")
                .defaultTtl(Duration.ofHours(1))
                .healthCheckInterval(Duration.ofSeconds(30))
                .ioScheduler(Schedulers.immediate())
                .build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private static Map<String, Object> payload(String gene, String variant) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("gene", gene);
        p.put("variant", variant);
        return p;
    }

    @Test
    void entryLivesExactlyForItsTtl() {
        Map<String, Object> payload = payload("EGFR", "L858R");
        assertTrue(cache.set("EGFR_L858R", payload, Duration.ofSeconds(3600)));

        clock.advance(Duration.ofSeconds(3599));
        assertEquals(Optional.of(payload), cache.get("EGFR_L858R", Map.class));

        clock.advance(Duration.ofSeconds(2));
        assertFalse(cache.get("EGFR_L858R", Map.class).isPresent());

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getExpired());
        assertEquals(0.5, stats.getHitRate());
    }

    @Test
    void entryExpiresAtBoundary() {
        cache.set("k", "v", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(10));
        assertFalse(cache.get("k", String.class).isPresent());
    }

    @Test
    void nonPositiveTtlNeverExpires() {
        cache.set("forever", "v", Duration.ZERO);
        clock.advance(Duration.ofDays(365));
        assertEquals(Optional.of("v"), cache.get("forever", String.class));
    }

    @Test
    void storesTypedValuesUnderPrefix() {
        cache.set("trial:NCT001", new Trial("NCT001", 3));

        Trial trial = cache.get("trial:NCT001", Trial.class).orElseThrow(AssertionError::new);
        assertEquals("NCT001", trial.id);
        assertEquals(3, trial.phase);
        assertTrue(remote.getStore().containsKey("test:trial:NCT001"));
    }

    @Test
    void typeMismatchIsAMissNotAnError() {
        cache.set("trial:NCT002", new Trial("NCT002", 2));
        assertFalse(cache.get("trial:NCT002", Integer.class).isPresent());
        assertEquals(1, cache.getStats().getErrors());
    }

    @Test
    void invalidatePatternRemovesOnlyMatchingKeys() {
        cache.set("mutation:EGFR:L858R", "a");
        cache.set("mutation:EGFR:T790M", "b");
        cache.set("mutation:KRAS:G12C", "c");
        cache.set("trial:EGFR", "d");

        assertEquals(2, cache.invalidatePattern("mutation:EGFR*"));

        assertFalse(cache.containsKey("mutation:EGFR:L858R"));
        assertFalse(cache.containsKey("mutation:EGFR:T790M"));
        assertTrue(cache.containsKey("mutation:KRAS:G12C"));
        assertTrue(cache.containsKey("trial:EGFR"));
        assertEquals(2.0, metrics.getCounter("cache.invalidations", Collections.emptyMap()));
    }

    @Test
    void patternWithoutWildcardIsPrefix() {
        cache.set("mutation:KRAS:G12C", "c");
        cache.set("mutation:KRAS:G12D", "d");
        cache.set("mutation:BRAF:V600E", "e");

        assertEquals(2, cache.invalidatePattern("mutation:KRAS"));
        assertEquals(1, cache.size());
        assertEquals(1, cache.clear());
        assertEquals(0, cache.size());
    }

    @Test
    void deleteAndContains() {
        cache.set("k", "v");
        assertTrue(cache.containsKey("k"));
        assertTrue(cache.delete("k"));
        assertFalse(cache.delete("k"));
        assertFalse(cache.containsKey("k"));
        assertEquals(1, cache.getStats().getDeletes());
    }

    @Test
    void inspectReportsHitCounts() {
        cache.set("a", 1);
        cache.set("b", 2);
        cache.get("a", Integer.class);
        cache.get("a", Integer.class);

        List<CacheEntry> entries = cache.inspect("a");
        assertEquals(1, entries.size());
        assertEquals(2, entries.get(0).getHitCount());
        assertEquals(2, cache.inspect("*").size());
    }

    @Test
    void reapExpiredRemovesOnlyExpiredEntries() {
        cache.set("short1", 1, Duration.ofSeconds(10));
        cache.set("short2", 2, Duration.ofSeconds(10));
        cache.set("long", 3, Duration.ofHours(2));

        clock.advance(Duration.ofSeconds(11));
        assertEquals(2, cache.reapExpired());
        assertEquals(1, cache.size());
        assertEquals(2, cache.getStats().getExpired());
    }

    @Test
    void warmWritesAllNonNullValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("g:EGFR", "egfr");
        values.put("g:KRAS", "kras");
        values.put("g:NULL", null);

        assertEquals(2, cache.warm(values, Duration.ofMinutes(5)));
        assertTrue(cache.containsKey("g:EGFR"));
    }

    @Test
    void getOrLoadCallsLoaderOnlyOnMiss() {
        AtomicInteger loads = new AtomicInteger();
        String first = cache.getOrLoad("k", String.class, null, () -> "v" + loads.incrementAndGet());
        String second = cache.getOrLoad("k", String.class, null, () -> "v" + loads.incrementAndGet());

        assertEquals("v1", first);
        assertEquals("v1", second);
        assertEquals(1, loads.get());
    }

    @Test
    void asyncOperations() {
        StepVerifier.create(cache.setAsync("k", "v", Duration.ofMinutes(1)))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(cache.getAsync("k", String.class))
                .expectNext(Optional.of("v"))
                .verifyComplete();
        StepVerifier.create(cache.containsKeyAsync("missing"))
                .expectNext(false)
                .verifyComplete();

        AtomicInteger loads = new AtomicInteger();
        StepVerifier.create(cache.getOrLoadAsync("lazy", String.class, null, () -> Mono.fromCallable(() -> "x" + loads.incrementAndGet())))
                .expectNext("x1")
                .verifyComplete();
        StepVerifier.create(cache.getOrLoadAsync("lazy", String.class, null, () -> Mono.just("other")))
                .expectNext("x1")
                .verifyComplete();

        StepVerifier.create(cache.invalidatePatternAsync("*"))
                .expectNext(2)
                .verifyComplete();
        StepVerifier.create(cache.deleteAsync("k"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void fallsBackToLocalBackendWhilePrimaryIsDown() {
        remote.setAvailable(false);

        assertTrue(cache.set("k", "v"));
        assertTrue(cache.isDegraded());
        assertEquals(Optional.of("v"), cache.get("k", String.class));
        assertEquals("local", cache.getStats().getActiveBackend());
        assertEquals(1.0, metrics.getGauge("cache.degraded", Collections.emptyMap()).orElse(0.0));
        assertTrue(metrics.getCounter("cache.errors", tags("operation", "backend")) >= 1.0);
    }

    @Test
    void returnsToPrimaryAfterHealthCheckInterval() {
        remote.setAvailable(false);
        cache.set("k", "v");
        assertTrue(cache.isDegraded());

        remote.setAvailable(true);
        clock.advance(Duration.ofSeconds(29));
        cache.containsKey("k");
        assertTrue(cache.isDegraded());

        clock.advance(Duration.ofSeconds(1));
        cache.containsKey("k");
        assertFalse(cache.isDegraded());
        assertEquals("fake-remote", cache.getStats().getActiveBackend());
        assertEquals(0.0, metrics.getGauge("cache.degraded", Collections.emptyMap()).orElse(-1.0));
    }

    @Test
    void invalidationsDuringOutageAreReplayedOnRecovery() {
        cache.set("mutation:EGFR:L858R", "stale");
        cache.set("mutation:KRAS:G12C", "keep");

        remote.setAvailable(false);
        cache.set("outage-write", "x");
        cache.invalidatePattern("mutation:EGFR*");

        remote.setAvailable(true);
        clock.advance(Duration.ofSeconds(30));
        cache.containsKey("anything");

        assertFalse(cache.isDegraded());
        assertFalse(remote.getStore().containsKey("test:mutation:EGFR:L858R"));
        assertTrue(remote.getStore().containsKey("test:mutation:KRAS:G12C"));
        assertFalse(cache.containsKey("mutation:EGFR:L858R"));
    }

    @Test
    void backendErrorsNeverReachCaller() {
        FlowCache localOnly = FlowCache.builder()
                .local(new LocalCacheBackend(10, clock))
                .clock(clock)
                .metrics(metrics)
                .ioScheduler(Schedulers.immediate())
                .build();
        assertFalse(localOnly.isDegraded());
        assertTrue(localOnly.set("k", "v"));
        assertEquals("local", localOnly.getStats().getActiveBackend());
        localOnly.close();
    }
}
