package xyz.vvrf.reactor.flow.cache.backend;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.cache.KeyPattern;
import xyz.vvrf.reactor.flow.test.util.MutableClock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class LocalCacheBackendTest {

    private MutableClock clock;
    private LocalCacheBackend backend;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        backend = new LocalCacheBackend(100, clock);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void storesAndDeletes() {
        backend.set("a", bytes("1"), null);
        assertArrayEquals(bytes("1"), backend.get("a").orElse(null));
        assertTrue(backend.delete("a"));
        assertFalse(backend.delete("a"));
        assertFalse(backend.get("a").isPresent());
        assertTrue(backend.ping());
    }

    @Test
    void entriesExpireByTtl() {
        backend.set("short", bytes("x"), Duration.ofSeconds(5));
        backend.set("forever", bytes("y"), Duration.ZERO);

        clock.advance(Duration.ofSeconds(6));
        assertFalse(backend.get("short").isPresent());
        assertTrue(backend.get("forever").isPresent());
    }

    @Test
    void keysFilteredByPattern() {
        backend.set("flow:mutation:EGFR", bytes("1"), null);
        backend.set("flow:mutation:KRAS", bytes("2"), null);
        backend.set("flow:trial:NCT001", bytes("3"), null);

        assertEquals(new HashSet<>(Arrays.asList("flow:mutation:EGFR", "flow:mutation:KRAS")),
                backend.keys(KeyPattern.of("flow:mutation:")));
    }
}
