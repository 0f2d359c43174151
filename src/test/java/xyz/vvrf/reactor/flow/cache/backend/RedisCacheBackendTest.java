package xyz.vvrf.reactor.flow.cache.backend;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.cache.FlowCache;
import xyz.vvrf.reactor.flow.cache.KeyPattern;
import xyz.vvrf.reactor.flow.exception.CacheBackendException;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;
import xyz.vvrf.reactor.flow.test.util.MutableClock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCacheBackendTest {

    private RedisConnectionFactory factory;
    private RedisConnection connection;
    private RedisCacheBackend backend;

    @BeforeEach
    void setUp() {
        factory = mock(RedisConnectionFactory.class);
        connection = mock(RedisConnection.class);
        when(factory.getConnection()).thenReturn(connection);
        backend = new RedisCacheBackend(factory);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void getReturnsStoredValue() {
        when(connection.get(bytes("flow:trial:NCT01"))).thenReturn(bytes("{\"phase\":3}"));

        Optional<byte[]> value = backend.get("flow:trial:NCT01");

        assertTrue(value.isPresent());
        assertArrayEquals(bytes("{\"phase\":3}"), value.get());
        assertFalse(backend.get("flow:trial:missing").isPresent());
    }

    @Test
    void connectionErrorsBecomeBackendExceptions() {
        RedisConnectionFailureException refused = new RedisConnectionFailureException("Connection refused");
        when(connection.get(any(byte[].class))).thenThrow(refused);

        CacheBackendException e = assertThrows(CacheBackendException.class, () -> backend.get("flow:trial:NCT01"));
        assertSame(refused, e.getCause());
        assertTrue(e.getMessage().contains("flow:trial:NCT01"));
    }

    @Test
    void unreachableServerBecomesBackendException() {
        when(factory.getConnection()).thenThrow(new RedisConnectionFailureException("Unable to connect to localhost:6379"));

        assertThrows(CacheBackendException.class, () -> backend.set("k", bytes("v"), Duration.ofMinutes(1)));
        assertThrows(CacheBackendException.class, () -> backend.delete("k"));
        assertThrows(CacheBackendException.class, () -> backend.keys(KeyPattern.of("k")));
    }

    @Test
    void setWithTtlUsesMillisecondExpiry() {
        byte[] value = bytes("v");

        backend.set("flow:gene:EGFR", value, Duration.ofMillis(1500));

        verify(connection).pSetEx(bytes("flow:gene:EGFR"), 1500L, value);
        verify(connection, never()).set(any(byte[].class), any(byte[].class));
    }

    @Test
    void setWithoutTtlNeverExpires() {
        byte[] value = bytes("v");

        backend.set("flow:gene:EGFR", value, null);
        backend.set("flow:gene:KRAS", value, Duration.ZERO);

        verify(connection).set(bytes("flow:gene:EGFR"), value);
        verify(connection).set(bytes("flow:gene:KRAS"), value);
        verify(connection, never()).pSetEx(any(byte[].class), anyLong(), any(byte[].class));
    }

    @Test
    void deleteReportsWhetherKeyExisted() {
        when(connection.del(bytes("flow:gene:EGFR"))).thenReturn(1L);
        when(connection.del(bytes("flow:gene:TP53"))).thenReturn(0L);

        assertTrue(backend.delete("flow:gene:EGFR"));
        assertFalse(backend.delete("flow:gene:TP53"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void keysScanWithEscapedPattern() throws Exception {
        Cursor<byte[]> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn(bytes("flow:trial[1]:a"), bytes("flow:trial[1]:b"));
        when(connection.scan(any(ScanOptions.class))).thenReturn(cursor);

        assertEquals(new HashSet<>(Arrays.asList("flow:trial[1]:a", "flow:trial[1]:b")),
                backend.keys(KeyPattern.of("flow:trial[1]:*")));

        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(connection).scan(options.capture());
        assertEquals("flow:trial\\[1\\]:*", options.getValue().getPattern());
        assertEquals(Long.valueOf(RedisCacheBackend.SCAN_COUNT), options.getValue().getCount());
        verify(cursor).close();
        verify(connection, never()).keys(any(byte[].class));
    }

    @Test
    void scanFailureBecomesBackendException() {
        when(connection.scan(any(ScanOptions.class))).thenThrow(new RedisConnectionFailureException("reset"));

        assertThrows(CacheBackendException.class, () -> backend.keys(KeyPattern.of("flow:*")));
    }

    @Test
    void redisGlobKeepsWildcardsAndEscapesBrackets() {
        assertEquals("flow:gene:*", RedisCacheBackend.toRedisGlob(KeyPattern.of("flow:gene:")));
        assertEquals("flow:?:x*", RedisCacheBackend.toRedisGlob(KeyPattern.of("flow:?:x*")));
        assertEquals("a\\\\b\\[c\\]*", RedisCacheBackend.toRedisGlob(KeyPattern.of("a\\b[c]")));
    }

    @Test
    void pingReflectsServerHealth() {
        when(connection.ping()).thenReturn("PONG");
        assertTrue(backend.ping());

        when(connection.ping()).thenThrow(new RedisConnectionFailureException("timeout"));
        assertFalse(backend.ping());

        when(factory.getConnection()).thenThrow(new RedisConnectionFailureException("refused"));
        assertFalse(backend.ping());
    }

    @Test
    void flowCacheFallsBackToLocalWhileRedisIsDown() {
        MutableClock clock = new MutableClock();
        FlowCache cache = FlowCache.builder()
                .primary(backend)
                .local(new LocalCacheBackend(100, clock))
                .clock(clock)
                .metrics(new MetricsCollector(new SimpleMeterRegistry(), clock))
                .keyPrefix("flow")
                .healthCheckInterval(Duration.ofSeconds(30))
                .ioScheduler(Schedulers.immediate())
                .build();
        try {
            RedisConnectionFailureException refused = new RedisConnectionFailureException("Connection refused");
            when(connection.pSetEx(any(byte[].class), anyLong(), any(byte[].class))).thenThrow(refused);
            when(connection.set(any(byte[].class), any(byte[].class))).thenThrow(refused);
            when(connection.ping()).thenThrow(refused);

            assertTrue(cache.set("gene:EGFR", "L858R"));
            assertTrue(cache.isDegraded());
            assertEquals("local", cache.getStats().getActiveBackend());
            assertEquals(Optional.of("L858R"), cache.get("gene:EGFR", String.class));

            // Redis 仍不可用，健康检查失败后保持降级
            clock.advance(Duration.ofSeconds(31));
            cache.containsKey("gene:EGFR");
            assertTrue(cache.isDegraded());

            doReturn("PONG").when(connection).ping();
            clock.advance(Duration.ofSeconds(30));
            cache.containsKey("gene:EGFR");
            assertFalse(cache.isDegraded());
            assertEquals("redis", cache.getStats().getActiveBackend());
        } finally {
            cache.close();
        }
    }
}
