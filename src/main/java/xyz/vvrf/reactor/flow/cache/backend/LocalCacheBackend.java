package xyz.vvrf.reactor.flow.cache.backend;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.cache.KeyPattern;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 基于 Caffeine 的进程内缓存后端。既可单独使用，也作为网络后端不可用时的降级存储。
 * 每个条目按自身 TTL 过期；Caffeine 的时钟取自注入的 {@link Clock}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LocalCacheBackend implements CacheBackend {

    private final Cache<String, Stored> cache;

    public LocalCacheBackend(long maximumSize, Clock clock) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new StoredExpiry())
                .build();
        log.info("LocalCacheBackend (Caffeine) 已初始化，最大条目数: {}", maximumSize);
    }

    @Override
    public String getName() {
        return "local";
    }

    @Override
    public Optional<byte[]> get(String key) {
        Stored stored = cache.getIfPresent(key);
        return stored == null ? Optional.empty() : Optional.of(stored.data);
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        cache.put(key, new Stored(value, ttl));
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public Set<String> keys(KeyPattern pattern) {
        return cache.asMap().keySet().stream()
                .filter(pattern::matches)
                .collect(Collectors.toSet());
    }

    @Override
    public boolean ping() {
        return true;
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private static final class Stored {
        final byte[] data;
        final long ttlNanos;

        Stored(byte[] data, Duration ttl) {
            this.data = data;
            this.ttlNanos = (ttl == null || ttl.isZero() || ttl.isNegative()) ? Long.MAX_VALUE : ttl.toNanos();
        }
    }

    private static final class StoredExpiry implements Expiry<String, Stored> {
        @Override
        public long expireAfterCreate(String key, Stored value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Stored value, long currentTime, long currentDuration) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Stored value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
