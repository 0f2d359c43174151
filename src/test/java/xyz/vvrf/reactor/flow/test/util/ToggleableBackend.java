package xyz.vvrf.reactor.flow.test.util;

import xyz.vvrf.reactor.flow.cache.KeyPattern;
import xyz.vvrf.reactor.flow.cache.backend.CacheBackend;
import xyz.vvrf.reactor.flow.exception.CacheBackendException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 模拟网络缓存后端。{@link #setAvailable(boolean)} 为 false 时所有操作抛出 {@link CacheBackendException}。
 * 不处理 TTL，过期判断由 FlowCache 的条目元数据完成。
 */
public class ToggleableBackend implements CacheBackend {

    private final Map<String, byte[]> store = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean available = true;

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public Map<String, byte[]> getStore() {
        return store;
    }

    public int getCalls() {
        return calls.get();
    }

    @Override
    public String getName() {
        return "fake-remote";
    }

    @Override
    public Optional<byte[]> get(String key) {
        check();
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        check();
        store.put(key, value);
    }

    @Override
    public boolean delete(String key) {
        check();
        return store.remove(key) != null;
    }

    @Override
    public Set<String> keys(KeyPattern pattern) {
        check();
        return store.keySet().stream().filter(pattern::matches).collect(Collectors.toSet());
    }

    @Override
    public boolean ping() {
        return available;
    }

    private void check() {
        calls.incrementAndGet();
        if (!available) {
            throw new CacheBackendException("connection refused");
        }
    }
}
