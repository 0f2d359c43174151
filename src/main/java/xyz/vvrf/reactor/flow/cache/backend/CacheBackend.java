package xyz.vvrf.reactor.flow.cache.backend;

import xyz.vvrf.reactor.flow.cache.KeyPattern;
import xyz.vvrf.reactor.flow.exception.CacheBackendException;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * 缓存存储后端协议: key -> bytes。所有方法在后端不可用时抛出 {@link CacheBackendException}。
 *
 * @author ruifeng.wen
 */
public interface CacheBackend {

    String getName();

    Optional<byte[]> get(String key);

    /**
     * @param ttl 为 null、零或负数时不过期
     */
    void set(String key, byte[] value, Duration ttl);

    boolean delete(String key);

    Set<String> keys(KeyPattern pattern);

    /**
     * 健康探测。不抛异常，不可用时返回 false。
     */
    boolean ping();
}
