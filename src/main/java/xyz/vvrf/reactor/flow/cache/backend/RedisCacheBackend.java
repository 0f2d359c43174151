package xyz.vvrf.reactor.flow.cache.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.serializer.RedisSerializer;
import xyz.vvrf.reactor.flow.cache.KeyPattern;
import xyz.vvrf.reactor.flow.exception.CacheBackendException;

import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的网络缓存后端。底层任何异常 (连接失败、超时、序列化) 都转换为 {@link CacheBackendException}。
 * <p>
 * 带 TTL 的写入使用 PSETEX，按模式列键使用 SCAN，不会用 KEYS 阻塞 Redis。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class RedisCacheBackend implements CacheBackend {

    static final long SCAN_COUNT = 500;

    private final RedisTemplate<String, byte[]> template;
    private final RedisSerializer<String> keySerializer = RedisSerializer.string();

    public RedisCacheBackend(RedisConnectionFactory connectionFactory) {
        Objects.requireNonNull(connectionFactory, "RedisConnectionFactory 不能为空");
        RedisTemplate<String, byte[]> t = new RedisTemplate<>();
        t.setConnectionFactory(connectionFactory);
        t.setKeySerializer(keySerializer);
        t.setValueSerializer(RedisSerializer.byteArray());
        t.afterPropertiesSet();
        this.template = t;
        log.info("RedisCacheBackend 已初始化，连接工厂: {}", connectionFactory.getClass().getSimpleName());
    }

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.ofNullable(execute(connection -> connection.get(raw(key))));
        } catch (RuntimeException e) {
            throw new CacheBackendException("Redis GET 失败: " + key, e);
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        try {
            execute((RedisCallback<Object>) connection -> {
                if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                    return connection.set(raw(key), value);
                }
                return connection.pSetEx(raw(key), Math.max(1, ttl.toMillis()), value);
            });
        } catch (RuntimeException e) {
            throw new CacheBackendException("Redis SET 失败: " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            Long removed = execute(connection -> connection.del(raw(key)));
            return removed != null && removed > 0;
        } catch (RuntimeException e) {
            throw new CacheBackendException("Redis DEL 失败: " + key, e);
        }
    }

    @Override
    public Set<String> keys(KeyPattern pattern) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(toRedisGlob(pattern))
                .count(SCAN_COUNT)
                .build();
        try {
            Set<String> found = execute((RedisCallback<Set<String>>) connection -> {
                Set<String> keys = new HashSet<>();
                Cursor<byte[]> cursor = connection.scan(options);
                try {
                    while (cursor.hasNext()) {
                        keys.add(keySerializer.deserialize(cursor.next()));
                    }
                } finally {
                    closeCursor(cursor, pattern);
                }
                return keys;
            });
            return found == null ? new HashSet<>() : found;
        } catch (RuntimeException e) {
            throw new CacheBackendException("Redis SCAN 失败: " + pattern, e);
        }
    }

    @Override
    public boolean ping() {
        try {
            String pong = execute(RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            log.debug("Redis PING 失败: {}", e.toString());
            return false;
        }
    }

    /**
     * 把模式转换为 Redis MATCH 语法：保留 {@code *} 与 {@code ?}，对 Redis 额外解释的 {@code [ ] \} 转义。
     */
    static String toRedisGlob(KeyPattern pattern) {
        String glob = pattern.getGlob();
        StringBuilder sb = new StringBuilder(glob.length() + 4);
        for (char c : glob.toCharArray()) {
            if (c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * 回调直接拿到底层连接，连接的获取与释放仍由 RedisTemplate 负责。
     */
    private <T> T execute(RedisCallback<T> callback) {
        return template.execute(callback, true);
    }

    private byte[] raw(String key) {
        return keySerializer.serialize(key);
    }

    private static void closeCursor(Cursor<byte[]> cursor, KeyPattern pattern) {
        try {
            cursor.close();
        } catch (Exception e) {
            log.warn("关闭 Redis SCAN 游标失败 (模式: {}): {}", pattern, e.toString());
        }
    }
}
