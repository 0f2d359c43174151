package xyz.vvrf.reactor.flow.cache;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 缓存条目信封。序列化为 JSON 字节后写入后端，值本身以 JSON 树保存。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "value")
public class CacheEntry {

    private String key;
    private JsonNode value;
    /** 创建时间 (epoch 毫秒) */
    private long createdAt;
    /** 存活时长 (毫秒)，<= 0 表示永不过期 */
    private long ttlMillis;
    private long hitCount;
    /** 最近访问时间 (epoch 毫秒) */
    private long lastAccessedAt;

    public CacheEntry(String key, JsonNode value, Instant createdAt, Duration ttl) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt.toEpochMilli();
        this.ttlMillis = ttl == null ? 0 : ttl.toMillis();
        this.lastAccessedAt = this.createdAt;
    }

    public boolean hasTtl() {
        return ttlMillis > 0;
    }

    /**
     * 到达或超过 createdAt + ttl 即视为过期。
     */
    public boolean isExpired(Instant now) {
        return hasTtl() && now.toEpochMilli() >= createdAt + ttlMillis;
    }

    public Duration age(Instant now) {
        return Duration.ofMillis(Math.max(0, now.toEpochMilli() - createdAt));
    }

    /**
     * 剩余存活时长；无 TTL 时返回 null。
     */
    public Duration remainingTtl(Instant now) {
        if (!hasTtl()) {
            return null;
        }
        return Duration.ofMillis(Math.max(1, createdAt + ttlMillis - now.toEpochMilli()));
    }

    void touch(Instant now) {
        hitCount++;
        lastAccessedAt = now.toEpochMilli();
    }
}
