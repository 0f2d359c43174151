package xyz.vvrf.reactor.flow.cache;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 缓存累计统计。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString
public class CacheStats {

    private final long hits;
    private final long misses;
    private final long sets;
    private final long deletes;
    private final long errors;
    private final long invalidations;
    private final long expired;
    private final boolean degraded;
    private final String activeBackend;

    public long getTotalRequests() {
        return hits + misses;
    }

    public double getHitRate() {
        long total = getTotalRequests();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
