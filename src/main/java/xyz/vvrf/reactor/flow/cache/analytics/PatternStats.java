package xyz.vvrf.reactor.flow.cache.analytics;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 某个被跟踪键模式的命中统计。
 *
 * @author ruifeng.wen
 */
@Getter
@ToString
@RequiredArgsConstructor
public class PatternStats {

    private final String pattern;
    private final long hits;
    private final long misses;

    public long getRequests() {
        return hits + misses;
    }

    public double getHitRate() {
        long total = getRequests();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
