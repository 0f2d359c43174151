package xyz.vvrf.reactor.flow.cache.analytics;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 缓存效率报告。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
public class CacheReport {

    private final Instant generatedAt;
    private final long totalRequests;
    private final long hits;
    private final long misses;
    private final long sets;
    private final long errors;
    private final double hitRate;
    private final double errorRate;
    private final Duration window;
    private final long windowRequests;
    private final double windowHitRate;
    /** 0 - 100 */
    private final double efficiencyScore;
    private final Map<String, PatternStats> patterns;
    private final List<String> recommendations;

    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Cache Performance Report (").append(generatedAt).append(")\n");
        sb.append(String.format("  Total requests : %d (hits %d, misses %d)%n", totalRequests, hits, misses));
        sb.append(String.format("  Hit rate       : %.2f%%%n", hitRate * 100));
        sb.append(String.format("  Window (%ds)   : %d requests, hit rate %.2f%%%n",
                window.getSeconds(), windowRequests, windowHitRate * 100));
        sb.append(String.format("  Sets / errors  : %d / %d (error rate %.2f%%)%n", sets, errors, errorRate * 100));
        sb.append(String.format("  Efficiency     : %.1f / 100%n", efficiencyScore));
        if (!patterns.isEmpty()) {
            sb.append("  Patterns:\n");
            patterns.values().forEach(p -> sb.append(String.format("    %-30s %6d requests, hit rate %.2f%%%n",
                    p.getPattern(), p.getRequests(), p.getHitRate() * 100)));
        }
        if (!recommendations.isEmpty()) {
            sb.append("  Recommendations:\n");
            recommendations.forEach(r -> sb.append("    - ").append(r).append('\n'));
        }
        return sb.toString();
    }
}
