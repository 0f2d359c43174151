package xyz.vvrf.reactor.flow.cache.analytics;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.cache.KeyPattern;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 缓存访问分析：累计计数、滑动时间窗口内的命中率，以及按键模式拆分的命中统计。
 * 滑动窗口由固定数量的时间桶组成，每个桶覆盖 window / buckets 的时长。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CacheAnalytics {

    static final double LOW_HIT_RATE = 0.6;
    static final double HIGH_ERROR_RATE = 0.05;
    static final long MIN_SAMPLE = 100;

    private static final int BUCKETS = 60;

    private final Clock clock;
    @Getter
    private final Duration window;
    private final long bucketMillis;
    private final Bucket[] buckets = new Bucket[BUCKETS];

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    private final Map<KeyPattern, PatternCounter> tracked = new ConcurrentHashMap<>();

    public CacheAnalytics(Duration window, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
        this.window = Objects.requireNonNull(window, "统计窗口不能为空");
        if (window.toMillis() < BUCKETS) {
            throw new IllegalArgumentException("统计窗口过短: " + window);
        }
        this.bucketMillis = window.toMillis() / BUCKETS;
        for (int i = 0; i < BUCKETS; i++) {
            buckets[i] = new Bucket();
        }
    }

    /**
     * 开始单独统计匹配该模式的键。
     */
    public void trackPattern(String pattern) {
        tracked.putIfAbsent(KeyPattern.of(pattern), new PatternCounter());
    }

    public void recordHit(String key) {
        hits.incrementAndGet();
        recordInWindow(true);
        forMatching(key, c -> c.hits.incrementAndGet());
    }

    public void recordMiss(String key) {
        misses.incrementAndGet();
        recordInWindow(false);
        forMatching(key, c -> c.misses.incrementAndGet());
    }

    public void recordSet() {
        sets.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public long getTotalRequests() {
        return hits.get() + misses.get();
    }

    public double getHitRate() {
        long total = getTotalRequests();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }

    public long getWindowRequests() {
        long[] hm = windowCounts();
        return hm[0] + hm[1];
    }

    public double getWindowHitRate() {
        long[] hm = windowCounts();
        long total = hm[0] + hm[1];
        return total == 0 ? 0.0 : (double) hm[0] / total;
    }

    public Map<String, PatternStats> patternBreakdown() {
        Map<String, PatternStats> result = new LinkedHashMap<>();
        tracked.entrySet().stream()
                .sorted(Map.Entry.comparingByKey((a, b) -> a.getGlob().compareTo(b.getGlob())))
                .forEach(e -> result.put(e.getKey().getGlob(),
                        new PatternStats(e.getKey().getGlob(), e.getValue().hits.get(), e.getValue().misses.get())));
        return Collections.unmodifiableMap(result);
    }

    /**
     * 效率分 = 命中率 * 100 - 错误率 * 100，截断到 [0, 100]。
     */
    public double efficiencyScore() {
        double score = getHitRate() * 100 - errorRate() * 100;
        return Math.max(0.0, Math.min(100.0, score));
    }

    public CacheReport report() {
        double hitRate = getHitRate();
        double errorRate = errorRate();
        long total = getTotalRequests();

        List<String> recommendations = new ArrayList<>();
        if (total < MIN_SAMPLE) {
            recommendations.add(String.format("样本量不足 (%d 次请求)，统计结论仅供参考", total));
        }
        if (total > 0 && hitRate < LOW_HIT_RATE) {
            recommendations.add(String.format("命中率 %.1f%% 偏低，考虑延长 TTL 或为热点键配置预热策略", hitRate * 100));
        }
        if (errorRate > HIGH_ERROR_RATE) {
            recommendations.add(String.format("错误率 %.1f%% 偏高，检查缓存后端连接与序列化", errorRate * 100));
        }

        return CacheReport.builder()
                .generatedAt(clock.instant())
                .totalRequests(total)
                .hits(hits.get())
                .misses(misses.get())
                .sets(sets.get())
                .errors(errors.get())
                .hitRate(hitRate)
                .errorRate(errorRate)
                .window(window)
                .windowRequests(getWindowRequests())
                .windowHitRate(getWindowHitRate())
                .efficiencyScore(efficiencyScore())
                .patterns(patternBreakdown())
                .recommendations(Collections.unmodifiableList(recommendations))
                .build();
    }

    public void reset() {
        hits.set(0);
        misses.set(0);
        sets.set(0);
        errors.set(0);
        for (Bucket b : buckets) {
            synchronized (b) {
                b.reset(-1);
            }
        }
        tracked.values().forEach(c -> {
            c.hits.set(0);
            c.misses.set(0);
        });
        log.info("CacheAnalytics 统计已重置。");
    }

    private double errorRate() {
        long ops = getTotalRequests() + sets.get();
        return ops == 0 ? 0.0 : (double) errors.get() / ops;
    }

    private void forMatching(String key, Consumer<PatternCounter> action) {
        if (tracked.isEmpty()) {
            return;
        }
        tracked.forEach((pattern, counter) -> {
            if (pattern.matches(key)) {
                action.accept(counter);
            }
        });
    }

    /**
     * 桶的轮换和计数在同一把锁内完成，计数不会落进已被其他线程轮换到新周期的桶。
     */
    private void recordInWindow(boolean hit) {
        long epoch = clock.millis() / bucketMillis;
        Bucket bucket = buckets[(int) (epoch % BUCKETS)];
        synchronized (bucket) {
            if (bucket.epoch != epoch) {
                bucket.reset(epoch);
            }
            if (hit) {
                bucket.hits++;
            } else {
                bucket.misses++;
            }
        }
    }

    private long[] windowCounts() {
        long epoch = clock.millis() / bucketMillis;
        long h = 0;
        long m = 0;
        for (Bucket bucket : buckets) {
            synchronized (bucket) {
                if (bucket.epoch >= 0 && epoch - bucket.epoch < BUCKETS) {
                    h += bucket.hits;
                    m += bucket.misses;
                }
            }
        }
        return new long[]{h, m};
    }

    /**
     * 所有字段只在持有该桶的锁时读写。
     */
    private static final class Bucket {
        long epoch = -1;
        long hits;
        long misses;

        void reset(long newEpoch) {
            epoch = newEpoch;
            hits = 0;
            misses = 0;
        }
    }

    private static final class PatternCounter {
        final AtomicLong hits = new AtomicLong();
        final AtomicLong misses = new AtomicLong();
    }
}
