package xyz.vvrf.reactor.flow.cache.invalidation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.flow.cache.CacheEntry;
import xyz.vvrf.reactor.flow.cache.FlowCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 缓存失效管理：
 * <ul>
 *     <li>命名触发器: 一个触发器对应一条或多条规则，每条规则给出若干键模式。</li>
 *     <li>按年龄: 删除创建时间早于给定时长的条目。</li>
 *     <li>按使用量: 优先淘汰命中次数最少 (其次最久未访问) 的条目。</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CacheInvalidator implements AutoCloseable {

    private final FlowCache cache;
    private final Clock clock;
    private final Map<String, List<InvalidationRule>> triggers = new ConcurrentHashMap<>();
    private final List<Disposable> scheduled = new CopyOnWriteArrayList<>();

    private final AtomicLong patternInvalidations = new AtomicLong();
    private final AtomicLong ageInvalidations = new AtomicLong();
    private final AtomicLong usageEvictions = new AtomicLong();
    private final AtomicLong triggersFired = new AtomicLong();

    public CacheInvalidator(FlowCache cache, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "FlowCache 不能为空");
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
    }

    /**
     * 注册固定模式的触发器，例如 {@code registerTrigger("mutation_updated", "mutation:*", "summary:*")}。
     */
    public void registerTrigger(String trigger, String... patterns) {
        List<String> fixed = Collections.unmodifiableList(Arrays.asList(patterns));
        registerRule(trigger, context -> fixed);
    }

    public void registerRule(String trigger, InvalidationRule rule) {
        Objects.requireNonNull(trigger, "触发器名称不能为空");
        Objects.requireNonNull(rule, "失效规则不能为空");
        triggers.computeIfAbsent(trigger, t -> new CopyOnWriteArrayList<>()).add(rule);
        log.debug("已为触发器 '{}' 注册失效规则。", trigger);
    }

    public Set<String> getTriggers() {
        return Collections.unmodifiableSet(triggers.keySet());
    }

    public int fire(String trigger) {
        return fire(trigger, Collections.emptyMap());
    }

    /**
     * 执行触发器下所有规则给出的模式失效 (重复模式只执行一次)。
     *
     * @return 删除的条目总数；未知触发器返回 0
     */
    public int fire(String trigger, Map<String, Object> context) {
        List<InvalidationRule> rules = triggers.get(trigger);
        if (rules == null || rules.isEmpty()) {
            log.warn("未注册的失效触发器: '{}'", trigger);
            return 0;
        }
        triggersFired.incrementAndGet();
        Set<String> patterns = new LinkedHashSet<>();
        for (InvalidationRule rule : rules) {
            List<String> produced = rule.patterns(context == null ? Collections.emptyMap() : context);
            if (produced != null) {
                patterns.addAll(produced);
            }
        }
        int removed = 0;
        for (String pattern : patterns) {
            removed += cache.invalidatePattern(pattern);
        }
        patternInvalidations.addAndGet(removed);
        log.info("触发器 '{}' 执行了 {} 个模式失效，共删除 {} 个条目。", trigger, patterns.size(), removed);
        return removed;
    }

    /**
     * 直接按模式失效，计入统计。
     */
    public int invalidatePattern(String pattern) {
        int removed = cache.invalidatePattern(pattern);
        patternInvalidations.addAndGet(removed);
        return removed;
    }

    /**
     * 删除年龄达到 maxAge 的条目。
     */
    public int invalidateOlderThan(Duration maxAge) {
        Instant now = clock.instant();
        int removed = 0;
        for (CacheEntry entry : cache.inspect("*")) {
            if (entry.age(now).compareTo(maxAge) >= 0 && cache.delete(entry.getKey())) {
                removed++;
            }
        }
        ageInvalidations.addAndGet(removed);
        if (removed > 0) {
            log.info("按年龄 (>= {}) 失效了 {} 个缓存条目。", maxAge, removed);
        }
        return removed;
    }

    /**
     * 淘汰命中次数低于 minHitCount 的条目，命中最少、最久未访问的优先，最多 maxEvictions 个。
     */
    public int evictLowHitEntries(long minHitCount, int maxEvictions) {
        List<CacheEntry> candidates = cache.inspect("*").stream()
                .filter(e -> e.getHitCount() < minHitCount)
                .sorted(leastUsedFirst())
                .limit(Math.max(0, maxEvictions))
                .collect(Collectors.toList());
        return evict(candidates, "低命中");
    }

    /**
     * 条目数超过 maxEntries 时按使用量淘汰多出的部分。
     */
    public int enforceCapacity(int maxEntries) {
        List<CacheEntry> all = cache.inspect("*");
        int excess = all.size() - maxEntries;
        if (excess <= 0) {
            return 0;
        }
        List<CacheEntry> victims = all.stream()
                .sorted(leastUsedFirst())
                .limit(excess)
                .collect(Collectors.toList());
        return evict(victims, "容量超限");
    }

    /**
     * 周期执行按年龄失效。
     */
    public void scheduleAgeSweep(Duration interval, Duration maxAge, Scheduler scheduler) {
        Disposable task = Flux.interval(interval, interval, scheduler)
                .subscribe(tick -> invalidateOlderThan(maxAge),
                        error -> log.error("按年龄失效的周期任务异常终止", error));
        scheduled.add(task);
        log.info("已调度按年龄失效任务: 间隔 {}, 最大年龄 {}", interval, maxAge);
    }

    public InvalidationStats getStats() {
        long p = patternInvalidations.get();
        long a = ageInvalidations.get();
        long u = usageEvictions.get();
        return InvalidationStats.builder()
                .patternInvalidations(p)
                .ageInvalidations(a)
                .usageEvictions(u)
                .totalInvalidations(p + a + u)
                .triggersFired(triggersFired.get())
                .build();
    }

    @Override
    public void close() {
        scheduled.forEach(Disposable::dispose);
        scheduled.clear();
    }

    private int evict(List<CacheEntry> victims, String reason) {
        int removed = 0;
        for (CacheEntry entry : victims) {
            if (cache.delete(entry.getKey())) {
                removed++;
            }
        }
        usageEvictions.addAndGet(removed);
        if (removed > 0) {
            log.info("因{}淘汰了 {} 个缓存条目。", reason, removed);
        }
        return removed;
    }

    private static Comparator<CacheEntry> leastUsedFirst() {
        return Comparator.comparingLong(CacheEntry::getHitCount)
                .thenComparingLong(CacheEntry::getLastAccessedAt);
    }
}
