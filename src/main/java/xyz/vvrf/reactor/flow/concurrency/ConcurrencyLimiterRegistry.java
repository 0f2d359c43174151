package xyz.vvrf.reactor.flow.concurrency;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 按操作名懒创建 {@link ConcurrencyLimiter} 的注册表。
 * <p>
 * 上限取值顺序：{@link #reset(String, Integer)} 设置的上限，其次是按操作名配置的上限，最后是默认上限。
 * 上限为 0 的操作不受限制，调用直接执行。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ConcurrencyLimiterRegistry {

    @Getter
    private final int defaultLimit;
    private final Map<String, Integer> configuredLimits;
    private final MetricsCollector metrics;
    private final Map<String, ConcurrencyLimiter> limiters = new ConcurrentHashMap<>();

    /**
     * @param defaultLimit     未单独配置的操作使用的上限，0 表示不限制
     * @param configuredLimits 按操作名配置的上限，值为 0 表示不限制
     * @param metrics          限制器写入指标使用
     */
    public ConcurrencyLimiterRegistry(int defaultLimit, Map<String, Integer> configuredLimits, MetricsCollector metrics) {
        if (defaultLimit < 0) {
            throw new IllegalArgumentException("默认并发上限不能为负数: " + defaultLimit);
        }
        this.defaultLimit = defaultLimit;
        this.configuredLimits = new ConcurrentHashMap<>();
        if (configuredLimits != null) {
            configuredLimits.forEach((name, limit) -> {
                if (limit == null || limit < 0) {
                    throw new IllegalArgumentException(String.format("操作 '%s' 的并发上限无效: %s", name, limit));
                }
                this.configuredLimits.put(name, limit);
            });
        }
        this.metrics = Objects.requireNonNull(metrics, "MetricsCollector 不能为空");
        log.info("ConcurrencyLimiterRegistry 已初始化。默认上限: {}, 单独配置: {}",
                defaultLimit == 0 ? "不限制" : defaultLimit, this.configuredLimits);
    }

    /**
     * 不限制任何操作的注册表。
     */
    public static ConcurrencyLimiterRegistry unlimited(MetricsCollector metrics) {
        return new ConcurrencyLimiterRegistry(0, Collections.emptyMap(), metrics);
    }

    /**
     * 获取或创建操作的限制器；操作不受限制时返回 empty。
     */
    public Optional<ConcurrencyLimiter> get(String operation) {
        Objects.requireNonNull(operation, "操作名不能为空");
        int limit = limitOf(operation);
        if (limit == 0) {
            return Optional.empty();
        }
        return Optional.of(limiters.computeIfAbsent(operation, name -> {
            log.info("为操作 '{}' 创建并发限制器，上限: {}", name, limit);
            return new ConcurrencyLimiter(name, limit, metrics);
        }));
    }

    public Optional<ConcurrencyLimiter> find(String operation) {
        return Optional.ofNullable(limiters.get(operation));
    }

    public int limitOf(String operation) {
        return configuredLimits.getOrDefault(operation, defaultLimit);
    }

    public <T> T call(String operation, Callable<T> callable) throws Exception {
        Optional<ConcurrencyLimiter> limiter = get(operation);
        return limiter.isPresent() ? limiter.get().call(callable) : callable.call();
    }

    public <T> Mono<T> callAsync(String operation, Supplier<Mono<T>> supplier) {
        Optional<ConcurrencyLimiter> limiter = get(operation);
        return limiter.isPresent() ? limiter.get().callAsync(supplier) : Mono.defer(supplier);
    }

    /**
     * 丢弃操作当前的限制器。newLimit 不为 null 时之后按新上限重新创建 (0 表示不再限制)。
     * 旧限制器上已分到的名额仍归还给旧限制器，不占用新限制器的名额。
     */
    public void reset(String operation, Integer newLimit) {
        Objects.requireNonNull(operation, "操作名不能为空");
        if (newLimit != null && newLimit < 0) {
            throw new IllegalArgumentException(String.format("操作 '%s' 的并发上限无效: %s", operation, newLimit));
        }
        ConcurrencyLimiter removed = limiters.remove(operation);
        if (newLimit != null) {
            configuredLimits.put(operation, newLimit);
        }
        log.info("已重置操作 '{}' 的并发限制器 (原有: {}, 新上限: {})。",
                operation, removed != null ? removed.getLimit() : "无", newLimit != null ? newLimit : "不变");
    }

    /**
     * 丢弃全部限制器，之后按配置重新创建。
     */
    public void clear() {
        int size = limiters.size();
        limiters.clear();
        log.info("已清除全部 {} 个并发限制器。", size);
    }

    /**
     * 当前已创建限制器的统计，按操作名排序。
     */
    public Map<String, ConcurrencyStats> getAllStats() {
        Map<String, ConcurrencyStats> stats = new TreeMap<>();
        limiters.forEach((name, limiter) -> stats.put(name, limiter.getStats()));
        return Collections.unmodifiableMap(stats);
    }

    /**
     * 汇总信息：已创建的限制器数量和每个限制器的统计。
     */
    public Map<String, Object> getInfo() {
        Map<String, ConcurrencyStats> stats = getAllStats();
        Map<String, Object> info = new HashMap<>();
        info.put("limiter_count", stats.size());
        info.put("default_limit", defaultLimit);
        info.put("limiters", stats);
        return Collections.unmodifiableMap(info);
    }
}
