package xyz.vvrf.reactor.flow.breaker;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按操作名懒创建熔断器的注册表。注册表自身只在创建时加锁，之后每个熔断器使用自己的锁。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CircuitBreakerRegistry {

    @Getter
    private final CircuitBreakerConfig defaultConfig;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, MetricsCollector metrics, Clock clock) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "默认熔断器配置不能为空");
        this.metrics = Objects.requireNonNull(metrics, "MetricsCollector 不能为空");
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
        defaultConfig.validate();
        log.info("CircuitBreakerRegistry 已初始化，默认配置: {}", defaultConfig);
    }

    public CircuitBreaker get(String name) {
        return get(name, defaultConfig);
    }

    /**
     * 获取或创建熔断器。已存在时忽略传入的配置。
     */
    public CircuitBreaker get(String name, CircuitBreakerConfig config) {
        Objects.requireNonNull(name, "熔断器名称不能为空");
        return breakers.computeIfAbsent(name, n -> {
            log.info("为操作 '{}' 创建熔断器。", n);
            return new CircuitBreaker(n, config, metrics, clock);
        });
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(breakers.keySet());
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("已重置全部 {} 个熔断器。", breakers.size());
    }

    public Map<String, CircuitBreakerStats> getAllStats() {
        Map<String, CircuitBreakerStats> stats = new TreeMap<>();
        breakers.forEach((name, breaker) -> stats.put(name, breaker.getStats()));
        return Collections.unmodifiableMap(stats);
    }
}
