package xyz.vvrf.reactor.flow.cache.warming;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.flow.cache.FlowCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 按策略预热缓存。策略按优先级升序依次执行，同一策略内的键以不超过 maxConcurrency 的并发加载。
 * 已缓存的键跳过；单个键加载失败只记录日志，不影响其他键。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CacheWarmer implements AutoCloseable {

    private enum Outcome { SUCCESS, FAILED, SKIPPED }

    private final FlowCache cache;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Map<String, WarmingStrategy> strategies = new ConcurrentHashMap<>();
    private final List<Disposable> periodicTasks = new CopyOnWriteArrayList<>();

    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private volatile Instant lastWarmingTime;
    private volatile Duration lastWarmingDuration;

    public CacheWarmer(FlowCache cache, Scheduler scheduler, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "FlowCache 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "调度器不能为空");
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
    }

    public void register(WarmingStrategy strategy) {
        Objects.requireNonNull(strategy, "预热策略不能为空");
        if (strategy.getMaxConcurrency() < 1) {
            throw new IllegalArgumentException("预热策略 '" + strategy.getName() + "' 的 maxConcurrency 必须 >= 1");
        }
        if (strategy.getSchedule() == WarmingSchedule.PERIODIC
                && (strategy.getPeriod() == null || strategy.getPeriod().isZero() || strategy.getPeriod().isNegative())) {
            throw new IllegalArgumentException("周期预热策略 '" + strategy.getName() + "' 必须配置正的 period");
        }
        if (strategies.putIfAbsent(strategy.getName(), strategy) != null) {
            throw new IllegalArgumentException("预热策略名称重复: " + strategy.getName());
        }
        log.info("已注册缓存预热策略: {}", strategy);
    }

    public List<WarmingStrategy> getStrategies() {
        List<WarmingStrategy> sorted = new ArrayList<>(strategies.values());
        sorted.sort(Comparator.comparingInt(WarmingStrategy::getPriority).thenComparing(WarmingStrategy::getName));
        return sorted;
    }

    /**
     * 按优先级依次执行全部策略。
     */
    public Mono<List<WarmingResult>> warmAll() {
        return warm(getStrategies());
    }

    /**
     * 执行 STARTUP 策略，并为 PERIODIC 策略启动周期任务。
     */
    public Mono<List<WarmingResult>> start() {
        List<WarmingStrategy> startup = new ArrayList<>();
        for (WarmingStrategy s : getStrategies()) {
            if (s.getSchedule() == WarmingSchedule.STARTUP) {
                startup.add(s);
            } else if (s.getSchedule() == WarmingSchedule.PERIODIC) {
                schedulePeriodic(s);
            }
        }
        return warm(startup);
    }

    public Mono<WarmingResult> warmStrategy(String name) {
        return Mono.defer(() -> {
            WarmingStrategy strategy = strategies.get(name);
            if (strategy == null) {
                return Mono.error(new IllegalArgumentException("未知的预热策略: " + name));
            }
            return runStrategy(strategy);
        });
    }

    public WarmingStats getStats() {
        return WarmingStats.builder()
                .successful(successful.get())
                .failed(failed.get())
                .skipped(skipped.get())
                .totalWarmed(successful.get())
                .lastWarmingTime(lastWarmingTime)
                .lastWarmingDuration(lastWarmingDuration)
                .build();
    }

    @Override
    public void close() {
        periodicTasks.forEach(Disposable::dispose);
        periodicTasks.clear();
    }

    private Mono<List<WarmingResult>> warm(List<WarmingStrategy> ordered) {
        return Mono.defer(() -> {
            Instant start = clock.instant();
            long startNanos = System.nanoTime();
            return Flux.fromIterable(ordered)
                    .concatMap(this::runStrategy)
                    .collectList()
                    .doOnSuccess(results -> {
                        lastWarmingTime = start;
                        lastWarmingDuration = Duration.ofNanos(System.nanoTime() - startNanos);
                        log.info("缓存预热完成: {} 个策略, 耗时 {} ms, 累计统计: {}",
                                results.size(), lastWarmingDuration.toMillis(), getStats());
                    });
        });
    }

    private Mono<WarmingResult> runStrategy(WarmingStrategy strategy) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            log.debug("开始执行预热策略 '{}' ({} 个键, 并发 {})",
                    strategy.getName(), strategy.getKeys().size(), strategy.getMaxConcurrency());
            return Flux.fromIterable(strategy.getKeys())
                    .flatMap(key -> warmKey(strategy, key), strategy.getMaxConcurrency())
                    .collectList()
                    .map(outcomes -> {
                        int ok = 0;
                        int bad = 0;
                        int skip = 0;
                        for (Outcome o : outcomes) {
                            if (o == Outcome.SUCCESS) {
                                ok++;
                            } else if (o == Outcome.FAILED) {
                                bad++;
                            } else {
                                skip++;
                            }
                        }
                        WarmingResult result = new WarmingResult(strategy.getName(), ok, bad, skip,
                                Duration.ofNanos(System.nanoTime() - startNanos));
                        log.info("预热策略 '{}' 完成: 成功 {}, 失败 {}, 跳过 {}", strategy.getName(), ok, bad, skip);
                        return result;
                    });
        });
    }

    private Mono<Outcome> warmKey(WarmingStrategy strategy, String key) {
        return cache.containsKeyAsync(key)
                .flatMap(exists -> {
                    if (exists) {
                        skipped.incrementAndGet();
                        return Mono.just(Outcome.SKIPPED);
                    }
                    return Mono.defer(() -> strategy.getLoader().load(key))
                            .flatMap(value -> cache.setAsync(key, value, strategy.getTtl()))
                            .map(written -> written ? Outcome.SUCCESS : Outcome.FAILED)
                            .defaultIfEmpty(Outcome.FAILED)
                            .doOnNext(o -> {
                                if (o == Outcome.SUCCESS) {
                                    successful.incrementAndGet();
                                } else {
                                    failed.incrementAndGet();
                                    log.warn("预热策略 '{}' 未能写入键 '{}'", strategy.getName(), key);
                                }
                            });
                })
                .onErrorResume(error -> {
                    failed.incrementAndGet();
                    log.warn("预热策略 '{}' 加载键 '{}' 失败: {}", strategy.getName(), key, error.toString());
                    return Mono.just(Outcome.FAILED);
                });
    }

    private void schedulePeriodic(WarmingStrategy strategy) {
        Disposable task = Flux.interval(strategy.getPeriod(), strategy.getPeriod(), scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> runStrategy(strategy))
                .subscribe(result -> log.debug("周期预热 '{}' 完成: {}", strategy.getName(), result),
                        error -> log.error("周期预热任务 '{}' 异常终止", strategy.getName(), error));
        periodicTasks.add(task);
        log.info("周期预热策略 '{}' 已调度，周期: {}", strategy.getName(), strategy.getPeriod());
    }
}
