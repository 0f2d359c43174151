package xyz.vvrf.reactor.flow.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.cache.analytics.CacheAnalytics;
import xyz.vvrf.reactor.flow.cache.backend.CacheBackend;
import xyz.vvrf.reactor.flow.cache.backend.LocalCacheBackend;
import xyz.vvrf.reactor.flow.exception.CacheBackendException;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 带 TTL、命中统计、模式失效和后端降级的缓存。同步与异步执行模式共用同一个实例。
 * <p>
 * 有网络后端 (primary) 时优先使用它；一旦它抛出 {@link CacheBackendException}，
 * 缓存切换到本地 Caffeine 后端 (降级模式)，并按 healthCheckInterval 周期探测网络后端，恢复后切回。
 * 降级期间执行的模式失效会在恢复时补发到网络后端。后端错误只记录日志和统计，从不抛给调用方。
 * <p>
 * 对同一个键的读改写 (命中计数更新、写入) 通过分段锁串行化。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class FlowCache implements AutoCloseable {

    static final String METRIC_REQUESTS = "cache.requests";
    static final String METRIC_SETS = "cache.sets";
    static final String METRIC_ERRORS = "cache.errors";
    static final String METRIC_INVALIDATIONS = "cache.invalidations";
    static final String METRIC_DEGRADED = "cache.degraded";

    private static final int STRIPES = 64;

    private final CacheBackend primary;
    private final LocalCacheBackend local;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MetricsCollector metrics;
    @Getter
    private final CacheAnalytics analytics;
    @Getter
    private final String keyPrefix;
    @Getter
    private final Duration defaultTtl;
    private final Duration healthCheckInterval;
    private final Scheduler ioScheduler;

    private final Object[] stripes = new Object[STRIPES];
    private final AtomicBoolean degraded = new AtomicBoolean(false);
    private final Set<String> pendingInvalidations = ConcurrentHashMap.newKeySet();
    private volatile long lastHealthCheckMillis;
    private volatile Disposable sweeper;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();

    /**
     * @param primary             网络后端，可为 null (只用本地后端)
     * @param local               本地后端，必填
     * @param keyPrefix           命名空间，存储键为 {@code keyPrefix:key}；为空时不加前缀
     * @param defaultTtl          set 未指定 TTL 时使用，默认 1 小时
     * @param healthCheckInterval 降级后探测网络后端的间隔，默认 30 秒
     * @param ioScheduler         异步方法执行阻塞后端调用的调度器，默认 boundedElastic
     */
    @Builder
    private FlowCache(CacheBackend primary,
                      LocalCacheBackend local,
                      ObjectMapper objectMapper,
                      Clock clock,
                      MetricsCollector metrics,
                      CacheAnalytics analytics,
                      String keyPrefix,
                      Duration defaultTtl,
                      Duration healthCheckInterval,
                      Scheduler ioScheduler) {
        this.primary = primary;
        this.local = Objects.requireNonNull(local, "本地缓存后端不能为空");
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.metrics = Objects.requireNonNull(metrics, "MetricsCollector 不能为空");
        this.analytics = analytics != null ? analytics : new CacheAnalytics(Duration.ofMinutes(5), this.clock);
        this.keyPrefix = (keyPrefix == null || keyPrefix.isEmpty()) ? "" : keyPrefix + ":";
        this.defaultTtl = defaultTtl != null ? defaultTtl : Duration.ofHours(1);
        this.healthCheckInterval = healthCheckInterval != null ? healthCheckInterval : Duration.ofSeconds(30);
        this.ioScheduler = ioScheduler != null ? ioScheduler : Schedulers.boundedElastic();
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new Object();
        }
        metrics.setGauge(METRIC_DEGRADED, 0, Collections.emptyMap());
        log.info("FlowCache 已初始化。主后端: {}, 本地后端: {}, 键前缀: '{}', 默认 TTL: {}, 健康检查间隔: {}",
                primary == null ? "无" : primary.getName(), local.getName(), this.keyPrefix, this.defaultTtl, this.healthCheckInterval);
    }

    // ---------------------------------------------------------------- 读写

    /**
     * 读取未过期的条目并更新其命中次数和最近访问时间。缺失、过期、后端故障或类型不匹配都返回空。
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Objects.requireNonNull(key, "缓存键不能为空");
        Objects.requireNonNull(type, "值类型不能为空");
        String storageKey = storageKey(key);
        Instant now = clock.instant();

        CacheEntry entry;
        synchronized (stripeFor(storageKey)) {
            entry = readEntry(storageKey);
            if (entry == null) {
                recordMiss(key);
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                withBackend(b -> b.delete(storageKey), false);
                expired.incrementAndGet();
                log.debug("缓存条目 '{}' 已过期 (存活 {})", key, entry.age(now));
                recordMiss(key);
                return Optional.empty();
            }
            entry.touch(now);
            writeEntry(storageKey, entry, entry.remainingTtl(now));
        }

        try {
            T value = objectMapper.treeToValue(entry.getValue(), type);
            recordHit(key);
            return Optional.ofNullable(value);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            recordError("convert", key, e);
            recordMiss(key);
            return Optional.empty();
        }
    }

    public boolean set(String key, Object value) {
        return set(key, value, defaultTtl);
    }

    /**
     * 写入条目。ttl 为 null 时使用默认 TTL；零或负数表示永不过期。
     *
     * @return 是否写入成功
     */
    public boolean set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "缓存键不能为空");
        Objects.requireNonNull(value, "缓存值不能为空");
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        String storageKey = storageKey(key);

        JsonNode node;
        try {
            node = objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            recordError("serialize", key, e);
            return false;
        }
        CacheEntry entry = new CacheEntry(key, node, clock.instant(), effectiveTtl);
        boolean written;
        synchronized (stripeFor(storageKey)) {
            written = writeEntry(storageKey, entry, entry.hasTtl() ? effectiveTtl : null);
        }
        if (written) {
            sets.incrementAndGet();
            analytics.recordSet();
            metrics.increment(METRIC_SETS, Collections.emptyMap());
        }
        return written;
    }

    public boolean delete(String key) {
        String storageKey = storageKey(key);
        boolean removed;
        synchronized (stripeFor(storageKey)) {
            removed = withBackend(b -> b.delete(storageKey), false);
        }
        if (removed) {
            deletes.incrementAndGet();
        }
        return removed;
    }

    /**
     * 是否存在未过期的条目。不影响命中统计。
     */
    public boolean containsKey(String key) {
        CacheEntry entry = readEntry(storageKey(key));
        return entry != null && !entry.isExpired(clock.instant());
    }

    /**
     * 删除所有匹配模式的键。支持 {@code *}/{@code ?} 通配，无通配符时按前缀匹配。
     *
     * @return 删除的条目数
     */
    public int invalidatePattern(String pattern) {
        KeyPattern storagePattern = KeyPattern.of(pattern).withPrefix(keyPrefix);
        if (primary != null && degraded.get()) {
            pendingInvalidations.add(pattern);
        }
        int removed = deleteMatching(storagePattern);
        invalidations.addAndGet(removed);
        metrics.increment(METRIC_INVALIDATIONS, removed, Collections.emptyMap());
        log.info("按模式 '{}' 失效了 {} 个缓存条目。", pattern, removed);
        return removed;
    }

    public int clear() {
        return invalidatePattern("*");
    }

    /**
     * 匹配模式的未过期条目快照，不影响命中统计。
     */
    public List<CacheEntry> inspect(String pattern) {
        Instant now = clock.instant();
        Set<String> keys = withBackend(b -> b.keys(KeyPattern.of(pattern).withPrefix(keyPrefix)), Collections.emptySet());
        List<CacheEntry> entries = new ArrayList<>(keys.size());
        for (String storageKey : keys) {
            CacheEntry entry = readEntry(storageKey);
            if (entry != null && !entry.isExpired(now)) {
                entries.add(entry);
            }
        }
        return entries;
    }

    public int size() {
        return inspect("*").size();
    }

    /**
     * 清理所有已过期条目。
     *
     * @return 清理的条目数
     */
    public int reapExpired() {
        Instant now = clock.instant();
        Set<String> keys = withBackend(b -> b.keys(KeyPattern.of("*").withPrefix(keyPrefix)), Collections.emptySet());
        int reaped = 0;
        for (String storageKey : keys) {
            synchronized (stripeFor(storageKey)) {
                CacheEntry entry = readEntry(storageKey);
                if (entry != null && entry.isExpired(now) && withBackend(b -> b.delete(storageKey), false)) {
                    reaped++;
                }
            }
        }
        if (reaped > 0) {
            expired.addAndGet(reaped);
            log.debug("清理了 {} 个过期缓存条目。", reaped);
        }
        return reaped;
    }

    /**
     * 批量写入。
     *
     * @return 写入成功的条目数
     */
    public int warm(Map<String, ?> values, Duration ttl) {
        int ok = 0;
        for (Map.Entry<String, ?> e : values.entrySet()) {
            if (e.getValue() != null && set(e.getKey(), e.getValue(), ttl)) {
                ok++;
            }
        }
        log.info("批量预热写入 {}/{} 个缓存条目。", ok, values.size());
        return ok;
    }

    /**
     * 命中直接返回，否则调用 loader 并把结果写入缓存。loader 抛出的异常原样传播。
     */
    public <T> T getOrLoad(String key, Class<T> type, Duration ttl, Supplier<T> loader) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = loader.get();
        if (value != null) {
            set(key, value, ttl);
        }
        return value;
    }

    // ---------------------------------------------------------------- 异步

    public <T> Mono<Optional<T>> getAsync(String key, Class<T> type) {
        return Mono.fromCallable(() -> get(key, type)).subscribeOn(ioScheduler);
    }

    public Mono<Boolean> setAsync(String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> set(key, value, ttl)).subscribeOn(ioScheduler);
    }

    public Mono<Boolean> deleteAsync(String key) {
        return Mono.fromCallable(() -> delete(key)).subscribeOn(ioScheduler);
    }

    public Mono<Boolean> containsKeyAsync(String key) {
        return Mono.fromCallable(() -> containsKey(key)).subscribeOn(ioScheduler);
    }

    public Mono<Integer> invalidatePatternAsync(String pattern) {
        return Mono.fromCallable(() -> invalidatePattern(pattern)).subscribeOn(ioScheduler);
    }

    public <T> Mono<T> getOrLoadAsync(String key, Class<T> type, Duration ttl, Supplier<Mono<T>> loader) {
        return getAsync(key, type).flatMap(cached -> cached
                .map(Mono::just)
                .orElseGet(() -> Mono.defer(loader)
                        .flatMap(value -> setAsync(key, value, ttl).thenReturn(value))));
    }

    // ---------------------------------------------------------------- 生命周期与统计

    /**
     * 启动后台过期清理任务。重复调用会替换之前的任务。
     */
    public synchronized void startSweeper(Duration interval) {
        stopSweeper();
        sweeper = Flux.interval(interval, interval, ioScheduler)
                .subscribe(tick -> reapExpired(),
                        error -> log.error("缓存过期清理任务异常终止", error));
        log.info("缓存过期清理任务已启动，间隔: {}", interval);
    }

    public synchronized void stopSweeper() {
        if (sweeper != null) {
            sweeper.dispose();
            sweeper = null;
        }
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public CacheStats getStats() {
        return CacheStats.builder()
                .hits(hits.get())
                .misses(misses.get())
                .sets(sets.get())
                .deletes(deletes.get())
                .errors(errors.get())
                .invalidations(invalidations.get())
                .expired(expired.get())
                .degraded(degraded.get())
                .activeBackend(currentBackend().getName())
                .build();
    }

    @Override
    public void close() {
        stopSweeper();
        log.info("FlowCache 已关闭。统计: {}", getStats());
    }

    // ---------------------------------------------------------------- 内部

    private String storageKey(String key) {
        return keyPrefix + key;
    }

    private Object stripeFor(String storageKey) {
        return stripes[(storageKey.hashCode() & 0x7fffffff) % STRIPES];
    }

    private int deleteMatching(KeyPattern storagePattern) {
        Set<String> keys = withBackend(b -> b.keys(storagePattern), Collections.emptySet());
        int removed = 0;
        for (String storageKey : keys) {
            synchronized (stripeFor(storageKey)) {
                if (withBackend(b -> b.delete(storageKey), false)) {
                    removed++;
                }
            }
        }
        return removed;
    }

    private CacheEntry readEntry(String storageKey) {
        Optional<byte[]> raw = withBackend(b -> b.get(storageKey), Optional.empty());
        if (!raw.isPresent()) {
            return null;
        }
        try {
            return objectMapper.readValue(raw.get(), CacheEntry.class);
        } catch (IOException e) {
            recordError("decode", storageKey, e);
            withBackend(b -> b.delete(storageKey), false);
            return null;
        }
    }

    private boolean writeEntry(String storageKey, CacheEntry entry, Duration ttl) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            recordError("encode", storageKey, e);
            return false;
        }
        return withBackend(b -> {
            b.set(storageKey, bytes, ttl);
            return true;
        }, false);
    }

    /**
     * 在当前生效的后端上执行操作。网络后端失败时切换到本地后端重试一次；本地后端也失败时返回 onFailure。
     */
    private <R> R withBackend(Function<CacheBackend, R> operation, R onFailure) {
        CacheBackend backend = currentBackend();
        try {
            return operation.apply(backend);
        } catch (CacheBackendException e) {
            recordError("backend", backend.getName(), e);
            if (backend == local) {
                return onFailure;
            }
            enterDegraded(e);
            try {
                return operation.apply(local);
            } catch (CacheBackendException fallbackError) {
                recordError("backend", local.getName(), fallbackError);
                return onFailure;
            }
        }
    }

    private CacheBackend currentBackend() {
        if (primary == null) {
            return local;
        }
        if (degraded.get()) {
            checkPrimaryHealth();
            if (degraded.get()) {
                return local;
            }
        }
        return primary;
    }

    private void checkPrimaryHealth() {
        long now = clock.millis();
        if (now - lastHealthCheckMillis < healthCheckInterval.toMillis()) {
            return;
        }
        lastHealthCheckMillis = now;
        if (primary.ping() && degraded.compareAndSet(true, false)) {
            metrics.setGauge(METRIC_DEGRADED, 0, Collections.emptyMap());
            log.info("缓存后端 '{}' 已恢复，退出降级模式。", primary.getName());
            replayPendingInvalidations();
        }
    }

    private void enterDegraded(CacheBackendException cause) {
        lastHealthCheckMillis = clock.millis();
        if (degraded.compareAndSet(false, true)) {
            metrics.setGauge(METRIC_DEGRADED, 1, Collections.emptyMap());
            log.warn("缓存后端 '{}' 不可用，进入降级模式，改用本地后端 '{}': {}",
                    primary.getName(), local.getName(), cause.getMessage());
        }
    }

    private void replayPendingInvalidations() {
        if (pendingInvalidations.isEmpty()) {
            return;
        }
        List<String> patterns = new ArrayList<>(pendingInvalidations);
        pendingInvalidations.removeAll(patterns);
        for (String pattern : patterns) {
            try {
                int removed = 0;
                for (String storageKey : primary.keys(KeyPattern.of(pattern).withPrefix(keyPrefix))) {
                    if (primary.delete(storageKey)) {
                        removed++;
                    }
                }
                log.info("恢复后向后端 '{}' 补发模式失效 '{}'，删除 {} 个条目。", primary.getName(), pattern, removed);
            } catch (CacheBackendException e) {
                pendingInvalidations.add(pattern);
                recordError("replay", pattern, e);
            }
        }
    }

    private void recordHit(String key) {
        hits.incrementAndGet();
        analytics.recordHit(key);
        metrics.increment(METRIC_REQUESTS, MetricsCollector.tags("result", "hit"));
    }

    private void recordMiss(String key) {
        misses.incrementAndGet();
        analytics.recordMiss(key);
        metrics.increment(METRIC_REQUESTS, MetricsCollector.tags("result", "miss"));
    }

    private void recordError(String operation, String key, Exception e) {
        errors.incrementAndGet();
        analytics.recordError();
        metrics.increment(METRIC_ERRORS, MetricsCollector.tags("operation", operation));
        log.warn("缓存操作 '{}' 失败 (key: {}): {}", operation, key, e.toString());
    }
}
