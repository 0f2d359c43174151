package xyz.vvrf.reactor.flow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.HistogramSnapshot;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 Micrometer {@link MeterRegistry} 的指标采集器：计数器、仪表和带分位数的分布统计。
 * <p>
 * 未注入 registry 时使用独立的 {@link SimpleMeterRegistry}；注入宿主应用的 registry 后，
 * 熔断器、重试和缓存的指标直接进入宿主的监控系统。分位数 (p50/p95/p99) 由 Micrometer 的
 * 客户端分位数直方图在滑动时间窗内计算，窗口由 bufferLength 个桶组成，整体在 expiry 后过期。
 * <p>
 * 线程安全，由 {@link xyz.vvrf.reactor.flow.runtime.FlowRuntime} 持有单例并注入到各组件。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MetricsCollector {

    public static final int DEFAULT_HISTOGRAM_BUFFER_LENGTH = 3;
    public static final Duration DEFAULT_HISTOGRAM_EXPIRY = Duration.ofMinutes(2);
    public static final int DEFAULT_RECENT_SAMPLES = 10000;

    private static final double[] PERCENTILES = {0.5, 0.95, 0.99};
    private static final int PERCENTILE_PRECISION = 3;

    @Getter
    private final MeterRegistry registry;
    private final int histogramBufferLength;
    private final Duration histogramExpiry;
    private final int recentSampleLimit;
    private final Clock clock;

    private final ConcurrentMap<MetricKey, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<MetricKey, AtomicLong> gauges = new ConcurrentHashMap<>();
    private final ConcurrentMap<MetricKey, DistributionSummary> summaries = new ConcurrentHashMap<>();
    private final ConcurrentMap<MetricKey, Timer> timers = new ConcurrentHashMap<>();
    /**
     * 本采集器注册过的 Meter，快照只覆盖这些，宿主 registry 里的其他 Meter 不参与。
     */
    private final Set<Meter.Id> ownMeters = ConcurrentHashMap.newKeySet();
    private final Deque<MetricSample> recentSamples = new ArrayDeque<>();

    public MetricsCollector() {
        this(new SimpleMeterRegistry(), Clock.systemUTC());
    }

    public MetricsCollector(MeterRegistry registry, Clock clock) {
        this(registry, DEFAULT_HISTOGRAM_BUFFER_LENGTH, DEFAULT_HISTOGRAM_EXPIRY, DEFAULT_RECENT_SAMPLES, clock);
    }

    public MetricsCollector(MeterRegistry registry, int histogramBufferLength, Duration histogramExpiry,
                            int recentSampleLimit, Clock clock) {
        if (histogramBufferLength < 1) {
            throw new IllegalArgumentException("histogramBufferLength 必须 >= 1");
        }
        if (histogramExpiry == null || histogramExpiry.isZero() || histogramExpiry.isNegative()) {
            throw new IllegalArgumentException("histogramExpiry 必须为正数");
        }
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
        this.histogramBufferLength = histogramBufferLength;
        this.histogramExpiry = histogramExpiry;
        this.recentSampleLimit = Math.max(0, recentSampleLimit);
        this.clock = clock != null ? clock : Clock.systemUTC();
        log.info("MetricsCollector 已初始化。MeterRegistry: {}, 分位数窗口: {} 个桶 / {}, 最近样本上限: {}",
                this.registry.getClass().getSimpleName(), histogramBufferLength, histogramExpiry, this.recentSampleLimit);
    }

    /**
     * 由成对的键值构造标签 Map，例如 {@code tags("node", "fetch", "status", "success")}。
     */
    public static Map<String, String> tags(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("标签参数必须成对出现");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    public void increment(String name, Map<String, String> tags) {
        increment(name, 1.0, tags);
    }

    public void increment(String name, double amount, Map<String, String> tags) {
        MetricKey key = MetricKey.of(name, tags);
        counters.computeIfAbsent(key, k -> own(Counter.builder(k.getName())
                .tags(toTags(k))
                .register(registry))).increment(amount);
        remember(key, MetricSample.Type.COUNTER, amount);
    }

    public void setGauge(String name, double value, Map<String, String> tags) {
        MetricKey key = MetricKey.of(name, tags);
        gauges.computeIfAbsent(key, k -> {
            AtomicLong holder = new AtomicLong(Double.doubleToLongBits(0.0));
            own(Gauge.builder(k.getName(), holder, h -> Double.longBitsToDouble(h.get()))
                    .tags(toTags(k))
                    .strongReference(true)
                    .register(registry));
            return holder;
        }).set(Double.doubleToLongBits(value));
        remember(key, MetricSample.Type.GAUGE, value);
    }

    public void observe(String name, double value, Map<String, String> tags) {
        MetricKey key = MetricKey.of(name, tags);
        summaries.computeIfAbsent(key, k -> own(DistributionSummary.builder(k.getName())
                .tags(toTags(k))
                .publishPercentiles(PERCENTILES)
                .percentilePrecision(PERCENTILE_PRECISION)
                .distributionStatisticBufferLength(histogramBufferLength)
                .distributionStatisticExpiry(histogramExpiry)
                .register(registry))).record(value);
        remember(key, MetricSample.Type.HISTOGRAM, value);
    }

    /**
     * 开始一次作用域计时，见 {@link MetricsTimer}。
     */
    public MetricsTimer timer(String name, Map<String, String> tags) {
        return new MetricsTimer(this, name, tags == null ? Collections.emptyMap() : tags, Timer.start(registry));
    }

    /**
     * 计时执行 callable，成功/失败分别计数。异常原样抛出。
     */
    public <T> T time(String name, Map<String, String> tags, Callable<T> callable) throws Exception {
        try (MetricsTimer timer = timer(name, tags)) {
            T result = callable.call();
            timer.success();
            return result;
        }
    }

    void stopTimer(Timer.Sample sample, String name, Map<String, String> tags) {
        MetricKey key = MetricKey.of(name, tags);
        Timer timer = timers.computeIfAbsent(key, k -> own(Timer.builder(k.getName())
                .tags(toTags(k))
                .publishPercentiles(PERCENTILES)
                .percentilePrecision(PERCENTILE_PRECISION)
                .distributionStatisticBufferLength(histogramBufferLength)
                .distributionStatisticExpiry(histogramExpiry)
                .register(registry)));
        long nanos = sample.stop(timer);
        remember(key, MetricSample.Type.HISTOGRAM, nanos / 1_000_000_000.0);
    }

    public double getCounter(String name, Map<String, String> tags) {
        Counter counter = counters.get(MetricKey.of(name, tags));
        return counter == null ? 0.0 : counter.count();
    }

    public Optional<Double> getGauge(String name, Map<String, String> tags) {
        AtomicLong holder = gauges.get(MetricKey.of(name, tags));
        return holder == null ? Optional.empty() : Optional.of(Double.longBitsToDouble(holder.get()));
    }

    /**
     * 分布统计或计时器的当前汇总；计时器的数值单位为秒。
     */
    public Optional<HistogramSummary> getHistogram(String name, Map<String, String> tags) {
        MetricKey key = MetricKey.of(name, tags);
        DistributionSummary summary = summaries.get(key);
        if (summary != null) {
            return Optional.of(summarize(summary.takeSnapshot(), null));
        }
        Timer timer = timers.get(key);
        return timer == null ? Optional.empty() : Optional.of(summarize(timer.takeSnapshot(), TimeUnit.SECONDS));
    }

    /**
     * 最近的原始观测点，按时间从旧到新，最多 limit 个。
     */
    public List<MetricSample> recentSamples(int limit) {
        synchronized (recentSamples) {
            List<MetricSample> all = new ArrayList<>(recentSamples);
            int from = Math.max(0, all.size() - limit);
            return Collections.unmodifiableList(new ArrayList<>(all.subList(from, all.size())));
        }
    }

    /**
     * 遍历 registry 中由本采集器注册的 Meter 生成快照，不修改任何已记录的值。
     */
    public MetricsSnapshot snapshot() {
        TreeMap<MetricKey, Double> c = new TreeMap<>();
        TreeMap<MetricKey, Double> g = new TreeMap<>();
        TreeMap<MetricKey, HistogramSummary> h = new TreeMap<>();
        for (Meter meter : registry.getMeters()) {
            if (!ownMeters.contains(meter.getId())) {
                continue;
            }
            MetricKey key = keyOf(meter.getId());
            if (meter instanceof Counter) {
                c.put(key, ((Counter) meter).count());
            } else if (meter instanceof Gauge) {
                g.put(key, ((Gauge) meter).value());
            } else if (meter instanceof DistributionSummary) {
                h.put(key, summarize(((DistributionSummary) meter).takeSnapshot(), null));
            } else if (meter instanceof Timer) {
                h.put(key, summarize(((Timer) meter).takeSnapshot(), TimeUnit.SECONDS));
            }
        }
        return new MetricsSnapshot(clock.instant(), c, g, h);
    }

    /**
     * 从 registry 中移除本采集器注册的全部 Meter 并清空最近样本。
     */
    public void reset() {
        for (Meter.Id id : ownMeters) {
            registry.remove(id);
        }
        ownMeters.clear();
        counters.clear();
        gauges.clear();
        summaries.clear();
        timers.clear();
        synchronized (recentSamples) {
            recentSamples.clear();
        }
        log.info("MetricsCollector 已重置所有指标。");
    }

    private <M extends Meter> M own(M meter) {
        ownMeters.add(meter.getId());
        return meter;
    }

    private static Tags toTags(MetricKey key) {
        List<Tag> tags = new ArrayList<>(key.getTags().size());
        key.getTags().forEach((k, v) -> tags.add(Tag.of(k, v)));
        return Tags.of(tags);
    }

    private static MetricKey keyOf(Meter.Id id) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (Tag tag : id.getTagsAsIterable()) {
            tags.put(tag.getKey(), tag.getValue());
        }
        return MetricKey.of(id.getName(), tags);
    }

    private static HistogramSummary summarize(HistogramSnapshot snapshot, TimeUnit unit) {
        HistogramSummary.HistogramSummaryBuilder builder = HistogramSummary.builder()
                .count(snapshot.count())
                .sum(unit == null ? snapshot.total() : snapshot.total(unit))
                .max(unit == null ? snapshot.max() : snapshot.max(unit))
                .mean(unit == null ? snapshot.mean() : snapshot.mean(unit));
        for (ValueAtPercentile v : snapshot.percentileValues()) {
            double value = unit == null ? v.value() : v.value(unit);
            if (v.percentile() == 0.5) {
                builder.p50(value);
            } else if (v.percentile() == 0.95) {
                builder.p95(value);
            } else if (v.percentile() == 0.99) {
                builder.p99(value);
            }
        }
        return builder.build();
    }

    private void remember(MetricKey key, MetricSample.Type type, double value) {
        if (recentSampleLimit == 0) {
            return;
        }
        MetricSample sample = new MetricSample(key, type, value, clock.instant());
        synchronized (recentSamples) {
            recentSamples.addLast(sample);
            while (recentSamples.size() > recentSampleLimit) {
                recentSamples.removeFirst();
            }
        }
    }
}
