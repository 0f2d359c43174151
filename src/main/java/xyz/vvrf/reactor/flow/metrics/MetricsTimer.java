package xyz.vvrf.reactor.flow.metrics;

import io.micrometer.core.instrument.Timer;

import java.util.Map;

/**
 * 作用域计时器。关闭时把耗时记录到 Micrometer 计时器 {@code <name>.duration}，
 * 并根据是否调用过 {@link #success()} 递增 {@code <name>.success} 或 {@code <name>.failure}。
 * <pre>
 * try (MetricsTimer t = metrics.timer("upstream.query", tags)) {
 *     doWork();
 *     t.success();
 * }
 * </pre>
 *
 * @author ruifeng.wen
 */
public class MetricsTimer implements AutoCloseable {

    private final MetricsCollector collector;
    private final String name;
    private final Map<String, String> tags;
    private final Timer.Sample sample;
    private boolean succeeded;
    private boolean closed;

    MetricsTimer(MetricsCollector collector, String name, Map<String, String> tags, Timer.Sample sample) {
        this.collector = collector;
        this.name = name;
        this.tags = tags;
        this.sample = sample;
    }

    public void success() {
        this.succeeded = true;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        collector.stopTimer(sample, name + ".duration", tags);
        collector.increment(name + (succeeded ? ".success" : ".failure"), tags);
    }
}
