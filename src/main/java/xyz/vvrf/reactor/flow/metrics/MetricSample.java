package xyz.vvrf.reactor.flow.metrics;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * 单个原始观测点，保存在采集器的最近样本环中。
 *
 * @author ruifeng.wen
 */
@Getter
@ToString
@RequiredArgsConstructor
public class MetricSample {

    public enum Type { COUNTER, GAUGE, HISTOGRAM }

    private final MetricKey key;
    private final Type type;
    private final double value;
    private final Instant timestamp;
}
