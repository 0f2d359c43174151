package xyz.vvrf.reactor.flow.metrics;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 某个分布统计在快照时刻的汇总值。count/sum 为累计值，max 和分位数只反映当前时间窗。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString
public class HistogramSummary {

    private final long count;
    private final double sum;
    private final double max;
    private final double mean;
    private final double p50;
    private final double p95;
    private final double p99;

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("count", count);
        map.put("sum", sum);
        map.put("max", max);
        map.put("mean", mean);
        map.put("p50", p50);
        map.put("p95", p95);
        map.put("p99", p99);
        return map;
    }
}
