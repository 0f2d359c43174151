package xyz.vvrf.reactor.flow.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Getter;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;

/**
 * 采集器在某一时刻的只读快照。生成快照不会修改采集器状态。
 *
 * @author ruifeng.wen
 */
@Getter
public class MetricsSnapshot {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final Instant timestamp;
    private final SortedMap<MetricKey, Double> counters;
    private final SortedMap<MetricKey, Double> gauges;
    private final SortedMap<MetricKey, HistogramSummary> histograms;

    MetricsSnapshot(Instant timestamp,
                    SortedMap<MetricKey, Double> counters,
                    SortedMap<MetricKey, Double> gauges,
                    SortedMap<MetricKey, HistogramSummary> histograms) {
        this.timestamp = timestamp;
        this.counters = Collections.unmodifiableSortedMap(counters);
        this.gauges = Collections.unmodifiableSortedMap(gauges);
        this.histograms = Collections.unmodifiableSortedMap(histograms);
    }

    /**
     * Prometheus 风格的文本格式。直方图展开为 _count/_sum/_max/_mean/_p50/_p95/_p99 几条序列。
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        appendSimple(sb, counters, "counter");
        appendSimple(sb, gauges, "gauge");

        String lastName = null;
        for (Map.Entry<MetricKey, HistogramSummary> entry : histograms.entrySet()) {
            MetricKey key = entry.getKey();
            HistogramSummary h = entry.getValue();
            if (!key.getExportName().equals(lastName)) {
                sb.append("# TYPE ").append(key.getExportName()).append(" histogram\n");
                lastName = key.getExportName();
            }
            String labels = key.render().substring(key.getExportName().length());
            line(sb, key.getExportName() + "_count" + labels, h.getCount());
            line(sb, key.getExportName() + "_sum" + labels, h.getSum());
            line(sb, key.getExportName() + "_max" + labels, h.getMax());
            line(sb, key.getExportName() + "_mean" + labels, h.getMean());
            line(sb, key.getExportName() + "_p50" + labels, h.getP50());
            line(sb, key.getExportName() + "_p95" + labels, h.getP95());
            line(sb, key.getExportName() + "_p99" + labels, h.getP99());
        }
        return sb.toString();
    }

    /**
     * 结构化表示: counters / gauges / histograms 三个分组，键为渲染后的指标键。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("timestamp", timestamp.toString());
        Map<String, Object> c = new LinkedHashMap<>();
        counters.forEach((k, v) -> c.put(k.render(), v));
        Map<String, Object> g = new LinkedHashMap<>();
        gauges.forEach((k, v) -> g.put(k.render(), v));
        Map<String, Object> h = new LinkedHashMap<>();
        histograms.forEach((k, v) -> h.put(k.render(), v.toMap()));
        root.put("counters", c);
        root.put("gauges", g);
        root.put("histograms", h);
        return root;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toMap());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("指标快照序列化为 JSON 失败", e);
        }
    }

    public double counter(String name, Map<String, String> tags) {
        Double v = counters.get(MetricKey.of(name, tags));
        return v == null ? 0.0 : v;
    }

    private static void appendSimple(StringBuilder sb, SortedMap<MetricKey, Double> values, String type) {
        String lastName = null;
        for (Map.Entry<MetricKey, Double> entry : values.entrySet()) {
            String exportName = entry.getKey().getExportName();
            if (!exportName.equals(lastName)) {
                sb.append("# TYPE ").append(exportName).append(' ').append(type).append('\n');
                lastName = exportName;
            }
            line(sb, entry.getKey().render(), entry.getValue());
        }
    }

    private static void line(StringBuilder sb, String series, double value) {
        sb.append(series).append(' ').append(value).append('\n');
    }
}
