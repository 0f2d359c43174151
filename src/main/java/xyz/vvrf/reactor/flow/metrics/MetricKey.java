package xyz.vvrf.reactor.flow.metrics;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 指标名称 + 标签组合的唯一键。标签按键名排序，保证同一组标签无论传入顺序如何都映射到同一个键。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class MetricKey implements Comparable<MetricKey> {

    private final String name;
    private final SortedMap<String, String> tags;

    private MetricKey(String name, SortedMap<String, String> tags) {
        this.name = name;
        this.tags = Collections.unmodifiableSortedMap(tags);
    }

    public static MetricKey of(String name, Map<String, String> tags) {
        Objects.requireNonNull(name, "指标名称不能为空");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("指标名称不能为空白");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        if (tags != null) {
            tags.forEach((k, v) -> sorted.put(Objects.requireNonNull(k, "标签键不能为空"), v == null ? "" : v));
        }
        return new MetricKey(name, sorted);
    }

    /**
     * 导出用的名称：点号和短横线替换为下划线。
     */
    public String getExportName() {
        return sanitize(name);
    }

    /**
     * 形如 {@code flow_node_executions{node="fetch",status="success"}} 的文本表示。
     */
    public String render() {
        if (tags.isEmpty()) {
            return getExportName();
        }
        return getExportName() + tags.entrySet().stream()
                .map(e -> sanitize(e.getKey()) + "=\"" + escape(e.getValue()) + "\"")
                .collect(Collectors.joining(",", "{", "}"));
    }

    @Override
    public int compareTo(MetricKey other) {
        return render().compareTo(other.render());
    }

    @Override
    public String toString() {
        return render();
    }

    private static String sanitize(String raw) {
        return raw.replace('.', '_').replace('-', '_');
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
