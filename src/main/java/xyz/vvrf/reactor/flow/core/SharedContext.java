package xyz.vvrf.reactor.flow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 单次 Flow 运行期间在节点间传递的可变键值表。每次运行一个实例，不在运行之间共享。
 *
 * @author ruifeng.wen
 */
public class SharedContext {

    /** 节点失败时写入的错误信息 (Map: node_id, error, error_type, error_kind) */
    public static final String KEY_ERROR = "error";
    /** 本次运行依次执行过的节点 ID 列表 */
    public static final String KEY_PATH = "_path";
    /** 本次运行的请求 ID */
    public static final String KEY_REQUEST_ID = "_request_id";

    private final Map<String, Object> values;

    public SharedContext() {
        this.values = Collections.synchronizedMap(new LinkedHashMap<>());
    }

    public static SharedContext of(Map<String, ?> initial) {
        SharedContext context = new SharedContext();
        if (initial != null) {
            context.values.putAll(initial);
        }
        return context;
    }

    public SharedContext put(String key, Object value) {
        values.put(Objects.requireNonNull(key, "上下文键不能为空"), value);
        return this;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 按类型读取。值存在但类型不符时抛出 {@link ClassCastException}。
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new ClassCastException(String.format("上下文键 '%s' 的值类型为 %s，期望 %s",
                    key, value.getClass().getName(), type.getName()));
        }
        return Optional.of(type.cast(value));
    }

    public <T> T require(String key, Class<T> type) {
        return get(key, type).orElseThrow(() -> new IllegalStateException("上下文缺少必需的键: " + key));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object remove(String key) {
        return values.remove(key);
    }

    /**
     * 当前内容的只读副本。
     */
    public Map<String, Object> snapshot() {
        synchronized (values) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    @Override
    public String toString() {
        return "SharedContext" + snapshot().keySet();
    }
}
