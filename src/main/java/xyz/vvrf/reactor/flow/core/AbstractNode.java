package xyz.vvrf.reactor.flow.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 节点基类。默认的 post 把 exec 结果写入上下文 {@code <id>_result} 并沿默认边继续。
 *
 * @param <P> prep 的结果类型
 * @param <R> exec 的结果类型
 * @author ruifeng.wen
 */
public abstract class AbstractNode<P, R> implements Node<P, R> {

    @Getter
    private final String id;

    protected AbstractNode(String id) {
        Objects.requireNonNull(id, "节点 ID 不能为空");
        if (id.trim().isEmpty()) {
            throw new IllegalArgumentException("节点 ID 不能为空白");
        }
        this.id = id;
    }

    public String getResultKey() {
        return id + "_result";
    }

    @Override
    public String post(SharedContext context, P prepResult, R execResult) {
        context.put(getResultKey(), execResult);
        return DEFAULT_EDGE;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
