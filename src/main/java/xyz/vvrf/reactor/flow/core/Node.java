package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.retry.RetryPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.Set;

/**
 * Flow 中的一个执行单元，分三个阶段：
 * <ol>
 *     <li>{@link #prep}: 从共享上下文读取输入，同步执行。</li>
 *     <li>{@link #exec} / {@link #execAsync}: 核心逻辑，唯一允许挂起或阻塞的阶段，由引擎包裹重试、熔断、超时和缓存。</li>
 *     <li>{@link #post}: 写回上下文，返回下一条边的名称；返回 null 表示 Flow 到此结束。</li>
 * </ol>
 * 同一个节点实现在 SYNC 与 ASYNC 两种模式下共用 prep/post，默认 execAsync 只是包装 exec。
 *
 * @param <P> prep 的结果类型
 * @param <R> exec 的结果类型
 * @author ruifeng.wen
 */
public interface Node<P, R> {

    String DEFAULT_EDGE = "default";

    /**
     * @return 节点在 Flow 内唯一的 ID
     */
    String getId();

    P prep(SharedContext context);

    R exec(P prepResult) throws Exception;

    default Mono<R> execAsync(P prepResult) {
        return Mono.fromCallable(() -> exec(prepResult));
    }

    /**
     * @return 下一条边的名称，null 表示结束
     */
    String post(SharedContext context, P prepResult, R execResult);

    /**
     * 熔断器和重试指标使用的操作名，默认与节点 ID 相同。
     */
    default String getOperationName() {
        return getId();
    }

    /**
     * @return 节点专属的重试策略；null 表示使用引擎默认策略
     */
    default RetryPolicy getRetryPolicy() {
        return null;
    }

    /**
     * @return 单次 exec 的超时；null 表示使用引擎默认超时
     */
    default Duration getExecutionTimeout() {
        return null;
    }

    /**
     * 返回非 null 的键时，引擎在 exec 前查缓存、在成功后写缓存。需要同时提供 {@link #getResultType()}。
     */
    default String cacheKey(P prepResult) {
        return null;
    }

    default Class<R> getResultType() {
        return null;
    }

    /**
     * @return 缓存写入 TTL；null 表示缓存默认 TTL
     */
    default Duration getCacheTtl() {
        return null;
    }

    /**
     * post 可能返回的具名边。构建 Flow 时会校验这些边都已连线。
     */
    default Set<String> getDeclaredEdges() {
        return Collections.emptySet();
    }
}
