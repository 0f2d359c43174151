package xyz.vvrf.reactor.flow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.ExecutionMode;
import xyz.vvrf.reactor.flow.core.Flow;
import xyz.vvrf.reactor.flow.core.SharedContext;

/**
 * Flow 执行引擎。同一个 Flow 可以用任一模式运行，节点的 prep/post 与边解析逻辑在两种模式下相同。
 *
 * @author ruifeng.wen
 */
public interface FlowEngine {

    /**
     * 在调用线程上以 SYNC 模式运行到终止节点。
     *
     * @return 传入的同一个上下文
     * @throws xyz.vvrf.reactor.flow.exception.NodeExecutionException     节点执行失败
     * @throws xyz.vvrf.reactor.flow.exception.FlowConfigurationException 节点返回了未连线的边或超过最大步数
     */
    SharedContext run(Flow flow, SharedContext context);

    /**
     * 以 ASYNC 模式运行。订阅时开始执行，取消订阅会传播到正在执行的节点。
     */
    Mono<SharedContext> runAsync(Flow flow, SharedContext context);

    /**
     * 按指定模式运行；AUTO 根据调用线程选择。SYNC 时返回的 Mono 在订阅线程上阻塞执行。
     */
    Mono<SharedContext> execute(Flow flow, SharedContext context, ExecutionMode mode);
}
