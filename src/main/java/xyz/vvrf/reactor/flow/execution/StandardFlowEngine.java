package xyz.vvrf.reactor.flow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.ExecutionMode;
import xyz.vvrf.reactor.flow.core.Flow;
import xyz.vvrf.reactor.flow.core.Node;
import xyz.vvrf.reactor.flow.core.SharedContext;
import xyz.vvrf.reactor.flow.exception.ErrorClassifier;
import xyz.vvrf.reactor.flow.exception.ErrorKind;
import xyz.vvrf.reactor.flow.exception.FlowConfigurationException;
import xyz.vvrf.reactor.flow.exception.NodeExecutionException;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * FlowEngine 的标准实现。
 * 从起始节点开始依次执行 prep -> exec -> post，按 post 返回的边选择下一个节点，直到没有后继。
 * SYNC 与 ASYNC 共用 {@link #prepare}、{@link #finish} 和 {@link #resolveNext}，只有 exec 的调度方式不同。
 * <p>
 * 边解析规则：
 * <ul>
 *     <li>post 返回 null: Flow 结束。</li>
 *     <li>边已连线: 进入目标节点。</li>
 *     <li>未连线的 "default" 边: Flow 结束。</li>
 *     <li>其他未连线的边: 抛出 {@link FlowConfigurationException}。</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardFlowEngine implements FlowEngine {

    private final StandardNodeExecutor nodeExecutor;
    private final ExecutionModeDetector modeDetector;
    private final List<FlowMonitorListener> monitorListeners;

    public StandardFlowEngine(StandardNodeExecutor nodeExecutor,
                              ExecutionModeDetector modeDetector,
                              List<FlowMonitorListener> monitorListeners) {
        this.nodeExecutor = Objects.requireNonNull(nodeExecutor, "NodeExecutor 不能为空");
        this.modeDetector = modeDetector != null ? modeDetector : new ExecutionModeDetector();
        this.monitorListeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.info("StandardFlowEngine initialized. Mode detector: {}, Listeners: {}",
                this.modeDetector.getClass().getSimpleName(), this.monitorListeners.size());
    }

    @Override
    public SharedContext run(Flow flow, SharedContext context) {
        FlowExecutionContext ctx = begin(flow, context, ExecutionMode.SYNC);
        try {
            Node<?, ?> current = flow.getStartNode();
            while (current != null) {
                ctx.enterNode(current.getId());
                Object prep = prepare(ctx, current);
                Object result = nodeExecutor.execute(ctx, current, prep);
                String edge = finish(ctx, current, prep, result);
                current = resolveNext(ctx, current, edge).orElse(null);
            }
            complete(ctx, null);
            return context;
        } catch (RuntimeException e) {
            complete(ctx, e);
            throw e;
        }
    }

    @Override
    public Mono<SharedContext> runAsync(Flow flow, SharedContext context) {
        return Mono.defer(() -> {
            FlowExecutionContext ctx = begin(flow, context, ExecutionMode.ASYNC);
            return Mono.<Node<?, ?>>just(flow.getStartNode())
                    .expand(node -> step(ctx, node))
                    .then(Mono.fromCallable(() -> {
                        complete(ctx, null);
                        return context;
                    }))
                    .doOnError(e -> complete(ctx, e))
                    .doOnCancel(() -> {
                        log.warn("[RequestId: {}][Flow: '{}'] Execution cancelled after path {}",
                                ctx.getRequestId(), ctx.getFlowName(), ctx.getPathSnapshot());
                        complete(ctx, new CancellationException("Flow '" + ctx.getFlowName() + "' 执行被取消"));
                    });
        });
    }

    @Override
    public Mono<SharedContext> execute(Flow flow, SharedContext context, ExecutionMode mode) {
        ExecutionMode effective = modeDetector.resolve(mode);
        if (effective == ExecutionMode.ASYNC) {
            return runAsync(flow, context);
        }
        return Mono.fromCallable(() -> run(flow, context));
    }

    private Mono<Node<?, ?>> step(FlowExecutionContext ctx, Node<?, ?> node) {
        return Mono.defer(() -> {
            ctx.enterNode(node.getId());
            Object prep = prepare(ctx, node);
            return nodeExecutor.executeAsync(ctx, node, prep)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(result -> Mono.justOrEmpty(resolveNext(ctx, node, finish(ctx, node, prep, result.orElse(null)))));
        });
    }

    private Object prepare(FlowExecutionContext ctx, Node<?, ?> node) {
        try {
            return cast(node).prep(ctx.getShared());
        } catch (RuntimeException e) {
            throw phaseFailure(ctx, node, "prep", e);
        }
    }

    private String finish(FlowExecutionContext ctx, Node<?, ?> node, Object prep, Object result) {
        try {
            return cast(node).post(ctx.getShared(), prep, result);
        } catch (RuntimeException e) {
            throw phaseFailure(ctx, node, "post", e);
        }
    }

    private Optional<Node<?, ?>> resolveNext(FlowExecutionContext ctx, Node<?, ?> node, String edge) {
        if (edge == null) {
            log.trace("[RequestId: {}][Flow: '{}'] Node '{}' ended the flow", ctx.getRequestId(), ctx.getFlowName(), node.getId());
            return Optional.empty();
        }
        Flow flow = ctx.getFlow();
        Optional<String> target = flow.successor(node.getId(), edge);
        if (target.isPresent()) {
            log.trace("[RequestId: {}][Flow: '{}'] '{}' --{}--> '{}'",
                    ctx.getRequestId(), ctx.getFlowName(), node.getId(), edge, target.get());
            return flow.getNode(target.get());
        }
        if (Node.DEFAULT_EDGE.equals(edge)) {
            return Optional.empty();
        }
        throw new FlowConfigurationException(String.format("Flow '%s': 节点 '%s' 返回了未连线的边 '%s' (已连线: %s)",
                flow.getName(), node.getId(), edge, flow.edgesOf(node.getId())));
    }

    private NodeExecutionException phaseFailure(FlowExecutionContext ctx, Node<?, ?> node, String phase, RuntimeException e) {
        if (e instanceof NodeExecutionException) {
            return (NodeExecutionException) e;
        }
        Throwable cause = ErrorClassifier.unwrap(e);
        ErrorKind kind = ErrorClassifier.classify(cause);
        StandardNodeExecutor.recordError(ctx.getShared(), node.getId(), cause, kind);
        log.error("[RequestId: {}][Flow: '{}'] 节点 '{}' 的 {} 阶段失败: {}",
                ctx.getRequestId(), ctx.getFlowName(), node.getId(), phase, cause.toString());
        return new NodeExecutionException(ctx.getFlowName(), node.getId(), node.getOperationName() + "#" + phase,
                kind, 0, cause);
    }

    private FlowExecutionContext begin(Flow flow, SharedContext context, ExecutionMode mode) {
        Objects.requireNonNull(flow, "Flow 不能为空");
        Objects.requireNonNull(context, "SharedContext 不能为空");
        FlowExecutionContext ctx = new FlowExecutionContext(flow, context, mode);
        log.info("[RequestId: {}][Flow: '{}'] Starting execution (mode: {})", ctx.getRequestId(), ctx.getFlowName(), mode);
        safeNotifyListeners(l -> l.onFlowStart(ctx.getRequestId(), ctx.getFlowName(), mode));
        return ctx;
    }

    private void complete(FlowExecutionContext ctx, Throwable error) {
        List<String> path = ctx.getPathSnapshot();
        if (error == null) {
            log.info("[RequestId: {}][Flow: '{}'] Execution completed in {}ms. Path: {}",
                    ctx.getRequestId(), ctx.getFlowName(), ctx.elapsed().toMillis(), path);
        } else {
            log.warn("[RequestId: {}][Flow: '{}'] Execution failed after {}ms. Path: {}, Error: {}",
                    ctx.getRequestId(), ctx.getFlowName(), ctx.elapsed().toMillis(), path, error.getMessage());
        }
        safeNotifyListeners(l -> l.onFlowComplete(ctx.getRequestId(), ctx.getFlowName(), ctx.getMode(),
                ctx.elapsed(), path, error));
    }

    @SuppressWarnings("unchecked")
    private static Node<Object, Object> cast(Node<?, ?> node) {
        return (Node<Object, Object>) node;
    }

    private void safeNotifyListeners(Consumer<FlowMonitorListener> action) {
        for (FlowMonitorListener listener : monitorListeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("FlowMonitorListener {} 抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
