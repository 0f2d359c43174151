package xyz.vvrf.reactor.flow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.flow.cache.FlowCache;
import xyz.vvrf.reactor.flow.concurrency.ConcurrencyLimiterRegistry;
import xyz.vvrf.reactor.flow.core.BatchNode;
import xyz.vvrf.reactor.flow.core.ExecutionMode;
import xyz.vvrf.reactor.flow.core.ItemOutcome;
import xyz.vvrf.reactor.flow.core.Node;
import xyz.vvrf.reactor.flow.core.SharedContext;
import xyz.vvrf.reactor.flow.exception.ErrorClassifier;
import xyz.vvrf.reactor.flow.exception.ErrorKind;
import xyz.vvrf.reactor.flow.exception.NodeExecutionException;
import xyz.vvrf.reactor.flow.exception.RetryExhaustedException;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.retry.RetryExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 负责节点 exec 阶段：缓存读穿、重试与熔断、按操作名的并发限制、超时、批处理并发以及监听器通知。
 * prep/post 与边解析由 {@link StandardFlowEngine} 处理。
 * <p>
 * 并发名额按每次尝试获取，退避等待期间不占用名额；节点超时只计算拿到名额之后的执行时间。
 * <p>
 * 批处理节点的单条目失败不会使节点失败，也不写入缓存。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardNodeExecutor {

    private final RetryExecutor retryExecutor;
    private final FlowCache cache;
    private final ConcurrencyLimiterRegistry concurrencyLimiters;
    private final Duration defaultNodeTimeout;
    private final int defaultBatchConcurrency;
    private final Scheduler blockingScheduler;
    private final List<FlowMonitorListener> monitorListeners;

    /**
     * @param retryExecutor           包裹每次 exec 的重试执行器
     * @param cache                   节点结果缓存；为 null 时忽略节点的 cacheKey
     * @param defaultNodeTimeout      节点未声明超时时使用；null 或非正数表示不限时
     * @param defaultBatchConcurrency 批处理节点未声明并发时使用
     * @param blockingScheduler       SYNC 模式下带超时的 exec 在其上运行
     * @param monitorListeners        监控监听器列表
     */
    public StandardNodeExecutor(RetryExecutor retryExecutor,
                                FlowCache cache,
                                Duration defaultNodeTimeout,
                                int defaultBatchConcurrency,
                                Scheduler blockingScheduler,
                                List<FlowMonitorListener> monitorListeners) {
        this(retryExecutor, cache, null, defaultNodeTimeout, defaultBatchConcurrency, blockingScheduler, monitorListeners);
    }

    /**
     * @param concurrencyLimiters 按操作名限制同时执行的 exec 数；为 null 时不限制
     */
    public StandardNodeExecutor(RetryExecutor retryExecutor,
                                FlowCache cache,
                                ConcurrencyLimiterRegistry concurrencyLimiters,
                                Duration defaultNodeTimeout,
                                int defaultBatchConcurrency,
                                Scheduler blockingScheduler,
                                List<FlowMonitorListener> monitorListeners) {
        this.concurrencyLimiters = concurrencyLimiters;
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "RetryExecutor 不能为空");
        this.cache = cache;
        this.defaultNodeTimeout = defaultNodeTimeout;
        this.defaultBatchConcurrency = defaultBatchConcurrency > 0 ? defaultBatchConcurrency : BatchNode.DEFAULT_CONCURRENCY;
        this.blockingScheduler = Objects.requireNonNull(blockingScheduler, "阻塞调度器不能为空");
        this.monitorListeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.info("初始化 StandardNodeExecutor。默认超时: {}, 批处理默认并发: {}, 缓存: {}, 并发限制: {}, 监听器数量: {}",
                defaultNodeTimeout, this.defaultBatchConcurrency, cache != null ? "启用" : "禁用",
                concurrencyLimiters != null ? "启用" : "禁用", this.monitorListeners.size());
    }

    /**
     * 在调用线程上执行节点的 exec 阶段。
     *
     * @throws NodeExecutionException 重试耗尽、遇到永久错误或熔断器拒绝
     */
    public Object execute(FlowExecutionContext ctx, Node<?, ?> rawNode, Object prep) {
        Node<Object, Object> node = cast(rawNode);
        String nodeId = node.getId();
        safeNotifyListeners(l -> l.onNodeStart(ctx.getRequestId(), ctx.getFlowName(), nodeId, ExecutionMode.SYNC));
        long start = System.nanoTime();
        String cacheKey = cacheKeyOf(node, prep);
        AtomicInteger attempts = new AtomicInteger();

        try {
            if (cacheKey != null) {
                Optional<Object> cached = cache.get(cacheKey, node.getResultType());
                if (cached.isPresent()) {
                    onCacheHit(ctx, nodeId, ExecutionMode.SYNC, start, cacheKey);
                    return cached.get();
                }
            }

            Object result;
            if (node instanceof BatchNode) {
                result = executeBatch(asBatch(node), prep, attempts);
            } else {
                Duration timeout = timeoutOf(node);
                result = retryExecutor.execute(node.getOperationName(), node.getRetryPolicy(),
                        () -> limited(node.getOperationName(), () -> callWithDeadline(() -> node.exec(prep), timeout)),
                        attempts::set);
            }

            if (cacheKey != null && result != null) {
                cache.set(cacheKey, result, node.getCacheTtl());
            }
            Duration duration = since(start);
            int made = attempts.get();
            log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 执行成功 (耗时: {}ms, 尝试: {})",
                    ctx.getRequestId(), ctx.getFlowName(), nodeId, duration.toMillis(), made);
            safeNotifyListeners(l -> l.onNodeSuccess(ctx.getRequestId(), ctx.getFlowName(), nodeId,
                    ExecutionMode.SYNC, duration, made, false));
            return result;
        } catch (RuntimeException e) {
            throw failed(ctx, node, ExecutionMode.SYNC, start, attempts.get(), e);
        }
    }

    /**
     * 以非阻塞方式执行节点的 exec 阶段。失败以 {@link NodeExecutionException} 信号结束。
     */
    public Mono<Object> executeAsync(FlowExecutionContext ctx, Node<?, ?> rawNode, Object prep) {
        Node<Object, Object> node = cast(rawNode);
        String nodeId = node.getId();
        return Mono.defer(() -> {
            safeNotifyListeners(l -> l.onNodeStart(ctx.getRequestId(), ctx.getFlowName(), nodeId, ExecutionMode.ASYNC));
            long start = System.nanoTime();
            String cacheKey = cacheKeyOf(node, prep);
            AtomicInteger attempts = new AtomicInteger();

            Mono<Optional<Object>> lookup = cacheKey == null
                    ? Mono.just(Optional.empty())
                    : cache.getAsync(cacheKey, node.getResultType());

            return lookup.flatMap(hit -> {
                        if (hit.isPresent()) {
                            onCacheHit(ctx, nodeId, ExecutionMode.ASYNC, start, cacheKey);
                            return Mono.just(hit.get());
                        }
                        Mono<Object> exec;
                        if (node instanceof BatchNode) {
                            exec = executeBatchAsync(asBatch(node), prep, attempts);
                        } else {
                            Duration timeout = timeoutOf(node);
                            exec = retryExecutor.executeAsync(node.getOperationName(), node.getRetryPolicy(),
                                    () -> limitedAsync(node.getOperationName(),
                                            () -> withDeadline(node.execAsync(prep), timeout)),
                                    attempts::set);
                        }
                        return exec
                                .flatMap(result -> cacheKey == null
                                        ? Mono.just(result)
                                        : cache.setAsync(cacheKey, result, node.getCacheTtl()).thenReturn(result))
                                .doOnSuccess(result -> {
                                    Duration duration = since(start);
                                    int made = attempts.get();
                                    log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 执行成功 (耗时: {}ms, 尝试: {})",
                                            ctx.getRequestId(), ctx.getFlowName(), nodeId, duration.toMillis(), made);
                                    safeNotifyListeners(l -> l.onNodeSuccess(ctx.getRequestId(), ctx.getFlowName(),
                                            nodeId, ExecutionMode.ASYNC, duration, made, false));
                                });
                    })
                    .onErrorMap(e -> !(e instanceof NodeExecutionException),
                            e -> failed(ctx, node, ExecutionMode.ASYNC, start, attempts.get(), e));
        });
    }

    private List<ItemOutcome<Object>> executeBatch(BatchNode<Object, Object> batch, Object prep, AtomicInteger attempts) {
        List<Object> items = itemsOf(batch, prep);
        Duration timeout = timeoutOf(batch);
        return batch.execItems(items, item -> () -> retryExecutor.execute(batch.getOperationName(), batch.getRetryPolicy(),
                () -> limited(batch.getOperationName(), () -> callWithDeadline(() -> batch.execItem(item), timeout)),
                attempt -> attempts.accumulateAndGet(attempt, Math::max)));
    }

    private Mono<Object> executeBatchAsync(BatchNode<Object, Object> batch, Object prep, AtomicInteger attempts) {
        List<Object> items = itemsOf(batch, prep);
        Duration timeout = timeoutOf(batch);
        int concurrency = batch.getConcurrency() > 0 ? batch.getConcurrency() : defaultBatchConcurrency;
        return batch.execItemsAsync(items,
                        item -> retryExecutor.executeAsync(batch.getOperationName(), batch.getRetryPolicy(),
                                () -> limitedAsync(batch.getOperationName(),
                                        () -> withDeadline(batch.execItemAsync(item), timeout)),
                                attempt -> attempts.accumulateAndGet(attempt, Math::max)),
                        concurrency)
                .map(outcomes -> (Object) outcomes);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> itemsOf(BatchNode<Object, Object> batch, Object prep) {
        if (prep == null) {
            return Collections.emptyList();
        }
        if (!(prep instanceof List)) {
            throw new IllegalStateException(String.format("批处理节点 '%s' 的 prep 必须返回 List，实际为 %s",
                    batch.getId(), prep.getClass().getName()));
        }
        return (List<Object>) prep;
    }

    private <T> T limited(String operation, Callable<T> call) throws Exception {
        return concurrencyLimiters == null ? call.call() : concurrencyLimiters.call(operation, call);
    }

    private <T> Mono<T> limitedAsync(String operation, Supplier<Mono<T>> call) {
        return concurrencyLimiters == null ? Mono.defer(call) : concurrencyLimiters.callAsync(operation, call);
    }

    /**
     * 超时为空时在调用线程上直接执行；否则切到阻塞调度器上执行并在调用线程等待结果。
     */
    private <T> T callWithDeadline(Callable<T> call, Duration timeout) throws Exception {
        if (!hasDeadline(timeout)) {
            return call.call();
        }
        try {
            return Mono.fromCallable(call).subscribeOn(blockingScheduler).timeout(timeout).block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    private static <T> Mono<T> withDeadline(Mono<T> exec, Duration timeout) {
        return hasDeadline(timeout) ? exec.timeout(timeout) : exec;
    }

    private static boolean hasDeadline(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    private Duration timeoutOf(Node<?, ?> node) {
        Duration declared = node.getExecutionTimeout();
        return hasDeadline(declared) ? declared : defaultNodeTimeout;
    }

    private String cacheKeyOf(Node<Object, Object> node, Object prep) {
        if (cache == null || node instanceof BatchNode || node.getResultType() == null) {
            return null;
        }
        return node.cacheKey(prep);
    }

    private void onCacheHit(FlowExecutionContext ctx, String nodeId, ExecutionMode mode, long start, String cacheKey) {
        Duration duration = since(start);
        log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 命中缓存 (key: {})",
                ctx.getRequestId(), ctx.getFlowName(), nodeId, cacheKey);
        safeNotifyListeners(l -> l.onNodeSuccess(ctx.getRequestId(), ctx.getFlowName(), nodeId, mode, duration, 0, true));
    }

    /**
     * 把 exec 阶段的最终错误转换为 {@link NodeExecutionException}，并写入 {@link SharedContext#KEY_ERROR}。
     */
    private NodeExecutionException failed(FlowExecutionContext ctx, Node<?, ?> node, ExecutionMode mode,
                                          long start, int attemptsMade, Throwable error) {
        Throwable cause = ErrorClassifier.unwrap(error);
        int attempts = attemptsMade;
        if (cause instanceof RetryExhaustedException) {
            attempts = ((RetryExhaustedException) cause).getAttempts();
            if (cause.getCause() != null) {
                cause = ErrorClassifier.unwrap(cause.getCause());
            }
        }
        ErrorKind kind = ErrorClassifier.classify(cause);
        Duration duration = since(start);

        recordError(ctx.getShared(), node.getId(), cause, kind);
        log.error("[RequestId: {}][Flow: '{}'] 节点 '{}' 执行失败 (操作: {}, 分类: {}, 尝试: {}, 耗时: {}ms): {}",
                ctx.getRequestId(), ctx.getFlowName(), node.getId(), node.getOperationName(), kind, attempts,
                duration.toMillis(), cause.toString());

        Throwable finalCause = cause;
        int finalAttempts = attempts;
        safeNotifyListeners(l -> l.onNodeFailure(ctx.getRequestId(), ctx.getFlowName(), node.getId(), mode,
                duration, finalAttempts, finalCause));
        return new NodeExecutionException(ctx.getFlowName(), node.getId(), node.getOperationName(), kind, attempts, cause);
    }

    static void recordError(SharedContext shared, String nodeId, Throwable cause, ErrorKind kind) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("node_id", nodeId);
        info.put("error", String.valueOf(cause.getMessage()));
        info.put("error_type", cause.getClass().getSimpleName());
        info.put("error_kind", kind.name());
        shared.put(SharedContext.KEY_ERROR, Collections.unmodifiableMap(info));
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @SuppressWarnings("unchecked")
    private static <A, B> Node<A, B> cast(Node<?, ?> node) {
        return (Node<A, B>) node;
    }

    @SuppressWarnings("unchecked")
    private static BatchNode<Object, Object> asBatch(Node<?, ?> node) {
        return (BatchNode<Object, Object>) node;
    }

    private void safeNotifyListeners(Consumer<FlowMonitorListener> action) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (FlowMonitorListener listener : monitorListeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("FlowMonitorListener {} 抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
