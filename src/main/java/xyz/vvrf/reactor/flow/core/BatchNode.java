package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 对 prep 返回的条目列表逐项执行的节点。
 * <ul>
 *     <li>SYNC: 按顺序逐项执行。</li>
 *     <li>ASYNC: 同时最多 {@link #getConcurrency()} 个条目在执行，输出顺序与输入一致。</li>
 * </ul>
 * 单个条目失败被记录为 {@link ItemOutcome#failure}，不会中断整个批次。
 * 异步执行被取消时不再派发新条目，已派发的条目继续运行到完成或自身超时。
 *
 * @param <I> 条目类型
 * @param <R> 条目结果类型
 * @author ruifeng.wen
 */
public abstract class BatchNode<I, R> extends AbstractNode<List<I>, List<ItemOutcome<R>>> {

    /** 异步模式下未覆盖 {@link #getConcurrency()} 时的默认并发 */
    public static final int DEFAULT_CONCURRENCY = 5;

    protected BatchNode(String id) {
        super(id);
    }

    public abstract R execItem(I item) throws Exception;

    public Mono<R> execItemAsync(I item) {
        return Mono.fromCallable(() -> execItem(item));
    }

    /**
     * @return 异步模式下的最大并发条目数；<= 0 表示使用引擎配置
     */
    public int getConcurrency() {
        return 0;
    }

    @Override
    public final List<ItemOutcome<R>> exec(List<I> items) {
        return execItems(items, item -> () -> execItem(item));
    }

    @Override
    public final Mono<List<ItemOutcome<R>>> execAsync(List<I> items) {
        int concurrency = getConcurrency() > 0 ? getConcurrency() : DEFAULT_CONCURRENCY;
        return execItemsAsync(items, this::execItemAsync, concurrency);
    }

    /**
     * 顺序执行每个条目。线程被中断时停止派发剩余条目，它们记为失败。
     *
     * @param invoker 为条目构造一次调用，引擎用它包裹重试和熔断
     */
    public List<ItemOutcome<R>> execItems(List<I> items, Function<I, Callable<R>> invoker) {
        List<ItemOutcome<R>> outcomes = new ArrayList<>(items.size());
        for (I item : items) {
            if (Thread.currentThread().isInterrupted()) {
                outcomes.add(ItemOutcome.failure(new InterruptedException("批处理节点 '" + getId() + "' 被中断")));
                continue;
            }
            try {
                outcomes.add(ItemOutcome.success(invoker.apply(item).call()));
            } catch (Exception e) {
                outcomes.add(ItemOutcome.failure(e));
            }
        }
        return outcomes;
    }

    /**
     * 以有限并发执行每个条目，结果按输入顺序排列。
     *
     * @param invoker 为条目构造一次异步调用，引擎用它包裹重试、熔断和超时
     */
    public Mono<List<ItemOutcome<R>>> execItemsAsync(List<I> items, Function<I, Mono<R>> invoker, int concurrency) {
        if (items.isEmpty()) {
            return Mono.just(new ArrayList<ItemOutcome<R>>());
        }
        return Flux.fromIterable(items)
                .flatMapSequential(item -> detached(invoker, item)
                                .map(ItemOutcome::success)
                                .defaultIfEmpty(ItemOutcome.<R>success(null))
                                .onErrorResume(e -> Mono.just(ItemOutcome.<R>failure(e))),
                        Math.max(1, concurrency))
                .collectList();
    }

    /**
     * 已派发的条目独立于下游订阅运行：下游取消只会放弃结果，不会取消条目本身。
     */
    private Mono<R> detached(Function<I, Mono<R>> invoker, I item) {
        return Mono.defer(() -> {
            CompletableFuture<R> running = Mono.defer(() -> invoker.apply(item)).toFuture();
            return Mono.fromFuture(running.thenApply(Function.identity()));
        });
    }
}
