package xyz.vvrf.reactor.flow.concurrency;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 单个操作的并发限制器：同一时刻最多 limit 个调用在执行，其余按到达顺序排队。
 * <p>
 * 同步调用方在调用线程上阻塞等待；异步调用方得到一个在名额可用时才订阅实际调用的 {@link Mono}，
 * 等待期间不占用线程，订阅被取消时退出队列。名额在调用结束、失败或取消时归还。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ConcurrencyLimiter {

    static final String METRIC_ACQUISITIONS = "concurrency_limiter.acquisitions";
    static final String METRIC_RELEASES = "concurrency_limiter.releases";
    static final String METRIC_ACTIVE = "concurrency_limiter.active";

    @Getter
    private final String name;
    @Getter
    private final int limit;
    private final MetricsCollector metrics;
    private final Map<String, String> tags;

    private final Object lock = new Object();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int active;
    private int maxActive;
    private long acquired;
    private long released;

    public ConcurrencyLimiter(String name, int limit, MetricsCollector metrics) {
        if (limit < 1) {
            throw new IllegalArgumentException(String.format("操作 '%s' 的并发上限必须 >= 1，实际为 %d", name, limit));
        }
        this.name = Objects.requireNonNull(name, "限制器名称不能为空");
        this.limit = limit;
        this.metrics = Objects.requireNonNull(metrics, "MetricsCollector 不能为空");
        this.tags = MetricsCollector.tags("operation", name);
        metrics.setGauge(METRIC_ACTIVE, 0, tags);
    }

    /**
     * 在调用线程上等待名额后执行 callable。
     *
     * @throws InterruptedException 等待名额期间线程被中断，此时不会执行 callable
     */
    public <T> T call(Callable<T> callable) throws Exception {
        Permit permit = acquire();
        try {
            return callable.call();
        } finally {
            permit.release();
        }
    }

    /**
     * 名额可用时才订阅 supplier 返回的 Mono，结束、失败或取消时归还名额。
     */
    public <T> Mono<T> callAsync(Supplier<Mono<T>> supplier) {
        return Mono.usingWhen(acquireAsync(),
                permit -> supplier.get(),
                permit -> Mono.fromRunnable(permit::release),
                (permit, error) -> Mono.fromRunnable(permit::release),
                permit -> Mono.fromRunnable(permit::release));
    }

    /**
     * 阻塞获取名额。
     */
    public Permit acquire() throws InterruptedException {
        Waiter waiter;
        synchronized (lock) {
            if (waiters.isEmpty() && active < limit) {
                return grantLocked();
            }
            waiter = new Waiter(null);
            waiters.addLast(waiter);
        }
        log.debug("操作 '{}' 达到并发上限 {}，同步调用进入等待。", name, limit);
        try {
            waiter.latch.await();
        } catch (InterruptedException e) {
            synchronized (lock) {
                if (!waiter.granted) {
                    waiters.remove(waiter);
                    throw e;
                }
            }
            // 中断与放行同时发生：名额已经分到，直接归还
            waiter.permit.release();
            throw e;
        }
        return waiter.permit;
    }

    /**
     * 非阻塞获取名额；排队期间订阅被取消会退出队列，已分到但未交付的名额会被归还。
     */
    public Mono<Permit> acquireAsync() {
        return Mono.create(sink -> {
            Permit immediate = null;
            Waiter waiter = null;
            synchronized (lock) {
                if (waiters.isEmpty() && active < limit) {
                    immediate = grantLocked();
                } else {
                    waiter = new Waiter(sink);
                    waiters.addLast(waiter);
                }
            }
            if (immediate != null) {
                sink.success(immediate);
                return;
            }
            log.debug("操作 '{}' 达到并发上限 {}，异步调用进入等待。", name, limit);
            Waiter queued = waiter;
            sink.onCancel(() -> abandon(queued));
        });
    }

    public ConcurrencyStats getStats() {
        synchronized (lock) {
            return ConcurrencyStats.builder()
                    .name(name)
                    .limit(limit)
                    .active(active)
                    .waiting(waiters.size())
                    .acquired(acquired)
                    .released(released)
                    .maxActive(maxActive)
                    .build();
        }
    }

    private void abandon(Waiter waiter) {
        Permit toRelease = null;
        synchronized (lock) {
            if (!waiter.granted) {
                waiters.remove(waiter);
                return;
            }
            toRelease = waiter.permit;
        }
        toRelease.release();
    }

    private Permit grantLocked() {
        active++;
        acquired++;
        maxActive = Math.max(maxActive, active);
        metrics.increment(METRIC_ACQUISITIONS, tags);
        metrics.setGauge(METRIC_ACTIVE, active, tags);
        return new Permit();
    }

    private void onRelease() {
        Waiter next;
        synchronized (lock) {
            active--;
            released++;
            metrics.increment(METRIC_RELEASES, tags);
            next = waiters.pollFirst();
            if (next != null) {
                next.permit = grantLocked();
                next.granted = true;
            } else {
                metrics.setGauge(METRIC_ACTIVE, active, tags);
            }
        }
        if (next == null) {
            return;
        }
        if (next.sink != null) {
            next.sink.success(next.permit);
        } else {
            next.latch.countDown();
        }
    }

    /**
     * 一个已分到的名额，只归还一次。
     */
    public final class Permit {

        private final AtomicBoolean returned = new AtomicBoolean();

        private Permit() {
        }

        public void release() {
            if (returned.compareAndSet(false, true)) {
                onRelease();
            }
        }
    }

    private final class Waiter {
        private final MonoSink<Permit> sink;
        private final CountDownLatch latch = new CountDownLatch(1);
        private boolean granted;
        private Permit permit;

        private Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }
    }
}
