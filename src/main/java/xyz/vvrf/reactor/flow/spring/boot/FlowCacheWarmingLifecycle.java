package xyz.vvrf.reactor.flow.spring.boot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import xyz.vvrf.reactor.flow.cache.warming.WarmingResult;
import xyz.vvrf.reactor.flow.runtime.FlowRuntime;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 应用上下文刷新完成时触发缓存的启动预热。
 * 最多等待 startupWarmingTimeout；超时或出错只记录日志，不阻止应用启动。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class FlowCacheWarmingLifecycle implements SmartLifecycle {

    private final FlowRuntime runtime;
    private final Duration timeout;
    private volatile boolean running;

    public FlowCacheWarmingLifecycle(FlowRuntime runtime, Duration timeout) {
        this.runtime = Objects.requireNonNull(runtime, "FlowRuntime 不能为空");
        this.timeout = Objects.requireNonNull(timeout, "启动预热超时不能为空");
    }

    @Override
    public void start() {
        running = true;
        log.info("开始执行启动缓存预热，最长等待 {}", timeout);
        try {
            List<WarmingResult> results = runtime.startWarming().block(timeout);
            log.info("启动缓存预热结束: {}", results);
        } catch (RuntimeException e) {
            log.warn("启动缓存预热未在 {} 内完成或执行出错，应用继续启动: {}", timeout, e.getMessage(), e);
        }
    }

    /**
     * 周期任务由 FlowRuntime 关闭时统一停止。
     */
    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
