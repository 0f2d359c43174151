package xyz.vvrf.reactor.flow.monitor;

import xyz.vvrf.reactor.flow.core.ExecutionMode;

import java.time.Duration;
import java.util.List;

/**
 * 用于监控 Flow 执行事件的监听器接口。
 * 包括 Flow 级别和节点级别的事件。实现抛出的异常会被引擎捕获并记录，不影响执行。
 *
 * @author ruifeng.wen
 */
public interface FlowMonitorListener {

    /**
     * Flow 执行开始时调用。
     *
     * @param requestId 请求 ID
     * @param flowName  Flow 名称
     * @param mode      实际生效的执行模式 (SYNC 或 ASYNC)
     */
    void onFlowStart(String requestId, String flowName, ExecutionMode mode);

    /**
     * Flow 执行结束时调用 (无论成功或失败)。
     *
     * @param requestId     请求 ID
     * @param flowName      Flow 名称
     * @param mode          执行模式
     * @param totalDuration 总耗时
     * @param path          依次执行过的节点 ID
     * @param error         失败时的异常；成功时为 null
     */
    void onFlowComplete(String requestId, String flowName, ExecutionMode mode, Duration totalDuration,
                        List<String> path, Throwable error);

    /**
     * 节点开始执行 (prep 已完成，exec 即将开始) 时调用。
     */
    void onNodeStart(String requestId, String flowName, String nodeId, ExecutionMode mode);

    /**
     * 节点 exec 成功时调用。
     *
     * @param duration  exec 总耗时 (包含重试等待)
     * @param attempts  尝试次数；缓存命中时为 0
     * @param fromCache 结果是否来自缓存
     */
    void onNodeSuccess(String requestId, String flowName, String nodeId, ExecutionMode mode,
                       Duration duration, int attempts, boolean fromCache);

    /**
     * 节点 exec 最终失败时调用。
     */
    void onNodeFailure(String requestId, String flowName, String nodeId, ExecutionMode mode,
                       Duration duration, int attempts, Throwable error);
}
