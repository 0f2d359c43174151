package xyz.vvrf.reactor.flow.core;

/**
 * Flow 的调度方式。
 *
 * @author ruifeng.wen
 */
public enum ExecutionMode {
    /** 每个节点的 exec 在调用线程上阻塞执行 */
    SYNC,
    /** 每个节点的 execAsync 以 Mono 形式挂起执行 */
    ASYNC,
    /** 由 {@link xyz.vvrf.reactor.flow.execution.ExecutionModeDetector} 根据调用线程判断 */
    AUTO
}
