package xyz.vvrf.reactor.flow.execution;

import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.core.ExecutionMode;

/**
 * 决定 AUTO 模式下实际使用的执行模式。调用线程是 Reactor 非阻塞线程时必须用 ASYNC，否则用 SYNC。
 * 需要其他判断规则时继承并覆盖 {@link #detect()}。
 *
 * @author ruifeng.wen
 */
public class ExecutionModeDetector {

    public ExecutionMode detect() {
        return Schedulers.isInNonBlockingThread() ? ExecutionMode.ASYNC : ExecutionMode.SYNC;
    }

    public final ExecutionMode resolve(ExecutionMode requested) {
        if (requested == null || requested == ExecutionMode.AUTO) {
            return detect();
        }
        return requested;
    }
}
