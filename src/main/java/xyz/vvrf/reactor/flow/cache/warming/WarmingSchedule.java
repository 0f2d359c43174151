package xyz.vvrf.reactor.flow.cache.warming;

/**
 * 预热策略的触发时机。
 *
 * @author ruifeng.wen
 */
public enum WarmingSchedule {
    /** 运行时启动时执行一次 */
    STARTUP,
    /** 按 period 周期执行 */
    PERIODIC,
    /** 只在显式调用时执行 */
    ON_DEMAND
}
