package xyz.vvrf.reactor.flow.exception;

/**
 * 错误分类。重试执行器和节点执行器据此决定是否重试、是否快速失败。
 *
 * @author ruifeng.wen
 */
public enum ErrorKind {
    /** 瞬时错误 (超时、连接重置、限流、5xx)，可以重试。*/
    TRANSIENT,
    /** 永久错误 (参数非法、4xx、数据格式错误)，不应重试。*/
    PERMANENT,
    /** 熔断器打开导致的拒绝，立即失败且不计入重试。*/
    CIRCUIT_OPEN
}
