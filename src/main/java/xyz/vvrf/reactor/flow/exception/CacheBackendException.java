package xyz.vvrf.reactor.flow.exception;

/**
 * 缓存后端 (网络或本地存储) 不可用。只在缓存层内部使用，触发降级，不会抛给业务调用方。
 *
 * @author ruifeng.wen
 */
public class CacheBackendException extends FlowException {

    public CacheBackendException(String message) {
        super(message);
    }

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TRANSIENT;
    }
}
