package xyz.vvrf.reactor.flow.exception;

/**
 * 不可重试的错误，例如请求参数非法或响应无法解析。
 *
 * @author ruifeng.wen
 */
public class PermanentException extends FlowException {

    public PermanentException(String message) {
        super(message);
    }

    public PermanentException(String message, Throwable cause) {
        super(message, cause);
    }
}
