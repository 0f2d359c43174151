package xyz.vvrf.reactor.flow.exception;

/**
 * 框架内所有异常的基类 (非受检)。
 *
 * @author ruifeng.wen
 */
public class FlowException extends RuntimeException {

    public FlowException(String message) {
        super(message);
    }

    public FlowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return 该异常对应的错误分类
     */
    public ErrorKind getKind() {
        return ErrorKind.PERMANENT;
    }
}
