package xyz.vvrf.reactor.flow.exception;

/**
 * 可重试的瞬时错误，例如上游超时、连接重置、限流。
 *
 * @author ruifeng.wen
 */
public class TransientException extends FlowException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TRANSIENT;
    }
}
