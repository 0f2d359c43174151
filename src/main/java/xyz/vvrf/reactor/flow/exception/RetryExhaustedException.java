package xyz.vvrf.reactor.flow.exception;

import lombok.Getter;

/**
 * 重试次数耗尽后抛出，携带最后一次失败的原因。
 *
 * @author ruifeng.wen
 */
@Getter
public class RetryExhaustedException extends FlowException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super(String.format("Operation '%s' failed after %d attempts: %s",
                operation, attempts, lastError == null ? "unknown" : lastError.getMessage()), lastError);
        this.operation = operation;
        this.attempts = attempts;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TRANSIENT;
    }
}
