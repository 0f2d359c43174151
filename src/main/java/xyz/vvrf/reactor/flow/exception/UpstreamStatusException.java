package xyz.vvrf.reactor.flow.exception;

import lombok.Getter;

/**
 * 上游返回了非成功的 HTTP 风格状态码。
 * 429 与 5xx (500/502/503/504) 视为瞬时错误，其余视为永久错误。
 *
 * @author ruifeng.wen
 */
@Getter
public class UpstreamStatusException extends FlowException {

    private final int statusCode;

    public UpstreamStatusException(int statusCode, String message) {
        super(String.format("Upstream responded with status %d: %s", statusCode, message));
        this.statusCode = statusCode;
    }

    @Override
    public ErrorKind getKind() {
        return isRetryableStatus(statusCode) ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT;
    }

    public static boolean isRetryableStatus(int statusCode) {
        switch (statusCode) {
            case 429:
            case 500:
            case 502:
            case 503:
            case 504:
                return true;
            default:
                return false;
        }
    }
}
