package xyz.vvrf.reactor.flow.exception;

import lombok.Getter;

/**
 * 节点 exec 阶段出现不可恢复错误时由引擎抛出，
 * 携带 Flow 名称、节点 ID、操作名、错误分类和已尝试次数。
 *
 * @author ruifeng.wen
 */
@Getter
public class NodeExecutionException extends FlowException {

    private final String flowName;
    private final String nodeId;
    private final String operation;
    private final ErrorKind errorKind;
    private final int attempts;

    public NodeExecutionException(String flowName, String nodeId, String operation,
                                  ErrorKind errorKind, int attempts, Throwable cause) {
        super(String.format("Node '%s' in flow '%s' failed (operation: %s, kind: %s, attempts: %d): %s",
                nodeId, flowName, operation, errorKind, attempts,
                cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage()), cause);
        this.flowName = flowName;
        this.nodeId = nodeId;
        this.operation = operation;
        this.errorKind = errorKind;
        this.attempts = attempts;
    }

    @Override
    public ErrorKind getKind() {
        return errorKind;
    }
}
