package xyz.vvrf.reactor.flow.exception;

/**
 * Flow 图配置错误：重复的节点 ID、指向不存在节点的边、未连线的边名称等。
 *
 * @author ruifeng.wen
 */
public class FlowConfigurationException extends FlowException {

    public FlowConfigurationException(String message) {
        super(message);
    }
}
