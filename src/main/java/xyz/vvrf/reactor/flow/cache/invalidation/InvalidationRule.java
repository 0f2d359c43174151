package xyz.vvrf.reactor.flow.cache.invalidation;

import java.util.List;
import java.util.Map;

/**
 * 根据触发时提供的上下文计算需要失效的键模式。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface InvalidationRule {

    List<String> patterns(Map<String, Object> context);
}
