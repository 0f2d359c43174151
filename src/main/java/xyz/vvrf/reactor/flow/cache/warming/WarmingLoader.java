package xyz.vvrf.reactor.flow.cache.warming;

import reactor.core.publisher.Mono;

/**
 * 为某个缓存键加载值。返回空 Mono 视为加载失败。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface WarmingLoader {

    Mono<?> load(String key);
}
