package xyz.vvrf.reactor.flow.cache.warming;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * 缓存预热策略：一组键、对应的加载器、优先级 (越小越先执行) 和最大并发。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString(exclude = "loader")
public class WarmingStrategy {

    @NonNull
    private final String name;

    @Singular
    private final List<String> keys;

    @NonNull
    private final WarmingLoader loader;

    @Builder.Default
    private final int priority = 1;

    @Builder.Default
    private final int maxConcurrency = 5;

    /** 为 null 时使用缓存的默认 TTL */
    private final Duration ttl;

    @Builder.Default
    private final WarmingSchedule schedule = WarmingSchedule.ON_DEMAND;

    /** PERIODIC 策略的执行周期 */
    private final Duration period;
}
