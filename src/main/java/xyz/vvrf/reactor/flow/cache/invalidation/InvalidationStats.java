package xyz.vvrf.reactor.flow.cache.invalidation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 失效操作累计统计。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString
public class InvalidationStats {

    private final long totalInvalidations;
    private final long patternInvalidations;
    private final long ageInvalidations;
    private final long usageEvictions;
    private final long triggersFired;
}
