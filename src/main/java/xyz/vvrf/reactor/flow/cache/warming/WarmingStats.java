package xyz.vvrf.reactor.flow.cache.warming;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 预热累计统计。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString
public class WarmingStats {

    private final long totalWarmed;
    private final long successful;
    private final long failed;
    private final long skipped;
    private final Instant lastWarmingTime;
    private final Duration lastWarmingDuration;
}
