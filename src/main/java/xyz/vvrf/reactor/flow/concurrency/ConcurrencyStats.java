package xyz.vvrf.reactor.flow.concurrency;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 并发限制器某一时刻的统计快照。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString
public class ConcurrencyStats {

    private final String name;
    private final int limit;
    private final int active;
    private final int waiting;
    private final long acquired;
    private final long released;
    private final int maxActive;

    /**
     * 没有剩余名额时为 true。
     */
    public boolean isSaturated() {
        return active >= limit;
    }
}
