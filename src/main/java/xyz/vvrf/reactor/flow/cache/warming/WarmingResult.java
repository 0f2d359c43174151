package xyz.vvrf.reactor.flow.cache.warming;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Duration;

/**
 * 单个策略一次执行的结果。
 *
 * @author ruifeng.wen
 */
@Getter
@ToString
@RequiredArgsConstructor
public class WarmingResult {

    private final String strategy;
    private final int successful;
    private final int failed;
    private final int skipped;
    private final Duration duration;
}
