package xyz.vvrf.reactor.flow.retry;

import java.time.Duration;

/**
 * 同步重试的等待方式。测试中替换为只记录时长的实现。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
