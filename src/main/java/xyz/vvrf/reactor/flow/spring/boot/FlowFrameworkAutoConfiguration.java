package xyz.vvrf.reactor.flow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import xyz.vvrf.reactor.flow.breaker.CircuitBreakerRegistry;
import xyz.vvrf.reactor.flow.cache.FlowCache;
import xyz.vvrf.reactor.flow.cache.backend.CacheBackend;
import xyz.vvrf.reactor.flow.cache.invalidation.CacheInvalidator;
import xyz.vvrf.reactor.flow.cache.warming.CacheWarmer;
import xyz.vvrf.reactor.flow.cache.warming.WarmingStrategy;
import xyz.vvrf.reactor.flow.concurrency.ConcurrencyLimiterRegistry;
import xyz.vvrf.reactor.flow.execution.FlowEngine;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.retry.RetryExecutor;
import xyz.vvrf.reactor.flow.runtime.FlowRuntime;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flow 框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link FlowFrameworkProperties}。
 * 2. 提供核心的 {@link FlowRuntime} Bean，上下文中有 RedisConnectionFactory 时用 Redis 作为主缓存后端，
 * 有 MeterRegistry 时同时上报 Micrometer 指标。
 * 3. 把 FlowRuntime 内部的组件 (引擎、指标、熔断器、重试、缓存) 暴露为 Bean，方便直接注入。
 * 4. 收集上下文中所有的 {@link FlowMonitorListener} Bean 交给引擎，所有的 {@link WarmingStrategy} Bean 交给缓存预热器。
 * 5. flow.cache.warm-on-startup=true (默认) 时在上下文刷新后执行启动预热。
 * <p>
 * 缓存被 flow.cache.enabled=false 关闭时不注册缓存相关的 Bean。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(FlowFrameworkProperties.class)
@Slf4j
public class FlowFrameworkAutoConfiguration {

    public FlowFrameworkAutoConfiguration() {
        log.info("Flow 框架自动配置 (FlowFrameworkAutoConfiguration) 已加载。");
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(FlowRuntime.class)
    public FlowRuntime flowRuntime(FlowFrameworkProperties properties,
                                   ObjectProvider<RedisConnectionFactory> redisConnectionFactory,
                                   ObjectProvider<CacheBackend> cacheBackend,
                                   ObjectProvider<MeterRegistry> meterRegistry,
                                   ObjectProvider<FlowMonitorListener> listenersProvider,
                                   ObjectProvider<WarmingStrategy> warmingStrategiesProvider) {
        List<FlowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (!listeners.isEmpty()) {
            log.info("收集到 {} 个 FlowMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        List<WarmingStrategy> warmingStrategies = warmingStrategiesProvider.orderedStream().collect(Collectors.toList());
        if (!warmingStrategies.isEmpty()) {
            log.info("收集到 {} 个 WarmingStrategy Bean: {}", warmingStrategies.size(),
                    warmingStrategies.stream().map(WarmingStrategy::getName).collect(Collectors.joining(", ")));
        }
        log.info("正在创建 FlowRuntime Bean，配置: {}", properties);
        return FlowRuntime.builder()
                .properties(properties)
                .redisConnectionFactory(redisConnectionFactory.getIfAvailable())
                .cacheBackend(cacheBackend.getIfAvailable())
                .meterRegistry(meterRegistry.getIfAvailable())
                .listeners(listeners)
                .warmingStrategies(warmingStrategies)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(FlowEngine.class)
    public FlowEngine flowEngine(FlowRuntime runtime) {
        return runtime.getEngine();
    }

    @Bean
    @ConditionalOnMissingBean(MetricsCollector.class)
    public MetricsCollector flowMetricsCollector(FlowRuntime runtime) {
        return runtime.getMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(CircuitBreakerRegistry.class)
    public CircuitBreakerRegistry flowCircuitBreakerRegistry(FlowRuntime runtime) {
        return runtime.getCircuitBreakers();
    }

    @Bean
    @ConditionalOnMissingBean(ConcurrencyLimiterRegistry.class)
    public ConcurrencyLimiterRegistry flowConcurrencyLimiterRegistry(FlowRuntime runtime) {
        return runtime.getConcurrencyLimiters();
    }

    @Bean
    @ConditionalOnMissingBean(RetryExecutor.class)
    public RetryExecutor flowRetryExecutor(FlowRuntime runtime) {
        return runtime.getRetryExecutor();
    }

    /**
     * 生命周期由 FlowRuntime 管理，这里不再注册销毁方法。
     */
    @Configuration
    @ConditionalOnProperty(prefix = "flow.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class CacheBeans {

        @Bean(destroyMethod = "")
        @ConditionalOnMissingBean(FlowCache.class)
        public FlowCache flowCache(FlowRuntime runtime) {
            return runtime.getCache();
        }

        @Bean(destroyMethod = "")
        @ConditionalOnMissingBean(CacheWarmer.class)
        public CacheWarmer flowCacheWarmer(FlowRuntime runtime) {
            return runtime.getCacheWarmer();
        }

        @Bean(destroyMethod = "")
        @ConditionalOnMissingBean(CacheInvalidator.class)
        public CacheInvalidator flowCacheInvalidator(FlowRuntime runtime) {
            return runtime.getCacheInvalidator();
        }

        @Bean
        @ConditionalOnProperty(prefix = "flow.cache", name = "warm-on-startup", havingValue = "true", matchIfMissing = true)
        public FlowCacheWarmingLifecycle flowCacheWarmingLifecycle(FlowRuntime runtime, FlowFrameworkProperties properties) {
            return new FlowCacheWarmingLifecycle(runtime, properties.getCache().getStartupWarmingTimeout());
        }
    }
}
