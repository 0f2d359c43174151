package xyz.vvrf.reactor.flow.test.util;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.AbstractNode;
import xyz.vvrf.reactor.flow.core.SharedContext;
import xyz.vvrf.reactor.flow.retry.RetryPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 用于测试目的的可配置节点实现。
 * 使用 Builder 模式进行配置。
 *
 * @param <P> prep 结果类型
 * @param <R> exec 结果类型
 */
public class TestNode<P, R> extends AbstractNode<P, R> {

    /**
     * 允许抛出受检异常的 exec 逻辑。
     */
    @FunctionalInterface
    public interface ExecLogic<P, R> {
        R apply(P prep) throws Exception;
    }

    /**
     * post 逻辑：返回下一条边。
     */
    @FunctionalInterface
    public interface PostLogic<P, R> {
        String apply(SharedContext context, P prep, R result);
    }

    private final Function<SharedContext, P> prepLogic;
    private final ExecLogic<P, R> execLogic;
    private final Function<P, Mono<R>> asyncLogic;
    private final PostLogic<P, R> postLogic;
    private final RetryPolicy retryPolicy;
    private final Duration executionTimeout;
    private final Function<P, String> cacheKeyLogic;
    private final Class<R> resultType;
    private final Set<String> declaredEdges;
    private final String operationName;
    private final AtomicInteger execCount = new AtomicInteger();

    private TestNode(Builder<P, R> builder) {
        super(builder.id);
        this.prepLogic = builder.prepLogic;
        this.execLogic = Objects.requireNonNull(builder.execLogic, "exec 逻辑不能为空");
        this.asyncLogic = builder.asyncLogic;
        this.postLogic = builder.postLogic;
        this.retryPolicy = builder.retryPolicy;
        this.executionTimeout = builder.executionTimeout;
        this.cacheKeyLogic = builder.cacheKeyLogic;
        this.resultType = builder.resultType;
        this.declaredEdges = Collections.unmodifiableSet(new HashSet<>(builder.declaredEdges));
        this.operationName = builder.operationName;
    }

    public static <P, R> Builder<P, R> builder(String id) {
        return new Builder<>(id);
    }

    public int getExecCount() {
        return execCount.get();
    }

    @Override
    public P prep(SharedContext context) {
        return prepLogic == null ? null : prepLogic.apply(context);
    }

    @Override
    public R exec(P prepResult) throws Exception {
        execCount.incrementAndGet();
        return execLogic.apply(prepResult);
    }

    @Override
    public Mono<R> execAsync(P prepResult) {
        if (asyncLogic == null) {
            return super.execAsync(prepResult);
        }
        return Mono.defer(() -> {
            execCount.incrementAndGet();
            return asyncLogic.apply(prepResult);
        });
    }

    @Override
    public String post(SharedContext context, P prepResult, R execResult) {
        if (postLogic == null) {
            return super.post(context, prepResult, execResult);
        }
        return postLogic.apply(context, prepResult, execResult);
    }

    @Override
    public String getOperationName() {
        return operationName != null ? operationName : getId();
    }

    @Override
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    @Override
    public String cacheKey(P prepResult) {
        return cacheKeyLogic == null ? null : cacheKeyLogic.apply(prepResult);
    }

    @Override
    public Class<R> getResultType() {
        return resultType;
    }

    @Override
    public Set<String> getDeclaredEdges() {
        return declaredEdges;
    }

    public static class Builder<P, R> {
        private final String id;
        private Function<SharedContext, P> prepLogic;
        private ExecLogic<P, R> execLogic;
        private Function<P, Mono<R>> asyncLogic;
        private PostLogic<P, R> postLogic;
        private RetryPolicy retryPolicy;
        private Duration executionTimeout;
        private Function<P, String> cacheKeyLogic;
        private Class<R> resultType;
        private final Set<String> declaredEdges = new HashSet<>();
        private String operationName;

        private Builder(String id) {
            this.id = id;
        }

        public Builder<P, R> prep(Function<SharedContext, P> prepLogic) {
            this.prepLogic = prepLogic;
            return this;
        }

        public Builder<P, R> exec(ExecLogic<P, R> execLogic) {
            this.execLogic = execLogic;
            return this;
        }

        public Builder<P, R> execAsync(Function<P, Mono<R>> asyncLogic) {
            this.asyncLogic = asyncLogic;
            return this;
        }

        public Builder<P, R> post(PostLogic<P, R> postLogic) {
            this.postLogic = postLogic;
            return this;
        }

        public Builder<P, R> retry(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder<P, R> timeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
            return this;
        }

        public Builder<P, R> cached(Function<P, String> cacheKeyLogic, Class<R> resultType) {
            this.cacheKeyLogic = cacheKeyLogic;
            this.resultType = resultType;
            return this;
        }

        public Builder<P, R> declaresEdge(String edge) {
            this.declaredEdges.add(edge);
            return this;
        }

        public Builder<P, R> operation(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public TestNode<P, R> build() {
            return new TestNode<>(this);
        }
    }
}
