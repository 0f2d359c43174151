package xyz.vvrf.reactor.flow.core;

import lombok.Getter;
import xyz.vvrf.reactor.flow.exception.ErrorClassifier;
import xyz.vvrf.reactor.flow.exception.ErrorKind;

import java.util.Optional;

/**
 * 批处理中单个条目的结果：成功值或分类后的错误。
 *
 * @param <R> 条目结果类型
 * @author ruifeng.wen
 */
public final class ItemOutcome<R> {

    private final R value;
    private final Throwable error;
    @Getter
    private final ErrorKind errorKind;

    private ItemOutcome(R value, Throwable error, ErrorKind errorKind) {
        this.value = value;
        this.error = error;
        this.errorKind = errorKind;
    }

    public static <R> ItemOutcome<R> success(R value) {
        return new ItemOutcome<>(value, null, null);
    }

    public static <R> ItemOutcome<R> failure(Throwable error) {
        Throwable cause = ErrorClassifier.unwrap(error);
        return new ItemOutcome<>(null, cause, ErrorClassifier.classify(cause));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public R getValue() {
        return value;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ItemOutcome{success=" + value + "}" : "ItemOutcome{" + errorKind + ": " + error + "}";
    }
}
