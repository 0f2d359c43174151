package xyz.vvrf.reactor.flow.exception;

import reactor.core.Exceptions;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 将任意异常归类为 {@link ErrorKind}。
 * 框架异常按自身声明的分类；JDK 的超时/IO 异常视为瞬时错误；其他一律视为永久错误。
 *
 * @author ruifeng.wen
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static ErrorKind classify(Throwable error) {
        Throwable e = unwrap(error);
        if (e instanceof FlowException) {
            return ((FlowException) e).getKind();
        }
        if (e instanceof TimeoutException
                || e instanceof SocketTimeoutException
                || e instanceof ConnectException
                || e instanceof IOException
                || e instanceof UncheckedIOException) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.PERMANENT;
    }

    public static boolean isRetryable(Throwable error) {
        return classify(error) == ErrorKind.TRANSIENT;
    }

    /**
     * 剥掉 Reactor 的 ReactiveException 以及 CompletionException / ExecutionException 包装。
     */
    public static Throwable unwrap(Throwable error) {
        Throwable e = Exceptions.unwrap(error);
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
