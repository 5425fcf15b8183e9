package org.knowhub.utils;

import org.knowhub.config.RagProperties;
import org.knowhub.exception.CustomException;
import org.knowhub.exception.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.concurrent.Callable;

/**
 * 检索后端调用的超时与指数退避重试。超时视为可重试，重试耗尽后抛出 RetrievalException。
 * 版本冲突、一致性校验失败等业务异常不重试，原样抛出。
 */
public final class RetryUtils {

    private static final Logger logger = LoggerFactory.getLogger(RetryUtils.class);

    private RetryUtils() {
    }

    public static <T> T callWithRetry(String operation, RagProperties.Backend policy, Callable<T> call) {
        try {
            return Mono.fromCallable(call)
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(policy.getTimeout())
                    .retryWhen(Retry.backoff(policy.getMaxRetries(), policy.getInitialBackoff())
                            .maxBackoff(policy.getMaxBackoff())
                            .filter(RetryUtils::isRetryable)
                            .doBeforeRetry(signal -> logger.warn("{} 调用失败，第 {} 次重试: {}",
                                    operation, signal.totalRetries() + 1, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                    .block();
        } catch (CustomException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new RetrievalException(operation + " 调用失败: " + cause.getMessage(), cause);
        }
    }

    public static void runWithRetry(String operation, RagProperties.Backend policy, Runnable call) {
        callWithRetry(operation, policy, () -> {
            call.run();
            return Boolean.TRUE;
        });
    }

    /**
     * 业务异常只重试 RetrievalException；超时及其他运行时异常视为后端临时故障
     */
    static boolean isRetryable(Throwable e) {
        if (e instanceof RetrievalException) {
            return true;
        }
        return !(e instanceof CustomException) && !(e instanceof IllegalArgumentException);
    }
}
