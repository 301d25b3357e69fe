package com.fulfillment.pipeline.core;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one external call of the pipeline with the step's retry policy and a hard timeout per
 * attempt. Policies are the Resilience4j instances named after the step
 * ({@code enrichment}, {@code generation}, {@code notification}).
 *
 * <p>Attempts are submitted as plain tasks so that a timed-out attempt is interrupted when the time
 * limiter cancels it.
 */
@Slf4j
@Component
public class StepExecutor {

    public static final String ENRICHMENT = "enrichment";
    public static final String GENERATION = "generation";
    public static final String NOTIFICATION = "notification";

    private final RetryRegistry retryRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService downstreamCallExecutor;

    public StepExecutor(RetryRegistry retryRegistry,
                        TimeLimiterRegistry timeLimiterRegistry,
                        @Qualifier("downstreamCallExecutor") ExecutorService downstreamCallExecutor) {
        this.retryRegistry = retryRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.downstreamCallExecutor = downstreamCallExecutor;
    }

    /**
     * @throws DownstreamTimeoutException if the last attempt timed out
     * @throws DownstreamException if the last attempt failed otherwise
     */
    public <T> T execute(String step, String orderId, Supplier<T> call) {
        Retry retry = retryRegistry.retry(step);
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(step);
        AtomicInteger attempts = new AtomicInteger();

        Callable<T> attempt = () -> {
            int n = attempts.incrementAndGet();
            try {
                return timeLimiter.executeFutureSupplier(() -> downstreamCallExecutor.submit(call::get));
            } catch (Exception e) {
                log.warn("Step attempt failed: step={}, orderId={}, attempt={}, error={}",
                        step, orderId, n, describe(e));
                throw e;
            }
        };

        try {
            T result = Retry.decorateCallable(retry, attempt).call();
            if (attempts.get() > 1) {
                log.info("Step succeeded after retry: step={}, orderId={}, attempts={}", step, orderId, attempts.get());
            }
            return result;
        } catch (TimeoutException e) {
            throw new DownstreamTimeoutException(step,
                    "Step " + step + " timed out after " + attempts.get() + " attempt(s)", e);
        } catch (Exception e) {
            throw new DownstreamException(step,
                    "Step " + step + " failed after " + attempts.get() + " attempt(s): " + describe(e), e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
