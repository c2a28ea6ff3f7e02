package com.lendora.lending.client;

import com.lendora.lending.exception.ExternalCallFailedException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Runs calls to external collaborators on a separate thread under a named time limiter, so the
 * calling operation fails with a retryable error instead of hanging.
 */
@Component
@Slf4j
public class ExternalCallGuard {

    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService executor;

    public ExternalCallGuard(TimeLimiterRegistry timeLimiterRegistry,
                             @Qualifier("externalCallExecutor") ExecutorService executor) {
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.executor = executor;
    }

    public <T> T execute(String limiterName, Callable<T> call) throws ExternalCallFailedException {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(limiterName);
        try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(call));
        } catch (TimeoutException e) {
            log.warn("Call guarded by {} timed out after {}", limiterName, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new ExternalCallFailedException(limiterName + " timed out", e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCallFailedException(limiterName + " interrupted", e, false);
        } catch (Exception e) {
            throw new ExternalCallFailedException(limiterName + " failed: " + e.getMessage(), e, false);
        }
    }
}
