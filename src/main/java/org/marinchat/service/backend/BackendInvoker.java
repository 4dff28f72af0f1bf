package org.marinchat.service.backend;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.marinchat.exception.BackendUnavailableException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Exécute un appel backend dans le bulkhead Resilience4j qui porte son nom
 * ({@code resilience4j.thread-pool-bulkhead.*}), borné par le time limiter du
 * même nom ({@code resilience4j.timelimiter.*}). Toute panne devient une
 * {@link BackendUnavailableException} (503).
 */
@Slf4j
@Component
public class BackendInvoker {

    private final ThreadPoolBulkheadRegistry bulkheads;
    private final TimeLimiterRegistry timeLimiters;

    public BackendInvoker(ThreadPoolBulkheadRegistry bulkheads, TimeLimiterRegistry timeLimiters) {
        this.bulkheads = bulkheads;
        this.timeLimiters = timeLimiters;
    }

    public <T> T call(String backend, Callable<T> call) {
        ThreadPoolBulkhead bulkhead = bulkheads.bulkhead(backend);
        TimeLimiter timeLimiter = timeLimiters.timeLimiter(backend);
        try {
            return timeLimiter.executeFutureSupplier(() -> bulkhead.executeCallable(call).toCompletableFuture());
        } catch (BulkheadFullException e) {
            log.warn("{} backend saturated, rejecting call", backend);
            throw new BackendUnavailableException(backend + " backend is saturated", e);
        } catch (TimeoutException e) {
            log.warn("{} backend timed out after {} ms", backend,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis());
            throw new BackendUnavailableException(backend + " backend timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(backend + " call interrupted", e);
        } catch (BackendUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.warn("{} backend failed: {}", backend, e.toString());
            throw new BackendUnavailableException(backend + " backend failed", e);
        }
    }
}
