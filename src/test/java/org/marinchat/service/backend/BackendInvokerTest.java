package org.marinchat.service.backend;

import io.github.resilience4j.bulkhead.ThreadPoolBulkheadConfig;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.marinchat.exception.BackendUnavailableException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendInvokerTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private ThreadPoolBulkheadRegistry bulkheads;
    private BackendInvoker invoker;

    @BeforeEach
    void setUp() {
        bulkheads = ThreadPoolBulkheadRegistry.of(ThreadPoolBulkheadConfig.custom()
                .coreThreadPoolSize(1)
                .maxThreadPoolSize(1)
                .queueCapacity(1)
                .build());
        TimeLimiterRegistry timeLimiters = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(200))
                .cancelRunningFuture(true)
                .build());
        invoker = new BackendInvoker(bulkheads, timeLimiters);
    }

    @AfterEach
    void tearDown() throws Exception {
        release.countDown();
        bulkheads.bulkhead("test").close();
    }

    private void blockUntilReleased() {
        try {
            release.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void call_renvoieLeResultat() {
        assertThat(invoker.call("test", () -> "done")).isEqualTo("done");
    }

    @Test
    void call_echecDuBackend_devient503() {
        assertThatThrownBy(() -> invoker.call("test", () -> {
            throw new BackendException("down");
        }))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("failed")
                .hasCauseInstanceOf(BackendException.class)
                .satisfies(e -> assertThat(((BackendUnavailableException) e).getStatus().value()).isEqualTo(503));
    }

    @Test
    void call_tropLent_devient503SansAttendreLeBackend() {
        long start = System.nanoTime();

        assertThatThrownBy(() -> invoker.call("test", () -> {
            blockUntilReleased();
            return "late";
        }))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("timed out");

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(2_000);
    }

    @Test
    void call_bulkheadSature_devient503() {
        // un appel en cours, un en file : le suivant est refusé
        bulkheads.bulkhead("test").executeRunnable(this::blockUntilReleased);
        bulkheads.bulkhead("test").executeRunnable(this::blockUntilReleased);

        assertThatThrownBy(() -> invoker.call("test", () -> "never"))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("saturated");
    }

    @Test
    void call_unBulkheadParBackend() throws Exception {
        bulkheads.bulkhead("completion").executeRunnable(this::blockUntilReleased);
        bulkheads.bulkhead("completion").executeRunnable(this::blockUntilReleased);

        try {
            assertThat(invoker.call("transcription", () -> "ok")).isEqualTo("ok");
        } finally {
            release.countDown();
            bulkheads.bulkhead("completion").close();
            bulkheads.bulkhead("transcription").close();
        }
    }
}
