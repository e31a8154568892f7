package com.pushhub.notification.retry;

import com.pushhub.notification.exception.NotificationException;
import com.pushhub.notification.exception.ProviderSendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryExecutorTest {

    private final List<Long> delays = new ArrayList<>();

    private RetryExecutor executor;

    @BeforeEach
    void setup() {
        executor = new RetryExecutor(3, 100L, delays::add);  // records instead of sleeping
    }

    @Test
    void execute_returnsImmediately_onFirstSuccess() {
        final var result = executor.execute(() -> "msg-001", "Firebase test");

        assertThat(result).isEqualTo("msg-001");
        assertThat(delays).isEmpty();
    }

    @Test
    void execute_retriesWithLinearBackoff_andSucceedsOnThirdAttempt() {
        final var counter = new AtomicInteger(0);
        final var result  = executor.execute(() -> {
            if (counter.incrementAndGet() < 3) {
                throw new ProviderSendException("Firebase", "HTTP 503");
            }
            return "msg-002";
        }, "Firebase test");

        assertThat(result).isEqualTo("msg-002");
        assertThat(counter.get()).isEqualTo(3);
        assertThat(delays).containsExactly(100L, 200L);
    }

    @Test
    void execute_exhaustsAllAttempts_andRethrowsLastFailure() {
        final var counter = new AtomicInteger(0);

        assertThatThrownBy(() -> executor.execute(() -> {
            throw new ProviderSendException("OneSignal", "failure " + counter.incrementAndGet());
        }, "OneSignal test"))
                .isInstanceOf(ProviderSendException.class)
                .hasMessage("failure 3");

        assertThat(counter.get()).isEqualTo(3);
        assertThat(delays).containsExactly(100L, 200L);   // no pause after the last attempt
    }

    @Test
    void execute_honoursPerCallAttemptCount() {
        final var counter = new AtomicInteger(0);

        assertThatThrownBy(() -> executor.execute(() -> {
            counter.incrementAndGet();
            throw new ProviderSendException("Pusher", "down");
        }, 1, "Pusher test")).isInstanceOf(ProviderSendException.class);

        assertThat(counter.get()).isEqualTo(1);
        assertThat(delays).isEmpty();
    }

    @Test
    void execute_wrapsCheckedExceptions() {
        assertThatThrownBy(() -> executor.execute(() -> {
            throw new IOException("connection reset");
        }, 2, "Firebase test"))
                .isInstanceOf(NotificationException.class)
                .hasMessage("connection reset")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void execute_stopsRetrying_whenInterrupted() {
        final var counter     = new AtomicInteger(0);
        final var interrupted = new RetryExecutor(3, 100L, ms -> { throw new InterruptedException(); });

        try {
            assertThatThrownBy(() -> interrupted.execute(() -> {
                counter.incrementAndGet();
                throw new ProviderSendException("Firebase", "HTTP 500");
            }, "Firebase test")).isInstanceOf(ProviderSendException.class);

            assertThat(counter.get()).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();   // clear the flag for the next test
        }
    }

    @Test
    void constructor_rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryExecutor(0, 100L, delays::add))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryExecutor(3, -1L, delays::add))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void backoffDelay_growsLinearly() {
        assertThat(executor.backoffDelay(1)).isEqualTo(100L);
        assertThat(executor.backoffDelay(2)).isEqualTo(200L);
        assertThat(executor.backoffDelay(4)).isEqualTo(400L);
    }
}
