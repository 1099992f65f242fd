package com.pdftranslator.backend.services.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import com.pdftranslator.backend.exceptions.ProviderException;

class ProviderCallGuardTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final ProviderCallGuard guard = new ProviderCallGuard(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void call_returnsTheResult() {
        assertThat(guard.call("p", Duration.ofSeconds(5), () -> "done")).isEqualTo("done");
    }

    @Test
    void call_pastDeadline_isTransient() {
        CountDownLatch never = new CountDownLatch(1);

        assertThatThrownBy(() -> guard.call("p", Duration.ofMillis(50), () -> {
            never.await(5, TimeUnit.SECONDS);
            return "late";
        }))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).isTransient()).isTrue())
                .hasMessageContaining("timed out");
    }

    @Test
    void call_providerExceptionsPassThroughUnchanged() {
        ProviderException original = ProviderException.permanent("p", "quota exhausted", null);

        assertThatThrownBy(() -> guard.call("p", Duration.ofSeconds(5), () -> {
            throw original;
        })).isSameAs(original);
    }

    @Test
    void call_unknownErrors_arePermanent() {
        assertThatThrownBy(() -> guard.call("p", Duration.ofSeconds(5), () -> {
            throw new IllegalStateException("bug");
        }))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).isTransient()).isFalse());
    }

    @Test
    void call_rejectedByExecutor_isTransient() {
        ProviderCallGuard saturated = new ProviderCallGuard(task -> {
            throw new TaskRejectedException("queue full");
        });

        assertThatThrownBy(() -> saturated.call("p", Duration.ofSeconds(5), () -> "never"))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).isTransient()).isTrue());
    }
}
