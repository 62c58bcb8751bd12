package com.portfolio.backend.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ScheduledTaskGuardTest {

    @Test
    void failureIsCountedAndDoesNotEscape() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ScheduledTaskGuard guard = new ScheduledTaskGuard(registry);

        assertThatCode(() -> guard.run("price-ingestion", () -> {
            throw new IllegalStateException("boom");
        })).doesNotThrowAnyException();

        assertThat(registry.counter("background_task_failures_total", "task", "price-ingestion").count()).isEqualTo(1.0);
    }

    @Test
    void successfulTaskRuns() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AtomicInteger calls = new AtomicInteger();

        new ScheduledTaskGuard(registry).run("noop", calls::incrementAndGet);

        assertThat(calls).hasValue(1);
        assertThat(registry.find("background_task_failures_total").counter()).isNull();
    }
}
