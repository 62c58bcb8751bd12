package com.portfolio.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Runs background tasks so that a failure is logged and counted instead of escaping to the scheduler.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MeterRegistry meterRegistry;

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Background task failed task={}", taskName, e);
            meterRegistry.counter("background_task_failures_total", "task", taskName).increment();
        }
    }
}
