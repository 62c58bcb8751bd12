package com.portfolio.backend.service.ingestion;

import com.portfolio.backend.service.ScheduledTaskGuard;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionSchedulerTest {

    @Test
    void scheduledRunSurvivesIngestionFailure() {
        PriceIngestionService ingestionService = mock(PriceIngestionService.class);
        when(ingestionService.runConfigured()).thenThrow(new IllegalStateException("pool exhausted"));
        IngestionScheduler scheduler = new IngestionScheduler(ingestionService, new ScheduledTaskGuard(new SimpleMeterRegistry()));

        assertThatCode(scheduler::runScheduled).doesNotThrowAnyException();
        verify(ingestionService).runConfigured();
    }

    @Test
    void startupRunUsesConfiguredTickers() {
        PriceIngestionService ingestionService = mock(PriceIngestionService.class);
        IngestionStartupRunner runner = new IngestionStartupRunner(ingestionService, new ScheduledTaskGuard(new SimpleMeterRegistry()));

        runner.onReady();

        verify(ingestionService).runConfigured();
    }
}
