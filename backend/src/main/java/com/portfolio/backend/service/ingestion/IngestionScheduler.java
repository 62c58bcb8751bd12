package com.portfolio.backend.service.ingestion;

import com.portfolio.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "portfolio.ingestion.schedule.enabled", havingValue = "true")
public class IngestionScheduler {

    private final PriceIngestionService priceIngestionService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(cron = "${portfolio.ingestion.schedule.cron}")
    public void runScheduled() {
        scheduledTaskGuard.run("price-ingestion", priceIngestionService::runConfigured);
    }
}
