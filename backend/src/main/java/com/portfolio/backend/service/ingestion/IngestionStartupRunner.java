package com.portfolio.backend.service.ingestion;

import com.portfolio.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "portfolio.ingestion.run-on-startup", havingValue = "true", matchIfMissing = true)
public class IngestionStartupRunner {

    private final PriceIngestionService priceIngestionService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("Running initial price ingestion");
        scheduledTaskGuard.run("startup-price-ingestion", priceIngestionService::runConfigured);
    }
}
