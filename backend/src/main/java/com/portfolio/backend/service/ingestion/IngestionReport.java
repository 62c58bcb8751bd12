package com.portfolio.backend.service.ingestion;

import java.time.Instant;
import java.util.List;

public record IngestionReport(
        Instant startedAt,
        Instant finishedAt,
        boolean endedInSyntheticMode,
        List<SymbolIngestionResult> results
) {

    public long successCount() {
        return results.stream().filter(SymbolIngestionResult::success).count();
    }

    public long errorCount() {
        return results.size() - successCount();
    }

    public int insertedCount() {
        return results.stream().mapToInt(SymbolIngestionResult::insertedCount).sum();
    }
}
