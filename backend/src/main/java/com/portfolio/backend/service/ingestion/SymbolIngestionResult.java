package com.portfolio.backend.service.ingestion;

/**
 * Outcome of ingesting one symbol. {@code error} is set only when {@code success} is false.
 */
public record SymbolIngestionResult(
        String symbol,
        boolean success,
        Source source,
        int insertedCount,
        String error
) {

    public enum Source {
        PROVIDER,
        SYNTHETIC
    }

    public static SymbolIngestionResult succeeded(String symbol, Source source, int insertedCount) {
        return new SymbolIngestionResult(symbol, true, source, insertedCount, null);
    }

    public static SymbolIngestionResult failed(String symbol, Source source, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new SymbolIngestionResult(symbol, false, source, 0, message);
    }
}
