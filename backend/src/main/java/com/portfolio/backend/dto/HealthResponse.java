package com.portfolio.backend.dto;

public record HealthResponse(boolean ok, String database) {

    public static HealthResponse connected() {
        return new HealthResponse(true, "connected");
    }

    public static HealthResponse disconnected() {
        return new HealthResponse(false, "disconnected");
    }
}
