package com.portfolio.backend.controller;

import com.portfolio.backend.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    @GetMapping("/healthz")
    @Operation(summary = "Liveness and database connectivity")
    public HealthResponse health() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            log.debug("Health check passed");
            return HealthResponse.connected();
        } catch (DataAccessException e) {
            log.error("Health check failed: {}", e.getMessage());
            return HealthResponse.disconnected();
        }
    }
}
