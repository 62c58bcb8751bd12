package com.portfolio.backend.controller;

import com.portfolio.backend.dto.HealthResponse;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    @Test
    void reportsConnectedDatabase() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);

        assertThat(new HealthController(jdbcTemplate).health().database()).isEqualTo("connected");
    }

    @Test
    void reportsDisconnectedDatabaseWithoutFailing() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        HealthResponse response = new HealthController(jdbcTemplate).health();

        assertThat(response.ok()).isFalse();
        assertThat(response.database()).isEqualTo("disconnected");
    }
}
