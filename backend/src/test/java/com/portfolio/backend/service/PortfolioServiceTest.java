package com.portfolio.backend.service;

import com.portfolio.backend.dto.PortfolioResponse;
import com.portfolio.backend.repository.HoldingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PortfolioServiceTest {

    private HoldingRepository holdingRepository;
    private PortfolioAssignmentService assignmentService;
    private PortfolioValuationService valuationService;
    private PortfolioService portfolioService;

    @BeforeEach
    void setUp() {
        holdingRepository = mock(HoldingRepository.class);
        assignmentService = mock(PortfolioAssignmentService.class);
        valuationService = mock(PortfolioValuationService.class);
        portfolioService = new PortfolioService(holdingRepository, assignmentService, valuationService);
        when(valuationService.valuate(42L)).thenReturn(PortfolioResponse.empty());
    }

    @Test
    void assignsOnFirstAccess() {
        when(holdingRepository.existsByUserId(42L)).thenReturn(false);

        portfolioService.getUserPortfolio(42L);

        verify(assignmentService).assignIfAbsent(42L);
        verify(valuationService).valuate(42L);
    }

    @Test
    void skipsAssignmentWhenHoldingsExist() {
        when(holdingRepository.existsByUserId(42L)).thenReturn(true);

        portfolioService.getUserPortfolio(42L);

        verify(assignmentService, never()).assignIfAbsent(42L);
    }

    @Test
    void concurrentAssignmentStillReturnsValuation() {
        when(holdingRepository.existsByUserId(42L)).thenReturn(false);
        when(assignmentService.assignIfAbsent(42L)).thenThrow(new DataIntegrityViolationException("uk_holdings_user_ticker"));

        PortfolioResponse response = portfolioService.getUserPortfolio(42L);

        assertThat(response).isNotNull();
        verify(valuationService).valuate(42L);
    }
}
