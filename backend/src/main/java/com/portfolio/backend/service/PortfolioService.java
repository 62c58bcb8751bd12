package com.portfolio.backend.service;

import com.portfolio.backend.dto.PortfolioResponse;
import com.portfolio.backend.repository.HoldingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioService {

    private final HoldingRepository holdingRepository;
    private final PortfolioAssignmentService portfolioAssignmentService;
    private final PortfolioValuationService portfolioValuationService;

    /**
     * Valuation of the user's holdings, assigning a starter basket on first access.
     */
    public PortfolioResponse getUserPortfolio(Long userId) {
        if (!holdingRepository.existsByUserId(userId)) {
            try {
                portfolioAssignmentService.assignIfAbsent(userId);
            } catch (DataIntegrityViolationException e) {
                // another request inserted the same basket first; its rows are the ones we read below
                log.info("Portfolio for user {} was assigned concurrently", userId);
            }
        }
        return portfolioValuationService.valuate(userId);
    }
}
