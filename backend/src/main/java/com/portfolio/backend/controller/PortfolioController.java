package com.portfolio.backend.controller;

import com.portfolio.backend.dto.PortfolioResponse;
import com.portfolio.backend.exception.UnauthorizedException;
import com.portfolio.backend.security.UserPrincipal;
import com.portfolio.backend.service.PortfolioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/portfolio")
@RequiredArgsConstructor
@Tag(name = "Portfolio")
public class PortfolioController {

    private final PortfolioService portfolioService;

    @GetMapping
    @Operation(summary = "Get the current user's portfolio with latest prices",
            security = @SecurityRequirement(name = "bearerAuth"))
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = PortfolioResponse.class)))
    public ResponseEntity<PortfolioResponse> getPortfolio(@AuthenticationPrincipal UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Invalid or expired token");
        }
        log.info("Fetching portfolio for user: {}", principal.getEmail());
        PortfolioResponse portfolio = portfolioService.getUserPortfolio(principal.getUserId());
        log.info("Portfolio retrieved for {}: {} holdings, total value: {}",
                principal.getEmail(), portfolio.getHoldings().size(), portfolio.getTotalValue());
        return ResponseEntity.ok(portfolio);
    }
}
