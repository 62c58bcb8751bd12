package com.portfolio.backend.dto;

import com.portfolio.backend.util.MoneyUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioResponse {

    @Builder.Default
    private List<HoldingResponse> holdings = new ArrayList<>();

    @Builder.Default
    private BigDecimal totalValue = MoneyUtils.DISPLAY_ZERO;

    public static PortfolioResponse empty() {
        return PortfolioResponse.builder().build();
    }
}
