package com.portfolio.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldingResponse {
    private String ticker;
    private String name;
    private int qty;
    private BigDecimal price;
    private BigDecimal dailyChangePct;
    private BigDecimal value;
}
