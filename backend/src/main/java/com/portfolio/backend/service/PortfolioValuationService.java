package com.portfolio.backend.service;

import com.portfolio.backend.dto.HoldingResponse;
import com.portfolio.backend.dto.PortfolioResponse;
import com.portfolio.backend.model.Holding;
import com.portfolio.backend.model.PricePoint;
import com.portfolio.backend.model.Ticker;
import com.portfolio.backend.repository.HoldingRepository;
import com.portfolio.backend.repository.PricePointRepository;
import com.portfolio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Values a user's holdings at the latest close and reports the change against the previous close.
 *
 * <p>Each holding's {@code value} is rounded on its own while {@code totalValue} is the rounded sum
 * of the unrounded values, so the two can differ by a cent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioValuationService {

    private final HoldingRepository holdingRepository;
    private final PricePointRepository pricePointRepository;

    @Transactional(readOnly = true)
    public PortfolioResponse valuate(Long userId) {
        List<Holding> holdings = holdingRepository.findByUserIdWithTicker(userId);
        if (holdings.isEmpty()) {
            return PortfolioResponse.empty();
        }

        List<HoldingResponse> rows = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Holding holding : holdings) {
            Ticker ticker = holding.getTicker();
            List<PricePoint> recent = pricePointRepository.findTop2ByTickerIdOrderByDateDesc(ticker.getId());
            if (recent.isEmpty()) {
                log.debug("No prices for {}, leaving it out of the valuation", ticker.getSymbol());
                continue;
            }
            BigDecimal latest = recent.get(0).getClose();
            BigDecimal previous = recent.size() > 1 ? recent.get(1).getClose() : null;
            BigDecimal value = MoneyUtils.multiply(latest, holding.getQuantity());
            total = total.add(value);

            rows.add(HoldingResponse.builder()
                    .ticker(ticker.getSymbol())
                    .name(ticker.getName())
                    .qty(holding.getQuantity())
                    .price(MoneyUtils.round2(latest))
                    .dailyChangePct(MoneyUtils.percentChange(latest, previous))
                    .value(MoneyUtils.round2(value))
                    .build());
        }

        return PortfolioResponse.builder()
                .holdings(rows)
                .totalValue(MoneyUtils.round2(total))
                .build();
    }
}
