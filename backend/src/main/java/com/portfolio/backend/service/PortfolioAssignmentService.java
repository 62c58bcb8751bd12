package com.portfolio.backend.service;

import com.portfolio.backend.exception.UnauthorizedException;
import com.portfolio.backend.model.Holding;
import com.portfolio.backend.model.Ticker;
import com.portfolio.backend.repository.HoldingRepository;
import com.portfolio.backend.repository.TickerRepository;
import com.portfolio.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Gives a user without holdings a starter basket. The basket is a pure function of the user id
 * and the set of known tickers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioAssignmentService {

    static final int MIN_HOLDINGS = 3;
    static final int MAX_HOLDINGS = 7;
    static final int MIN_QUANTITY = 5;
    static final int MAX_QUANTITY = 50;

    private final UserRepository userRepository;
    private final TickerRepository tickerRepository;
    private final HoldingRepository holdingRepository;

    /**
     * Assigns a basket unless the user already owns something. The user row stays locked for the
     * whole check-and-insert, so concurrent first requests cannot both insert.
     *
     * @return the holdings created by this call, empty when nothing was assigned
     */
    @Transactional
    public List<Holding> assignIfAbsent(Long userId) {
        userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new UnauthorizedException("Unknown user"));
        if (holdingRepository.existsByUserId(userId)) {
            return List.of();
        }
        List<Ticker> tickers = tickerRepository.findAllByOrderBySymbolAsc();
        if (tickers.isEmpty()) {
            log.warn("No tickers available to generate portfolio for user {}", userId);
            return List.of();
        }
        List<Holding> holdings = selectBasket(userId, tickers).stream()
                .map(allocation -> Holding.builder()
                        .userId(userId)
                        .ticker(allocation.ticker())
                        .quantity(allocation.quantity())
                        .build())
                .toList();
        List<Holding> saved = holdingRepository.saveAllAndFlush(holdings);
        log.info("Generated portfolio for user {} with {} holdings", userId, saved.size());
        return saved;
    }

    /**
     * Draws the basket from a generator seeded with the user id. {@code tickers} must be in a
     * stable order. Fewer than three tickers are all taken.
     */
    static List<Allocation> selectBasket(long seed, List<Ticker> tickers) {
        Random random = new Random(seed);
        int available = tickers.size();
        int count;
        if (available < MIN_HOLDINGS) {
            count = available;
        } else {
            int upper = Math.min(MAX_HOLDINGS, available);
            count = MIN_HOLDINGS + random.nextInt(upper - MIN_HOLDINGS + 1);
        }

        List<Ticker> pool = new ArrayList<>(tickers);
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(available - i);
            Ticker picked = pool.get(j);
            pool.set(j, pool.get(i));
            pool.set(i, picked);
        }

        List<Allocation> allocations = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int quantity = MIN_QUANTITY + random.nextInt(MAX_QUANTITY - MIN_QUANTITY + 1);
            allocations.add(new Allocation(pool.get(i), quantity));
        }
        return allocations;
    }

    record Allocation(Ticker ticker, int quantity) {
    }
}
