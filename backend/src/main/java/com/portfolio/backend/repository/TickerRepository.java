package com.portfolio.backend.repository;

import com.portfolio.backend.model.Ticker;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TickerRepository extends JpaRepository<Ticker, Long> {
    Optional<Ticker> findBySymbol(String symbol);
    List<Ticker> findAllByOrderBySymbolAsc();
}
