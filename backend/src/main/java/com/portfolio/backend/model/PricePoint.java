package com.portfolio.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One trading day of OHLCV data for a ticker. Rows are insert-only.
 */
@Entity
@Table(name = "prices", uniqueConstraints = @UniqueConstraint(columnNames = {"ticker_id", "price_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricePoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ticker_id", nullable = false, updatable = false)
    @ToString.Exclude
    private Ticker ticker;

    @Column(name = "price_date", nullable = false, updatable = false)
    private LocalDate date;

    @Column(name = "open_price", precision = 19, scale = 4, updatable = false)
    private BigDecimal open;

    @Column(name = "high_price", precision = 19, scale = 4, updatable = false)
    private BigDecimal high;

    @Column(name = "low_price", precision = 19, scale = 4, updatable = false)
    private BigDecimal low;

    @Column(name = "close_price", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal close;

    @Column(updatable = false)
    private Long volume;
}
