package com.portfolio.backend.repository;

import com.portfolio.backend.model.PricePoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public interface PricePointRepository extends JpaRepository<PricePoint, Long> {

    @Query("select p.date from PricePoint p where p.ticker.id = :tickerId")
    Set<LocalDate> findDatesByTickerId(@Param("tickerId") Long tickerId);

    /**
     * Latest first; the second element, when present, is the previous trading day.
     */
    List<PricePoint> findTop2ByTickerIdOrderByDateDesc(Long tickerId);
}
