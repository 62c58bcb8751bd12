package com.portfolio.backend.repository;

import com.portfolio.backend.model.Holding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface HoldingRepository extends JpaRepository<Holding, Long> {

    @Query("select h from Holding h join fetch h.ticker t where h.userId = :userId order by t.symbol asc")
    List<Holding> findByUserIdWithTicker(@Param("userId") Long userId);

    boolean existsByUserId(Long userId);
}
