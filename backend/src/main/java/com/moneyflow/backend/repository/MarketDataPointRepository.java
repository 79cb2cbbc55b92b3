package com.moneyflow.backend.repository;

import com.moneyflow.backend.model.MarketDataPoint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface MarketDataPointRepository extends JpaRepository<MarketDataPoint, Long> {

    List<MarketDataPoint> findBySymbolAndTimestampBetweenOrderByTimestampDesc(String symbol, Instant from, Instant to, Pageable pageable);

    List<MarketDataPoint> findBySymbolInAndTimestampBetweenOrderByTimestampAsc(Collection<String> symbols, Instant from, Instant to);

    @Modifying
    @Query("delete from MarketDataPoint p where p.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
