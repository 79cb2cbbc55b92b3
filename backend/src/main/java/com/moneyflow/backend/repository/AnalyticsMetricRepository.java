package com.moneyflow.backend.repository;

import com.moneyflow.backend.model.AnalyticsMetric;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface AnalyticsMetricRepository extends JpaRepository<AnalyticsMetric, Long> {

    List<AnalyticsMetric> findByMetricNameOrderByTimestampDesc(String metricName, Pageable pageable);

    @Modifying
    @Query("delete from AnalyticsMetric m where m.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
