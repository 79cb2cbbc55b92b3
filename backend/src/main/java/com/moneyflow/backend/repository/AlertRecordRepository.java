package com.moneyflow.backend.repository;

import com.moneyflow.backend.model.AlertRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface AlertRecordRepository extends JpaRepository<AlertRecord, Long> {

    List<AlertRecord> findByTimestampBetweenOrderByTimestampDesc(Instant from, Instant to, Pageable pageable);

    @Modifying
    @Query("delete from AlertRecord a where a.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
