package com.moneyflow.backend.repository;

import com.moneyflow.backend.model.SignalRecord;
import com.moneyflow.backend.model.SignalSeverity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface SignalRecordRepository extends JpaRepository<SignalRecord, Long> {

    List<SignalRecord> findByActiveTrueOrderByTimestampDesc(Pageable pageable);

    List<SignalRecord> findByActiveTrueAndSeverityOrderByTimestampDesc(SignalSeverity severity, Pageable pageable);

    @Modifying
    @Query("delete from SignalRecord s where s.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
