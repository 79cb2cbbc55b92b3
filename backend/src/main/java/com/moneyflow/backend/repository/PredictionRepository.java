package com.moneyflow.backend.repository;

import com.moneyflow.backend.model.Prediction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface PredictionRepository extends JpaRepository<Prediction, Long> {

    Optional<Prediction> findFirstByOrderByCreatedAtDesc();

    Optional<Prediction> findFirstByModelTypeOrderByCreatedAtDesc(String modelType);

    @Modifying
    @Query("delete from Prediction p where p.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
