package com.moneyflow.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "signals")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String scenario;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SignalSeverity severity;

    @Column(nullable = false)
    private double confidence;

    @Column(length = 2000)
    private String triggers;

    @Column(length = 1000)
    private String recommendation;

    @Column(length = 2000)
    private String metadata;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant timestamp;

    private Instant deactivatedAt;
}
