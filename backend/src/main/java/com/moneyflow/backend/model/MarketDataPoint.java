package com.moneyflow.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "market_data", indexes = {
        @Index(name = "idx_market_data_symbol_ts", columnList = "symbol, observed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketDataPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(name = "observed_at", nullable = false)
    private Instant timestamp;

    @Column(name = "price_value", nullable = false)
    private double value;

    private Long volume;
    private Double bid;
    private Double ask;

    @Column(name = "open_price")
    private Double open;

    @Column(name = "high_price")
    private Double high;

    @Column(name = "low_price")
    private Double low;

    @Column(name = "close_price")
    private Double close;

    @Column(length = 2000)
    private String metadata;
}
