package com.moneyflow.backend.service;

import com.moneyflow.backend.config.StorageProperties;
import com.moneyflow.backend.dto.MarketDataPointDTO;
import com.moneyflow.backend.model.MarketDataPoint;
import com.moneyflow.backend.model.Observation;
import com.moneyflow.backend.repository.MarketDataPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class MarketDataService {

    private final MarketDataPointRepository repository;
    private final StorageProperties storageProperties;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    @Transactional
    public MarketDataPoint save(Observation observation) {
        return repository.save(toEntity(observation));
    }

    @Transactional
    public int saveAll(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            return 0;
        }
        List<MarketDataPoint> entities = observations.stream().map(this::toEntity).toList();
        repository.saveAll(entities);
        log.debug("Stored {} market data points", entities.size());
        return entities.size();
    }

    /**
     * Points for one symbol, oldest first. Missing bounds default to the configured lookback.
     */
    @Transactional(readOnly = true)
    public List<MarketDataPoint> find(String symbol, Instant from, Instant to, Integer limit) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(Duration.ofHours(storageProperties.getDefaultLookbackHours()));
        int size = limit != null && limit > 0 ? limit : storageProperties.getDefaultQueryLimit();
        List<MarketDataPoint> newestFirst = repository.findBySymbolAndTimestampBetweenOrderByTimestampDesc(
                Observation.normalizeSymbol(symbol), start, end, PageRequest.of(0, size));
        List<MarketDataPoint> ascending = new ArrayList<>(newestFirst);
        Collections.reverse(ascending);
        return ascending;
    }

    @Transactional(readOnly = true)
    public List<Observation> findObservations(Collection<String> symbols, Instant from, Instant to) {
        Set<String> normalized = symbols.stream()
                .map(Observation::normalizeSymbol)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (normalized.isEmpty()) {
            return List.of();
        }
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(Duration.ofHours(storageProperties.getDefaultLookbackHours()));
        return repository.findBySymbolInAndTimestampBetweenOrderByTimestampAsc(normalized, start, end)
                .stream()
                .map(this::toObservation)
                .toList();
    }

    public MarketDataPointDTO toDto(MarketDataPoint point) {
        return MarketDataPointDTO.builder()
                .symbol(point.getSymbol())
                .timestamp(point.getTimestamp())
                .value(point.getValue())
                .volume(point.getVolume())
                .bid(point.getBid())
                .ask(point.getAsk())
                .build();
    }

    private MarketDataPoint toEntity(Observation observation) {
        return MarketDataPoint.builder()
                .symbol(Observation.normalizeSymbol(observation.getSymbol()))
                .timestamp(observation.getTimestamp() != null ? observation.getTimestamp() : clock.instant())
                .value(observation.getValue())
                .volume(observation.getVolume())
                .bid(observation.getBid())
                .ask(observation.getAsk())
                .open(observation.getOpen())
                .high(observation.getHigh())
                .low(observation.getLow())
                .close(observation.getClose())
                .metadata(observation.getMetadata() == null || observation.getMetadata().isEmpty()
                        ? null
                        : jsonCodec.write(observation.getMetadata()))
                .build();
    }

    private Observation toObservation(MarketDataPoint point) {
        return Observation.builder()
                .symbol(point.getSymbol())
                .timestamp(point.getTimestamp())
                .value(point.getValue())
                .volume(point.getVolume())
                .bid(point.getBid())
                .ask(point.getAsk())
                .open(point.getOpen())
                .high(point.getHigh())
                .low(point.getLow())
                .close(point.getClose())
                .metadata(jsonCodec.readMap(point.getMetadata()))
                .build();
    }
}
