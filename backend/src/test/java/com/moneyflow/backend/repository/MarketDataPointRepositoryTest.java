package com.moneyflow.backend.repository;

import com.moneyflow.backend.model.MarketDataPoint;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class MarketDataPointRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-08-05T09:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private MarketDataPointRepository repository;

    @Test
    void symbolWindowIsNewestFirstAndPaged() {
        for (int i = 0; i < 5; i++) {
            entityManager.persist(point("SPY", T0.plusSeconds(60L * i), 500 + i));
        }
        entityManager.persist(point("QQQ", T0.plusSeconds(30), 430));
        entityManager.flush();

        List<MarketDataPoint> page = repository.findBySymbolAndTimestampBetweenOrderByTimestampDesc(
                "SPY", T0, T0.plusSeconds(600), PageRequest.of(0, 3));

        assertThat(page).extracting(MarketDataPoint::getValue).containsExactly(504.0, 503.0, 502.0);
    }

    @Test
    void multiSymbolQueryIsChronological() {
        entityManager.persist(point("SPY", T0.plusSeconds(120), 501));
        entityManager.persist(point("QQQ", T0.plusSeconds(60), 430));
        entityManager.persist(point("GLD", T0.plusSeconds(30), 220));
        entityManager.flush();

        List<MarketDataPoint> rows = repository.findBySymbolInAndTimestampBetweenOrderByTimestampAsc(
                List.of("SPY", "QQQ"), T0, T0.plusSeconds(600));

        assertThat(rows).extracting(MarketDataPoint::getSymbol).containsExactly("QQQ", "SPY");
    }

    @Test
    void deleteOlderThanKeepsRecentRows() {
        entityManager.persist(point("SPY", T0.minusSeconds(3600), 499));
        entityManager.persist(point("SPY", T0, 500));
        entityManager.flush();

        int deleted = repository.deleteOlderThan(T0);

        assertThat(deleted).isEqualTo(1);
        assertThat(repository.findAll()).extracting(MarketDataPoint::getValue).containsExactly(500.0);
    }

    private static MarketDataPoint point(String symbol, Instant timestamp, double value) {
        return MarketDataPoint.builder()
                .symbol(symbol)
                .timestamp(timestamp)
                .value(value)
                .volume(1_000L)
                .build();
    }
}
