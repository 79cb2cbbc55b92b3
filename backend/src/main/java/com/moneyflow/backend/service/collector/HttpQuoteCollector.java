package com.moneyflow.backend.service.collector;

import com.moneyflow.backend.config.CollectorProperties;
import com.moneyflow.backend.dto.TickRequest;
import com.moneyflow.backend.model.Observation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Polls a JSON quotes endpoint returning an array of ticks shaped like {@link TickRequest}.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "moneyflow.collectors.http", name = "enabled", havingValue = "true")
public class HttpQuoteCollector implements MarketDataCollector {

    private final CollectorProperties.Http config;
    private final RestTemplate restTemplate;

    @Autowired
    public HttpQuoteCollector(CollectorProperties properties) {
        this(properties, buildRestTemplate(properties.getHttp()));
    }

    HttpQuoteCollector(CollectorProperties properties, RestTemplate restTemplate) {
        this.config = properties.getHttp();
        this.restTemplate = restTemplate;
        if (config.getQuotesUrl() == null || config.getQuotesUrl().isBlank()) {
            throw new IllegalStateException("moneyflow.collectors.http.quotes-url is required when the HTTP collector is enabled");
        }
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public List<Observation> collect(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return List.of();
        }
        String url = UriComponentsBuilder.fromHttpUrl(config.getQuotesUrl())
                .queryParam("symbols", String.join(",", symbols))
                .toUriString();
        TickRequest[] ticks;
        try {
            ticks = restTemplate.getForObject(url, TickRequest[].class);
        } catch (RestClientException e) {
            log.error("Quote collection failed for {}: {}", symbols, e.getMessage());
            return List.of();
        }
        if (ticks == null) {
            return List.of();
        }
        List<Observation> observations = new ArrayList<>(ticks.length);
        Arrays.stream(ticks)
                .filter(tick -> tick != null && tick.getSymbol() != null && tick.getValue() != null)
                .forEach(tick -> observations.add(tick.toObservation()));
        log.debug("Collected {} quotes for {} symbols", observations.size(), symbols.size());
        return observations;
    }

    @Override
    public boolean validateConnection() {
        String url = config.getHealthUrl() != null && !config.getHealthUrl().isBlank()
                ? config.getHealthUrl()
                : config.getQuotesUrl();
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("Quote source unreachable: {}", e.getMessage());
            return false;
        }
    }

    private static RestTemplate buildRestTemplate(CollectorProperties.Http config) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(config.getConnectTimeoutMs());
        factory.setReadTimeout(config.getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
