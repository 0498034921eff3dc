package com.updownbacktest.backtester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbacktest.backtester.config.BacktestProperties;
import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.Indicator;
import com.updownbacktest.backtester.domain.IndicatorCacheEntry;
import com.updownbacktest.backtester.domain.IndicatorResult;
import com.updownbacktest.backtester.domain.Timeframe;
import com.updownbacktest.backtester.engine.IndicatorSeries;
import com.updownbacktest.backtester.indicator.IndicatorCalculator;
import com.updownbacktest.backtester.repository.IndicatorCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Indicator value provider: precomputed values from {@code indicator_cache} when
 * they cover the requested candles, real-time computation otherwise.
 */
@Service
@Slf4j
public class IndicatorService {

    private static final TypeReference<Map<String, Double>> FIELD_MAP = new TypeReference<>() {
    };

    private final IndicatorCacheRepository indicatorCacheRepository;
    private final IndicatorCalculator indicatorCalculator;
    private final ObjectMapper objectMapper;
    private final BacktestProperties properties;
    private final Executor indicatorExecutor;

    public IndicatorService(IndicatorCacheRepository indicatorCacheRepository,
                            IndicatorCalculator indicatorCalculator,
                            ObjectMapper objectMapper,
                            BacktestProperties properties,
                            @Qualifier("indicatorExecutor") Executor indicatorExecutor) {
        this.indicatorCacheRepository = indicatorCacheRepository;
        this.indicatorCalculator = indicatorCalculator;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.indicatorExecutor = indicatorExecutor;
    }

    /**
     * Compute the series of every indicator used in conditions. Lookups run
     * concurrently; the result is keyed by indicator id.
     *
     * @param asset cache key; null skips the cache (market-local candles)
     */
    public Map<String, IndicatorSeries> calculateAll(String asset, Timeframe timeframe, List<Candle> candles,
                                                     List<Indicator> indicators) {
        Map<String, CompletableFuture<List<IndicatorResult>>> futures = new LinkedHashMap<>();
        for (Indicator indicator : indicators) {
            futures.put(indicator.getId(), CompletableFuture.supplyAsync(
                    () -> calculate(asset, timeframe, candles, indicator), indicatorExecutor));
        }

        Map<String, IndicatorSeries> series = new LinkedHashMap<>();
        try {
            futures.forEach((id, future) -> series.put(id, toSeries(future.join())));
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        return series;
    }

    public IndicatorSeries toSeries(List<IndicatorResult> results) {
        return new IndicatorSeries(results, properties.getLookup().getExactToleranceMs(),
                properties.getLookup().getNearestWindowMs());
    }

    /**
     * Values of one indicator over {@code candles}.
     */
    public List<IndicatorResult> calculate(String asset, Timeframe timeframe, List<Candle> candles,
                                           Indicator indicator) {
        if (candles.isEmpty()) {
            return Collections.emptyList();
        }
        if (asset != null) {
            List<IndicatorResult> cached = fromCache(asset, timeframe, candles, indicator);
            if (!cached.isEmpty()) {
                return cached;
            }
        }
        return indicatorCalculator.calculate(candles, indicator);
    }

    private List<IndicatorResult> fromCache(String asset, Timeframe timeframe, List<Candle> candles,
                                            Indicator indicator) {
        long first = candles.get(0).getTimestamp();
        long last = candles.get(candles.size() - 1).getTimestamp();
        List<IndicatorCacheEntry> entries;
        try {
            entries = indicatorCacheRepository.findRange(asset.toUpperCase(), timeframe.getLabel(),
                    indicator.getType().getDisplayName(), canonicalParameters(indicator.getParameters()),
                    Instant.ofEpochMilli(first), Instant.ofEpochMilli(last));
        } catch (DataAccessException e) {
            log.warn("Indicator cache unavailable for {} {}, computing in real time: {}",
                    asset, indicator.getType(), e.getMessage());
            return Collections.emptyList();
        }

        if (entries.isEmpty()) {
            log.info("Indicator cache miss for {} {} {}, computing in real time",
                    asset, timeframe.getLabel(), indicator.getType());
            return Collections.emptyList();
        }

        long newest = entries.get(entries.size() - 1).getTimestamp().toEpochMilli();
        if (newest + properties.getLookup().getExactToleranceMs() < last) {
            log.info("Indicator cache for {} {} ends before the last candle, computing in real time",
                    asset, indicator.getType());
            return Collections.emptyList();
        }

        List<IndicatorResult> results = new ArrayList<>(entries.size());
        for (IndicatorCacheEntry entry : entries) {
            results.add(toResult(entry));
        }
        log.debug("Indicator cache hit for {} {}: {} values", asset, indicator.getType(), results.size());
        return results;
    }

    private IndicatorResult toResult(IndicatorCacheEntry entry) {
        IndicatorResult.IndicatorResultBuilder builder = IndicatorResult.builder()
                .timestamp(entry.getTimestamp().toEpochMilli());
        try {
            if (entry.getValue() != null && !"null".equals(entry.getValue())) {
                builder.value(objectMapper.readValue(entry.getValue(), Double.class));
            }
            if (entry.getValues() != null && !"null".equals(entry.getValues())) {
                Map<String, Double> fields = objectMapper.readValue(entry.getValues(), FIELD_MAP);
                fields.forEach((name, value) -> {
                    if (value != null) {
                        builder.field(name, value);
                    }
                });
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cached indicator value at {}: {}", entry.getTimestamp(), e.getOriginalMessage());
        }
        return builder.build();
    }

    /**
     * Parameters as JSON with sorted keys and integral numbers written without a
     * fraction, so equal parameter sets always produce the same cache key.
     */
    String canonicalParameters(Map<String, Double> parameters) {
        Map<String, Object> sorted = new TreeMap<>();
        if (parameters != null) {
            parameters.forEach((name, value) -> {
                if (value != null) {
                    sorted.put(name, value == Math.rint(value) && !Double.isInfinite(value)
                            ? (Object) value.longValue() : value);
                }
            });
        }
        try {
            return objectMapper.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable indicator parameters: " + parameters, e);
        }
    }
}
