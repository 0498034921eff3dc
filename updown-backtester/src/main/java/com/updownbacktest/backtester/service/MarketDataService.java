package com.updownbacktest.backtester.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbacktest.backtester.config.RedisConfig;
import com.updownbacktest.backtester.domain.MarketWindow;
import com.updownbacktest.backtester.domain.PriceEvent;
import com.updownbacktest.backtester.domain.Tick;
import com.updownbacktest.backtester.repository.PriceEventRepository;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Historical price store over the recorded {@code price_events} rows.
 * Tick histories are cached in Redis (TTL: 10 minutes).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService {

    private static final TypeReference<List<PricePoint>> PRICE_POINTS = new TypeReference<>() {
    };

    private final PriceEventRepository priceEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Load every tick of a market, merged across its rows and sorted by time.
     * Samples outside the event window or outside 0-100 cents are dropped.
     */
    @Cacheable(value = RedisConfig.MARKET_TICKS_CACHE, key = "#marketId")
    public List<Tick> loadMarketTicks(String marketId) {
        List<PriceEvent> events = fetch(() -> priceEventRepository.findByMarketIdOrderByEventStartAsc(marketId));

        List<Tick> ticks = new ArrayList<>();
        for (PriceEvent event : events) {
            long start = event.getEventStart().toEpochMilli();
            long end = event.getEventEnd().toEpochMilli();
            for (PricePoint point : parse(event)) {
                if (point.getT() < start || point.getT() > end || !point.isValid()) {
                    continue;
                }
                ticks.add(point.toTick());
            }
        }
        ticks.sort(Comparator.comparingLong(Tick::getTimestamp));

        log.info("Loaded {} ticks for market {} from {} events", ticks.size(), marketId, events.size());
        return ticks;
    }

    /**
     * Markets whose event has ended, filtered by duration when a timeframe is given,
     * oldest first.
     */
    public List<MarketWindow> findCompletedMarkets(MarketFilter filter) {
        Instant now = clock.instant();
        Instant from = filter.getStartTime() != null ? Instant.ofEpochMilli(filter.getStartTime()) : Instant.EPOCH;
        Instant to = filter.getEndTime() != null ? Instant.ofEpochMilli(filter.getEndTime()) : now;

        List<PriceEvent> events = fetch(() -> priceEventRepository.findCompletedBetween(now, from, to));

        Map<String, MarketWindow> windows = new LinkedHashMap<>();
        for (PriceEvent event : events) {
            MarketWindow window = windows.computeIfAbsent(event.getMarketId(), id -> MarketWindow.builder()
                    .marketId(id)
                    .eventStartMs(event.getEventStart().toEpochMilli())
                    .eventEndMs(event.getEventEnd().toEpochMilli())
                    .build());
            window.setEventStartMs(Math.min(window.getEventStartMs(), event.getEventStart().toEpochMilli()));
            window.setEventEndMs(Math.max(window.getEventEndMs(), event.getEventEnd().toEpochMilli()));
            window.setTickCount(window.getTickCount() + parse(event).size());
        }

        List<MarketWindow> completed = windows.values().stream()
                .filter(window -> window.getTickCount() > 0)
                .filter(window -> filter.getTimeframe() == null
                        || window.getDurationMs() == filter.getTimeframe().getDurationMs())
                .sorted(Comparator.comparingLong(MarketWindow::getEventStartMs).reversed()
                        .thenComparing(MarketWindow::getMarketId))
                .limit(filter.getLimit() > 0 ? filter.getLimit() : Long.MAX_VALUE)
                .sorted(Comparator.comparingLong(MarketWindow::getEventStartMs)
                        .thenComparing(MarketWindow::getMarketId))
                .collect(Collectors.toList());

        log.info("Found {} completed markets ({} events scanned)", completed.size(), events.size());
        return completed;
    }

    private List<PricePoint> parse(PriceEvent event) {
        if (event.getPrices() == null || event.getPrices().isBlank()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(event.getPrices(), PRICE_POINTS);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable prices of market {} at {}: {}",
                    event.getMarketId(), event.getEventStart(), e.getOriginalMessage());
            return Collections.emptyList();
        }
    }

    private <T> T fetch(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new HistoricalDataUnavailableException("Historical price store unavailable: " + e.getMessage(), e);
        }
    }

    /**
     * One sample of the stored price array.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PricePoint {
        private long t;
        private int yb;
        private int ya;
        private int nb;
        private int na;

        boolean isValid() {
            return inRange(yb) && inRange(ya) && inRange(nb) && inRange(na);
        }

        Tick toTick() {
            return Tick.builder()
                    .timestamp(t)
                    .yesBid(yb)
                    .yesAsk(ya)
                    .noBid(nb)
                    .noAsk(na)
                    .build();
        }

        private static boolean inRange(int cents) {
            return cents >= 0 && cents <= 100;
        }
    }
}
