package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.IndicatorResult;

import java.util.Collections;
import java.util.List;

/**
 * Time-indexed indicator values with tolerant lookup: exact match, then nearest
 * within a window, then positional fallback.
 */
public class IndicatorSeries {

    private final List<IndicatorResult> results;
    private final long exactToleranceMs;
    private final long nearestWindowMs;

    public IndicatorSeries(List<IndicatorResult> results, long exactToleranceMs, long nearestWindowMs) {
        this.results = results == null ? Collections.emptyList() : results;
        this.exactToleranceMs = exactToleranceMs;
        this.nearestWindowMs = nearestWindowMs;
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /**
     * Find the value for a candle.
     *
     * @param timestamp   the candle timestamp
     * @param candleIndex index of the candle, used only when no timestamp qualifies
     * @return the matched result, or null
     */
    public IndicatorResult lookup(long timestamp, int candleIndex) {
        if (results.isEmpty()) {
            return null;
        }

        // The closest result is also the exact match when one exists.
        int nearest = nearestIndex(timestamp);
        long distance = Math.abs(results.get(nearest).getTimestamp() - timestamp);
        if (distance <= Math.max(exactToleranceMs, nearestWindowMs)) {
            return results.get(nearest);
        }

        // never resolve to a value computed after the candle
        if (candleIndex >= 0 && candleIndex < results.size()
                && results.get(candleIndex).getTimestamp() <= timestamp) {
            return results.get(candleIndex);
        }
        return null;
    }

    private int nearestIndex(long timestamp) {
        int low = 0;
        int high = results.size() - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (results.get(mid).getTimestamp() < timestamp) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        if (low > 0) {
            long before = Math.abs(results.get(low - 1).getTimestamp() - timestamp);
            long after = Math.abs(results.get(low).getTimestamp() - timestamp);
            if (before <= after) {
                return low - 1;
            }
        }
        return low;
    }
}
