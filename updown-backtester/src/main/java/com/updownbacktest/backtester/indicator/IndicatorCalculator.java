package com.updownbacktest.backtester.indicator;

import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.Indicator;
import com.updownbacktest.backtester.domain.IndicatorResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Real-time indicator computation over candle closes. Values follow the usual
 * charting conventions: RSI and ATR use Wilder smoothing, EMA is seeded with an SMA.
 * Results start at the first fully warmed-up candle.
 */
@Component
@Slf4j
public class IndicatorCalculator {

    public List<IndicatorResult> calculate(List<Candle> candles, Indicator indicator) {
        if (candles == null || candles.isEmpty()) {
            return Collections.emptyList();
        }
        List<IndicatorResult> results = switch (indicator.getType()) {
            case RSI -> rsi(candles, indicator.intParameter("length", 14));
            case MACD -> macd(candles, indicator.intParameter("fast", 12),
                    indicator.intParameter("slow", 26), indicator.intParameter("signal", 9));
            case SMA -> smaResults(candles, indicator.intParameter("length", 20));
            case EMA -> emaResults(candles, indicator.intParameter("length", 20));
            case BOLLINGER_BANDS -> bollinger(candles, indicator.intParameter("length", 20),
                    indicator.doubleParameter("stdDev", 2));
            case STOCHASTIC -> stochastic(candles, indicator.intParameter("k", 14),
                    indicator.intParameter("smoothK", 1), indicator.intParameter("d", 3));
            case ATR -> atr(candles, indicator.intParameter("length", 14));
            case VWAP -> vwap(candles, resetDaily(indicator.getParameters()));
            case ROLLING_UP_PERCENT -> rollingUpPercent(candles, indicator.intParameter("length", 50));
        };
        log.debug("Calculated {} over {} candles: {} values", indicator.getType(), candles.size(), results.size());
        return results;
    }

    List<IndicatorResult> rsi(List<Candle> candles, int period) {
        if (candles.size() < period + 1) {
            return Collections.emptyList();
        }
        double[] closes = closes(candles);
        double[] gains = new double[closes.length];
        double[] losses = new double[closes.length];
        for (int i = 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            gains[i] = change > 0 ? change : 0;
            losses[i] = change < 0 ? -change : 0;
        }
        double[] avgGain = rma(gains, period);
        double[] avgLoss = rma(losses, period);

        List<IndicatorResult> results = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            if (Double.isNaN(avgGain[i]) || Double.isNaN(avgLoss[i])) {
                continue;
            }
            double value;
            if (avgLoss[i] == 0) {
                value = 100;
            } else if (avgGain[i] == 0) {
                value = 0;
            } else {
                value = 100 - (100 / (1 + avgGain[i] / avgLoss[i]));
            }
            results.add(scalar(candles.get(i), value));
        }
        return results;
    }

    List<IndicatorResult> macd(List<Candle> candles, int fast, int slow, int signal) {
        if (candles.size() < slow + signal) {
            return Collections.emptyList();
        }
        double[] closes = closes(candles);
        double[] fastEma = ema(closes, fast);
        double[] slowEma = ema(closes, slow);
        double[] line = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            line[i] = fastEma[i] - slowEma[i];
        }
        double[] signalLine = ema(line, signal);

        List<IndicatorResult> results = new ArrayList<>();
        // the signal line is only meaningful once the slow EMA has its SMA seed
        for (int i = slow - 1 + signal - 1; i < closes.length; i++) {
            double histogram = line[i] - signalLine[i];
            results.add(IndicatorResult.builder()
                    .timestamp(candles.get(i).getTimestamp())
                    .value(histogram)
                    .field("macd", line[i])
                    .field("signal", signalLine[i])
                    .field("histogram", histogram)
                    .build());
        }
        return results;
    }

    List<IndicatorResult> smaResults(List<Candle> candles, int period) {
        if (candles.size() < period) {
            return Collections.emptyList();
        }
        double[] values = sma(closes(candles), period);
        List<IndicatorResult> results = new ArrayList<>();
        for (int i = period - 1; i < values.length; i++) {
            results.add(scalar(candles.get(i), values[i]));
        }
        return results;
    }

    List<IndicatorResult> emaResults(List<Candle> candles, int period) {
        if (candles.size() < period) {
            return Collections.emptyList();
        }
        double[] values = ema(closes(candles), period);
        List<IndicatorResult> results = new ArrayList<>();
        for (int i = period - 1; i < values.length; i++) {
            results.add(scalar(candles.get(i), values[i]));
        }
        return results;
    }

    List<IndicatorResult> bollinger(List<Candle> candles, int period, double multiplier) {
        if (candles.size() < period) {
            return Collections.emptyList();
        }
        double[] closes = closes(candles);
        double[] basis = sma(closes, period);
        List<IndicatorResult> results = new ArrayList<>();
        for (int i = period - 1; i < closes.length; i++) {
            double sumSquared = 0;
            for (int j = 0; j < period; j++) {
                double diff = closes[i - j] - basis[i];
                sumSquared += diff * diff;
            }
            double deviation = Math.sqrt(sumSquared / period);
            results.add(IndicatorResult.builder()
                    .timestamp(candles.get(i).getTimestamp())
                    .value(basis[i])
                    .field("upper", basis[i] + multiplier * deviation)
                    .field("middle", basis[i])
                    .field("lower", basis[i] - multiplier * deviation)
                    .build());
        }
        return results;
    }

    List<IndicatorResult> stochastic(List<Candle> candles, int lengthK, int smoothK, int lengthD) {
        if (candles.size() < lengthK + lengthD) {
            return Collections.emptyList();
        }
        double[] rawK = new double[candles.size()];
        for (int i = 0; i < candles.size(); i++) {
            if (i < lengthK - 1) {
                rawK[i] = Double.NaN;
                continue;
            }
            double highest = Double.NEGATIVE_INFINITY;
            double lowest = Double.POSITIVE_INFINITY;
            for (int j = i - lengthK + 1; j <= i; j++) {
                highest = Math.max(highest, candles.get(j).getHigh());
                lowest = Math.min(lowest, candles.get(j).getLow());
            }
            double range = highest - lowest;
            rawK[i] = range == 0 ? 50 : 100 * (candles.get(i).getClose() - lowest) / range;
        }
        double[] kLine = smoothK > 1 ? sma(rawK, smoothK) : rawK;
        double[] dLine = sma(kLine, lengthD);

        List<IndicatorResult> results = new ArrayList<>();
        for (int i = 0; i < candles.size(); i++) {
            if (Double.isNaN(kLine[i]) || Double.isNaN(dLine[i])) {
                continue;
            }
            results.add(IndicatorResult.builder()
                    .timestamp(candles.get(i).getTimestamp())
                    .value(kLine[i])
                    .field("k", kLine[i])
                    .field("d", dLine[i])
                    .build());
        }
        return results;
    }

    List<IndicatorResult> atr(List<Candle> candles, int period) {
        if (candles.size() < period + 1) {
            return Collections.emptyList();
        }
        double[] trueRange = new double[candles.size()];
        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            double highLow = candle.getHigh() - candle.getLow();
            if (i == 0) {
                trueRange[i] = highLow;
            } else {
                double previousClose = candles.get(i - 1).getClose();
                trueRange[i] = Math.max(highLow, Math.max(Math.abs(candle.getHigh() - previousClose),
                        Math.abs(candle.getLow() - previousClose)));
            }
        }
        double[] values = rma(trueRange, period);
        List<IndicatorResult> results = new ArrayList<>();
        for (int i = period - 1; i < values.length; i++) {
            results.add(scalar(candles.get(i), values[i]));
        }
        return results;
    }

    List<IndicatorResult> vwap(List<Candle> candles, boolean resetDaily) {
        List<IndicatorResult> results = new ArrayList<>();
        double cumulativeTpv = 0;
        double cumulativeVolume = 0;
        int lastDay = -1;
        for (Candle candle : candles) {
            int day = Instant.ofEpochMilli(candle.getTimestamp()).atZone(ZoneOffset.UTC).getDayOfMonth();
            if (resetDaily && lastDay != -1 && day != lastDay) {
                cumulativeTpv = 0;
                cumulativeVolume = 0;
            }
            lastDay = day;

            double typicalPrice = (candle.getHigh() + candle.getLow() + candle.getClose()) / 3;
            double volume = candle.getVolume() > 0 ? candle.getVolume() : 1;
            cumulativeTpv += typicalPrice * volume;
            cumulativeVolume += volume;
            results.add(scalar(candle, cumulativeTpv / cumulativeVolume));
        }
        return results;
    }

    List<IndicatorResult> rollingUpPercent(List<Candle> candles, int length) {
        if (candles.size() < length) {
            return Collections.emptyList();
        }
        List<IndicatorResult> results = new ArrayList<>();
        for (int i = length - 1; i < candles.size(); i++) {
            int up = 0;
            for (int j = i - length + 1; j <= i; j++) {
                if (candles.get(j).getClose() >= candles.get(j).getOpen()) {
                    up++;
                }
            }
            results.add(scalar(candles.get(i), up * 100.0 / length));
        }
        return results;
    }

    private static boolean resetDaily(Map<String, Double> parameters) {
        Double value = parameters == null ? null : parameters.get("resetDaily");
        return value == null || value != 0;
    }

    private static IndicatorResult scalar(Candle candle, double value) {
        return IndicatorResult.builder()
                .timestamp(candle.getTimestamp())
                .value(value)
                .build();
    }

    private static double[] closes(List<Candle> candles) {
        double[] closes = new double[candles.size()];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = candles.get(i).getClose();
        }
        return closes;
    }

    static double[] sma(double[] values, int period) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (i < period - 1) {
                result[i] = Double.NaN;
                continue;
            }
            double sum = 0;
            for (int j = 0; j < period; j++) {
                sum += values[i - j];
            }
            result[i] = sum / period;
        }
        return result;
    }

    /**
     * Exponential average: warm-up values blend from the first sample, index
     * {@code period - 1} is re-seeded with the SMA.
     */
    static double[] ema(double[] values, int period) {
        double[] result = new double[values.length];
        double alpha = 2.0 / (period + 1);
        for (int i = 0; i < values.length; i++) {
            if (i == 0) {
                result[i] = values[i];
            } else if (i == period - 1) {
                double sum = 0;
                for (int j = 0; j < period; j++) {
                    sum += values[i - j];
                }
                result[i] = sum / period;
            } else {
                result[i] = alpha * values[i] + (1 - alpha) * result[i - 1];
            }
        }
        return result;
    }

    /**
     * Wilder smoothing, seeded with the SMA of the first {@code period} values.
     */
    static double[] rma(double[] values, int period) {
        double[] result = new double[values.length];
        double alpha = 1.0 / period;
        for (int i = 0; i < values.length; i++) {
            if (i < period - 1) {
                result[i] = Double.NaN;
            } else if (i == period - 1) {
                double sum = 0;
                for (int j = 0; j < period; j++) {
                    sum += values[i - j];
                }
                result[i] = sum / period;
            } else {
                result[i] = alpha * values[i] + (1 - alpha) * result[i - 1];
            }
        }
        return result;
    }
}
