package com.updownbacktest.backtester.service;

import com.updownbacktest.backtester.client.MarketMetadata;
import com.updownbacktest.backtester.client.MarketMetadataResolver;
import com.updownbacktest.backtester.client.MarketSlugs;
import com.updownbacktest.backtester.config.BacktestProperties;
import com.updownbacktest.backtester.domain.MarketWindow;
import com.updownbacktest.backtester.domain.Timeframe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Confirms that a stored market really is the asset/timeframe market its start time
 * suggests, by resolving its slug against the metadata API.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketVerificationService {

    private final MarketMetadataResolver marketMetadataResolver;
    private final BacktestProperties properties;

    /**
     * Open a verification session for one run. Sessions memoize results and are not
     * thread-safe.
     */
    public VerificationSession openSession(String asset, Timeframe timeframe) {
        return new VerificationSession(asset, timeframe);
    }

    /**
     * Per-run verifier. Calls are spaced by the configured delay; after too many
     * consecutive failures every duration-matched market is accepted.
     */
    public class VerificationSession implements Predicate<MarketWindow> {

        private final String asset;
        private final Timeframe timeframe;
        private final Map<String, Boolean> verified = new HashMap<>();
        private int consecutiveFailures;
        private boolean fallback;
        private int calls;

        VerificationSession(String asset, Timeframe timeframe) {
            this.asset = asset;
            this.timeframe = timeframe;
        }

        @Override
        public boolean test(MarketWindow market) {
            BacktestProperties.Verification config = properties.getVerification();
            if (!config.isEnabled() || fallback) {
                return true;
            }
            Boolean known = verified.get(market.getMarketId());
            if (known != null) {
                return known;
            }

            Optional<String> slug = MarketSlugs.forMarket(asset, timeframe, market.getEventStartMs());
            if (slug.isEmpty()) {
                verified.put(market.getMarketId(), true);
                return true;
            }

            throttle(config.getDelayMs());
            try {
                Optional<MarketMetadata> metadata = marketMetadataResolver.resolveMarketBySlug(slug.get());
                consecutiveFailures = 0;
                boolean matches = metadata.map(m -> m.identifies(market.getMarketId())).orElse(false);
                if (!matches) {
                    log.info("Market {} does not match slug {}, skipping", market.getMarketId(), slug.get());
                }
                verified.put(market.getMarketId(), matches);
                return matches;
            } catch (RestClientException e) {
                consecutiveFailures++;
                log.warn("Verification of {} failed ({}/{}): {}", slug.get(), consecutiveFailures,
                        config.getMaxConsecutiveFailures(), e.getMessage());
                if (consecutiveFailures >= config.getMaxConsecutiveFailures()) {
                    log.warn("Falling back to duration-based market matching for {} {}",
                            asset, timeframe.getLabel());
                    fallback = true;
                }
                return fallback;
            }
        }

        public boolean isFallback() {
            return fallback;
        }

        private void throttle(long delayMs) {
            if (calls++ == 0 || delayMs <= 0) {
                return;
            }
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BacktestException("Interrupted while verifying markets", e);
            }
        }
    }
}
