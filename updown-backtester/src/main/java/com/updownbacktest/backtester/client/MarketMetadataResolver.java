package com.updownbacktest.backtester.client;

import java.util.Optional;

/**
 * Looks up market metadata by slug.
 */
public interface MarketMetadataResolver {

    /**
     * @return the market, or empty when the slug is unknown
     * @throws org.springframework.web.client.RestClientException when the API cannot be reached
     */
    Optional<MarketMetadata> resolveMarketBySlug(String slug);
}
