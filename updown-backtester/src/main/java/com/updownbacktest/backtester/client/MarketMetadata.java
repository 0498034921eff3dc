package com.updownbacktest.backtester.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Market identity as published by the metadata API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarketMetadata {

    private String marketId;
    private String conditionId;
    private String slug;
    private Long eventStart;
    private Long eventEnd;
    private String yesTokenId;
    private String noTokenId;

    public boolean identifies(String candidateId) {
        return candidateId != null
                && (candidateId.equals(marketId) || candidateId.equals(conditionId)
                || candidateId.equals(yesTokenId) || candidateId.equals(noTokenId));
    }
}
