package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Composite key of {@link PriceEvent}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceEventId implements Serializable {

    private String marketId;
    private Instant eventStart;
}
