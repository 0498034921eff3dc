package com.updownbacktest.backtester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * One recorded market event: a compact JSON array of {@code {t, yb, ya, nb, na}}
 * samples in cents, written by the price recorder.
 */
@Entity
@Table(name = "price_events", indexes = {
        @Index(name = "idx_price_events_market_time", columnList = "market_id, event_start"),
        @Index(name = "idx_price_events_time", columnList = "event_start")
})
@IdClass(PriceEventId.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceEvent {

    @Id
    @Column(name = "market_id", nullable = false)
    private String marketId;

    @Id
    @Column(name = "event_start", nullable = false)
    private Instant eventStart;

    @Column(name = "event_end", nullable = false)
    private Instant eventEnd;

    @Column(name = "yes_token_id", nullable = false)
    private String yesTokenId;

    @Column(name = "no_token_id", nullable = false)
    private String noTokenId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "prices", nullable = false, columnDefinition = "jsonb")
    private String prices;
}
