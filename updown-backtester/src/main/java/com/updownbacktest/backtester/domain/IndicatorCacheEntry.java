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
 * Precomputed indicator value for one asset candle. {@code value} holds scalar
 * indicators, {@code values} the named sub-values of multi-line indicators.
 */
@Entity
@Table(name = "indicator_cache", uniqueConstraints = {
        @UniqueConstraint(name = "uk_indicator_cache_point",
                columnNames = { "asset", "timeframe", "indicator_type", "indicator_params", "timestamp" })
}, indexes = {
        @Index(name = "idx_indicator_cache_lookup",
                columnList = "asset, timeframe, indicator_type, indicator_params, timestamp")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndicatorCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "asset", nullable = false)
    private String asset;

    @Column(name = "timeframe", nullable = false)
    private String timeframe;

    @Column(name = "indicator_type", nullable = false)
    private String indicatorType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "indicator_params", nullable = false, columnDefinition = "jsonb")
    private String indicatorParams;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "value", columnDefinition = "jsonb")
    private String value;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "\"values\"", columnDefinition = "jsonb")
    private String values;
}
