package com.updownbacktest.backtester.repository;

import com.updownbacktest.backtester.domain.IndicatorCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for precomputed indicator values.
 */
@Repository
public interface IndicatorCacheRepository extends JpaRepository<IndicatorCacheEntry, Long> {

    @Query(value = "SELECT * FROM indicator_cache WHERE asset = :asset AND timeframe = :timeframe " +
            "AND indicator_type = :type AND indicator_params = CAST(:params AS jsonb) " +
            "AND timestamp >= :from AND timestamp <= :to ORDER BY timestamp ASC LIMIT 10000",
            nativeQuery = true)
    List<IndicatorCacheEntry> findRange(
            @Param("asset") String asset,
            @Param("timeframe") String timeframe,
            @Param("type") String type,
            @Param("params") String params,
            @Param("from") Instant from,
            @Param("to") Instant to);
}
