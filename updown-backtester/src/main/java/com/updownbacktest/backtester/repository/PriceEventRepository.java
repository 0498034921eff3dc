package com.updownbacktest.backtester.repository;

import com.updownbacktest.backtester.domain.PriceEvent;
import com.updownbacktest.backtester.domain.PriceEventId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for recorded market price events.
 */
@Repository
public interface PriceEventRepository extends JpaRepository<PriceEvent, PriceEventId> {

    /**
     * All rows of one market, oldest first.
     */
    List<PriceEvent> findByMarketIdOrderByEventStartAsc(String marketId);

    /**
     * Events that ended before {@code now}, newest first.
     */
    @Query("SELECT p FROM PriceEvent p WHERE p.eventEnd < :now " +
            "AND p.eventStart >= :from AND p.eventEnd <= :to ORDER BY p.eventStart DESC")
    List<PriceEvent> findCompletedBetween(
            @Param("now") Instant now,
            @Param("from") Instant from,
            @Param("to") Instant to);
}
