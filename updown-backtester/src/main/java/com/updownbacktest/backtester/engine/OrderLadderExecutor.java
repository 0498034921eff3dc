package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.ActiveTrade;
import com.updownbacktest.backtester.domain.OrderLadderItem;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Simulates ladder fills. At most one order fills per entry opportunity.
 */
@Slf4j
public class OrderLadderExecutor {

    /**
     * Fill the first ladder order at its limit price. Used when a condition signal
     * is the timing trigger.
     *
     * @return the opened position, or null when the ladder is empty or unaffordable
     */
    public ActiveTrade fillImmediately(BacktestLedger ledger, String marketId, long timestamp,
                                       List<OrderLadderItem> ladder, String reason) {
        if (ladder == null || ladder.isEmpty()) {
            return null;
        }
        OrderLadderItem order = ladder.get(0);
        return fill(ledger, marketId, timestamp, order, reason);
    }

    /**
     * Fill the first order whose limit the price crossed down through between the
     * previous and the current tick.
     *
     * @return the opened position, or null when nothing crossed or the order is unaffordable
     */
    public ActiveTrade fillOnCross(BacktestLedger ledger, String marketId, long timestamp,
                                   List<OrderLadderItem> ladder, int previousCents, int currentCents,
                                   String reason) {
        if (ladder == null) {
            return null;
        }
        for (OrderLadderItem order : ladder) {
            if (previousCents > order.getPriceCents() && currentCents <= order.getPriceCents()) {
                return fill(ledger, marketId, timestamp, order, reason);
            }
        }
        return null;
    }

    private ActiveTrade fill(BacktestLedger ledger, String marketId, long timestamp, OrderLadderItem order,
                             String reason) {
        ActiveTrade position = ledger.open(marketId, timestamp, order, reason);
        if (position == null) {
            log.debug("Insufficient balance {} for {} shares at {}c, skipping fill",
                    ledger.getBalance(), order.getShares(), order.getPriceCents());
            return null;
        }
        log.debug("BUY {} shares at {}c ({})", order.getShares(), order.getPriceCents(), reason);
        return position;
    }
}
