package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.ActiveTrade;
import com.updownbacktest.backtester.domain.BacktestTrade;
import com.updownbacktest.backtester.domain.Prices;
import com.updownbacktest.backtester.domain.SettlementMode;
import com.updownbacktest.backtester.domain.TradeSide;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Closes positions: at the exit price once reached, otherwise at market end.
 */
@Slf4j
public class PositionSettlement {

    /**
     * Track the running maximum and close at {@code exitPriceCents} once it is reached.
     *
     * @return the closing trade, or null while the position stays open
     */
    public BacktestTrade checkExit(BacktestLedger ledger, ActiveTrade position, long timestamp,
                                   int priceCents, Integer exitPriceCents) {
        position.observe(priceCents);
        if (exitPriceCents == null || position.getMaxPriceCents() < exitPriceCents) {
            return null;
        }
        BacktestTrade trade = ledger.close(position, timestamp, TradeSide.SELL, Prices.toDecimal(exitPriceCents),
                "Exit price " + exitPriceCents + "c reached");
        log.debug("Exit at {}c, pnl {}", exitPriceCents, trade.getPnl());
        return trade;
    }

    /**
     * Settle a position still open when its market ends.
     *
     * @param indicatorTriggered whether the strategy enters on condition signals
     * @param exitPriceCents     configured exit price, null if none
     * @param orderbookMode      settlement for orderbook strategies without an exit price
     */
    public BacktestTrade settleAtMarketEnd(BacktestLedger ledger, ActiveTrade position, long timestamp,
                                           int finalPriceCents, boolean indicatorTriggered,
                                           Integer exitPriceCents, SettlementMode orderbookMode) {
        BacktestTrade trade;
        if (indicatorTriggered) {
            trade = settleBinary(ledger, position, timestamp, finalPriceCents);
        } else if (exitPriceCents != null) {
            trade = ledger.close(position, timestamp, TradeSide.LOSS, BigDecimal.ZERO.setScale(2),
                    "Exit price " + exitPriceCents + "c not reached, expired worthless");
        } else if (orderbookMode == SettlementMode.BINARY) {
            trade = settleBinary(ledger, position, timestamp, finalPriceCents);
        } else {
            trade = ledger.close(position, timestamp, TradeSide.SELL, Prices.toDecimal(finalPriceCents),
                    "Market end, sold at last price " + finalPriceCents + "c");
        }
        log.debug("Settled {} at market end, pnl {}", trade.getSide(), trade.getPnl());
        return trade;
    }

    private BacktestTrade settleBinary(BacktestLedger ledger, ActiveTrade position, long timestamp,
                                       int finalPriceCents) {
        if (finalPriceCents > position.getEntryPriceCents()) {
            return ledger.close(position, timestamp, TradeSide.SELL, Prices.ONE_DOLLAR,
                    "Market resolved WIN (final " + finalPriceCents + "c > entry "
                            + position.getEntryPriceCents() + "c)");
        }
        return ledger.close(position, timestamp, TradeSide.LOSS, BigDecimal.ZERO.setScale(2),
                "Market resolved LOSS (final " + finalPriceCents + "c <= entry "
                        + position.getEntryPriceCents() + "c)");
    }
}
