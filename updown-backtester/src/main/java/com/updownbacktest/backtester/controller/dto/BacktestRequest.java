package com.updownbacktest.backtester.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for running a backtest.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    @NotNull(message = "Strategy is required")
    @Valid
    private StrategyRequest strategy;

    /** Backtest a single market instead of selecting several. */
    private String marketId;

    @Min(value = 1, message = "Number of markets must be at least 1")
    @Max(value = 50, message = "Number of markets must be at most 50")
    private Integer numberOfMarkets;

    /** Exit price in cents. */
    @Min(value = 1, message = "Exit price must be at least 1 cent")
    @Max(value = 100, message = "Exit price must be at most 100 cents")
    private Integer exitPrice;

    private Long startTime;

    private Long endTime;

    @Positive(message = "Initial balance must be positive")
    private BigDecimal initialBalance;

    /** MARK_TO_MARKET or BINARY, for orderbook positions without an exit price. */
    private String settlementMode;
}
