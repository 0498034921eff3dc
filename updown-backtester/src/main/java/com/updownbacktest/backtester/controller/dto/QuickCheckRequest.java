package com.updownbacktest.backtester.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a quick profitability check over recent history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuickCheckRequest {

    @NotNull(message = "Strategy is required")
    @Valid
    private StrategyRequest strategy;

    private String marketId;

    @Min(value = 1, message = "Lookback must be at least 1 day")
    @Max(value = 90, message = "Lookback must be at most 90 days")
    @Builder.Default
    private Integer lookbackDays = 7;
}
