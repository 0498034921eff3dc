package com.updownbacktest.backtester.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuickCheckResponse {

    private boolean profitable;
    private BigDecimal pnlPercent;
    private BigDecimal winRate;
}
