package com.updownbacktest.backtester.controller.dto;

import com.updownbacktest.backtester.domain.BacktestReport;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BacktestResponse {

    private boolean success;
    private BacktestReport result;
}
