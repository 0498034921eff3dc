package com.updownbacktest.backtester.controller;

import com.updownbacktest.backtester.controller.dto.BacktestRequest;
import com.updownbacktest.backtester.controller.dto.BacktestResponse;
import com.updownbacktest.backtester.controller.dto.QuickCheckRequest;
import com.updownbacktest.backtester.controller.dto.QuickCheckResponse;
import com.updownbacktest.backtester.domain.BacktestOptions;
import com.updownbacktest.backtester.domain.BacktestReport;
import com.updownbacktest.backtester.domain.BacktestStrategy;
import com.updownbacktest.backtester.service.BacktestService;
import com.updownbacktest.backtester.service.StrategyMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for backtest runs.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;
    private final StrategyMapper strategyMapper;

    /**
     * Run a backtest synchronously.
     *
     * @param request the strategy and run options
     * @return the aggregated report
     */
    @PostMapping
    public ResponseEntity<BacktestResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {

        log.info("POST /backtests - Strategy: {}, Asset: {}",
                request.getStrategy().getName(), request.getStrategy().getAsset());

        BacktestStrategy strategy = strategyMapper.toDomain(request.getStrategy());
        BacktestOptions options = strategyMapper.toOptions(request);
        BacktestReport report = backtestService.runBacktest(strategy, request.getInitialBalance(), options);

        return ResponseEntity.ok(new BacktestResponse(true, report));
    }

    /**
     * Check whether a strategy would have been profitable over recent history.
     */
    @PostMapping("/quick")
    public ResponseEntity<QuickCheckResponse> quickCheck(@Valid @RequestBody QuickCheckRequest request) {

        log.info("POST /backtests/quick - Strategy: {}, Lookback: {} days",
                request.getStrategy().getName(), request.getLookbackDays());

        BacktestStrategy strategy = strategyMapper.toDomain(request.getStrategy());
        int lookbackDays = request.getLookbackDays() != null ? request.getLookbackDays() : 7;

        return ResponseEntity.ok(backtestService.quickCheck(strategy, request.getMarketId(), lookbackDays));
    }
}
