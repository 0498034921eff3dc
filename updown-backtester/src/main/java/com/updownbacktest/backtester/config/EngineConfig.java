package com.updownbacktest.backtester.config;

import com.updownbacktest.backtester.engine.CandleBuilder;
import com.updownbacktest.backtester.engine.ConditionEvaluator;
import com.updownbacktest.backtester.engine.MarketSelector;
import com.updownbacktest.backtester.engine.MarketSimulator;
import com.updownbacktest.backtester.engine.OrderLadderExecutor;
import com.updownbacktest.backtester.engine.OrderbookRuleEvaluator;
import com.updownbacktest.backtester.engine.PositionSettlement;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the stateless simulation components. They hold no per-run state and are
 * shared by concurrent runs.
 */
@Configuration
public class EngineConfig {

    @Bean
    public CandleBuilder candleBuilder() {
        return new CandleBuilder();
    }

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    public MarketSelector marketSelector(ConditionEvaluator conditionEvaluator) {
        return new MarketSelector(conditionEvaluator);
    }

    @Bean
    public MarketSimulator marketSimulator(ConditionEvaluator conditionEvaluator) {
        return new MarketSimulator(conditionEvaluator, new OrderbookRuleEvaluator(),
                new OrderLadderExecutor(), new PositionSettlement());
    }
}
