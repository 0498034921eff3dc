package com.updownbacktest.backtester.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Strategy as submitted by API callers. Names of operators, fields and
 * indicator types are free-form strings here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyRequest {

    private String id;

    @NotBlank(message = "Strategy name is required")
    private String name;

    private String asset;

    /** UP or DOWN. */
    private String direction;

    private String timeframe;

    @Valid
    @Builder.Default
    private List<IndicatorRequest> indicators = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<ConditionRequest> conditions = new ArrayList<>();

    /** all or any. */
    private String conditionLogic;

    @Valid
    @Builder.Default
    private List<OrderbookRuleRequest> orderbookRules = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<OrderLadderItemRequest> orderLadder = new ArrayList<>();

    private String market;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class IndicatorRequest {

        @NotBlank(message = "Indicator id is required")
        private String id;

        @NotBlank(message = "Indicator type is required")
        private String type;

        private String timeframe;

        @Builder.Default
        private Map<String, Double> parameters = new HashMap<>();

        private Boolean useInConditions;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ConditionRequest {

        private String id;

        @NotBlank(message = "Condition sourceA is required")
        private String sourceA;

        @NotBlank(message = "Condition operator is required")
        private String operator;

        private String sourceB;

        private Double value;

        private Double value2;

        /** current or previous. */
        private String candle;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OrderbookRuleRequest {

        private String id;

        @NotBlank(message = "Orderbook rule field is required")
        private String field;

        @NotBlank(message = "Orderbook rule operator is required")
        private String operator;

        @NotNull(message = "Orderbook rule value is required")
        private Double value;

        private Double value2;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OrderLadderItemRequest {

        @NotNull(message = "Order price is required")
        @Min(value = 1, message = "Order price must be at least 1 cent")
        @Max(value = 99, message = "Order price must be at most 99 cents")
        private Integer price;

        @NotNull(message = "Order shares are required")
        @Positive(message = "Order shares must be positive")
        private Integer shares;
    }
}
