package com.updownbacktest.backtester.domain;

/**
 * How a strategy combines its conditions.
 */
public enum ConditionLogic {
    ALL,
    ANY;

    public static ConditionLogic fromString(String raw) {
        return raw != null && raw.trim().equalsIgnoreCase("any") ? ANY : ALL;
    }
}
