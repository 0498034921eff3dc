package com.updownbacktest.backtester.domain;

public enum PositionState {
    NO_POSITION,
    OPEN,
    CLOSED
}
