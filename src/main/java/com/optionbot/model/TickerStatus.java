package com.optionbot.model;

public enum TickerStatus {
    OK,
    DEGRADED_SENTIMENT,
    SKIPPED
}
