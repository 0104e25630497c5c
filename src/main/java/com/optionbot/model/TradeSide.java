package com.optionbot.model;

public enum TradeSide {
    BUY,
    SELL,
    NONE
}
