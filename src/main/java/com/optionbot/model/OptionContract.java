package com.optionbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One listed contract with the market fields captured at fetch time.
 * Missing bid/ask/last/IV are carried as 0 or NaN, never as a substitute value.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class OptionContract {
    public final String ticker;
    public final OptionKind kind;
    public final double strike;
    public final LocalDate expiration;
    public final String contractSymbol;
    public final double lastPrice;
    public final double bid;
    public final double ask;
    public final double impliedVolatility;
    public final long openInterest;
    public final long volume;

    public ContractId id() {
        return new ContractId(ticker, kind, strike, expiration);
    }

    public boolean hasTwoSidedQuote() {
        return isPositive(bid) && isPositive(ask) && ask >= bid;
    }

    public double mid() {
        return hasTwoSidedQuote() ? (bid + ask) / 2.0 : Double.NaN;
    }

    /**
     * Mid when both sides are quoted, otherwise the last trade (0 when absent).
     */
    public double marketPrice() {
        if (hasTwoSidedQuote()) {
            return mid();
        }
        return Double.isFinite(lastPrice) && lastPrice > 0.0 ? lastPrice : 0.0;
    }

    public long activity() {
        return Math.max(0L, volume) + Math.max(0L, openInterest);
    }

    private static boolean isPositive(double value) {
        return Double.isFinite(value) && value > 0.0;
    }
}
