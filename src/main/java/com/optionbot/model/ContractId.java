package com.optionbot.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Locale;

/**
 * Identity of a listed option: (ticker, kind, strike, expiration).
 */
public record ContractId(
        String ticker,
        OptionKind kind,
        double strike,
        LocalDate expiration
) implements Comparable<ContractId> {
    private static final Comparator<ContractId> ORDER = Comparator
            .comparing(ContractId::ticker)
            .thenComparing(ContractId::expiration, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ContractId::kind)
            .thenComparingDouble(ContractId::strike);

    public ContractId {
        ticker = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        if (kind == null) {
            throw new IllegalArgumentException("option kind is required");
        }
    }

    @Override
    public int compareTo(ContractId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s %s %s %.2f", ticker, expiration, kind.label(), strike);
    }
}
