package com.optionbot.scoring;

import com.optionbot.model.OpportunityRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Total order over records: strongest |score| first, then deeper liquidity, nearer expiry,
 * and finally contract identity.
 */
public final class OpportunityRanking {
    public static final Comparator<OpportunityRecord> ORDER = Comparator
            .comparingDouble((OpportunityRecord r) -> Math.abs(r.compositeScore)).reversed()
            .thenComparing(Comparator.comparingDouble((OpportunityRecord r) -> r.liquidity).reversed())
            .thenComparing(r -> r.expiration, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(r -> r.ticker)
            .thenComparing(r -> r.kind)
            .thenComparingDouble(r -> r.strike);

    private OpportunityRanking() {
    }

    public static List<OpportunityRecord> rank(Collection<OpportunityRecord> records) {
        List<OpportunityRecord> out = new ArrayList<>(records == null ? List.of() : records);
        out.sort(ORDER);
        return out;
    }

    /**
     * @param limit 0 keeps every record
     */
    public static List<OpportunityRecord> rankTop(Collection<OpportunityRecord> records, int limit) {
        List<OpportunityRecord> ranked = rank(records);
        if (limit <= 0 || ranked.size() <= limit) {
            return ranked;
        }
        return new ArrayList<>(ranked.subList(0, limit));
    }
}
