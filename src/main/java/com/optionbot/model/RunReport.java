package com.optionbot.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RunReport {
    public final String runId;
    public final RunRequest request;
    public final Instant startedAt;
    public final Instant finishedAt;
    public final List<OpportunityRecord> records;
    /** Keyed by ticker, in request order. */
    public final Map<String, TickerReport> tickers;
    public final String sentimentMethod;
    public final String telemetrySummary;
    public final boolean cancelled;

    public RunReport(
            String runId,
            RunRequest request,
            Instant startedAt,
            Instant finishedAt,
            List<OpportunityRecord> records,
            Map<String, TickerReport> tickers,
            String sentimentMethod,
            String telemetrySummary,
            boolean cancelled
    ) {
        this.runId = runId == null ? "" : runId;
        this.request = request;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.tickers = tickers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tickers));
        this.sentimentMethod = sentimentMethod == null ? "" : sentimentMethod;
        this.telemetrySummary = telemetrySummary == null ? "" : telemetrySummary;
        this.cancelled = cancelled;
    }

    public List<TickerReport> tickerReports() {
        return new ArrayList<>(tickers.values());
    }

    public long countByStatus(TickerStatus status) {
        return tickers.values().stream().filter(r -> r.status == status).count();
    }
}
