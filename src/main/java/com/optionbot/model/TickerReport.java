package com.optionbot.model;

import java.util.List;
import java.util.Locale;

public final class TickerReport {
    public final String ticker;
    public final TickerStatus status;
    public final ScanFailureReason skipReason;
    public final List<String> warnings;
    public final Quote quote;
    public final SentimentSummary sentiment;
    public final List<OpportunityRecord> records;
    public final int contractsRejected;
    public final String error;

    private TickerReport(
            String ticker,
            TickerStatus status,
            ScanFailureReason skipReason,
            List<String> warnings,
            Quote quote,
            SentimentSummary sentiment,
            List<OpportunityRecord> records,
            int contractsRejected,
            String error
    ) {
        this.ticker = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        this.status = status == null ? TickerStatus.SKIPPED : status;
        this.skipReason = skipReason == null ? ScanFailureReason.NONE : skipReason;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.quote = quote;
        this.sentiment = sentiment;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.contractsRejected = Math.max(0, contractsRejected);
        this.error = error == null ? "" : error;
    }

    public static TickerReport ok(
            String ticker,
            boolean degradedSentiment,
            List<String> warnings,
            Quote quote,
            SentimentSummary sentiment,
            List<OpportunityRecord> records,
            int contractsRejected
    ) {
        return new TickerReport(
                ticker,
                degradedSentiment ? TickerStatus.DEGRADED_SENTIMENT : TickerStatus.OK,
                ScanFailureReason.NONE,
                warnings,
                quote,
                sentiment,
                records,
                contractsRejected,
                ""
        );
    }

    public static TickerReport skipped(String ticker, ScanFailureReason reason, String error, List<String> warnings) {
        return new TickerReport(
                ticker,
                TickerStatus.SKIPPED,
                reason == null ? ScanFailureReason.OTHER : reason,
                warnings,
                null,
                null,
                List.of(),
                0,
                error
        );
    }

    public static TickerReport skipped(String ticker, ScanFailureReason reason, String error) {
        return skipped(ticker, reason, error, List.of());
    }

    public boolean isSkipped() {
        return status == TickerStatus.SKIPPED;
    }
}
