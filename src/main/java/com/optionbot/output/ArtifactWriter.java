package com.optionbot.output;

import com.optionbot.core.CsvSupport;
import com.optionbot.core.RunTelemetry;
import com.optionbot.model.OpportunityRecord;
import com.optionbot.model.RunReport;
import com.optionbot.model.ScoredHeadline;
import com.optionbot.model.SentimentSummary;
import com.optionbot.model.TickerReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Writes {@code opportunities_<ts>.csv} (every record field) and {@code run_summary_<ts>.json}.
 */
public final class ArtifactWriter {
    private static final Logger LOG = LogManager.getLogger(ArtifactWriter.class);
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    static final List<String> CSV_HEADER = List.of(
            "rank", "ticker", "kind", "strike", "expiration", "contract_symbol", "spot",
            "last_price", "bid", "ask", "implied_volatility", "open_interest", "volume",
            "theoretical_value", "delta", "vega", "time_to_expiry_years", "volatility_used", "degenerate_pricing",
            "market_price", "pricing_gap", "liquidity", "spread_penalty", "sentiment_alignment",
            "composite_score", "risk_flag", "risk_reasons", "bucket", "side"
    );

    private final Path outputDir;

    public ArtifactWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public record Artifacts(Path csv, Path summary) {
    }

    public Artifacts write(RunReport report, RunTelemetry telemetry) throws IOException {
        Files.createDirectories(outputDir);
        String ts = TS.format(report.startedAt == null ? Instant.now() : report.startedAt);
        Path csv = outputDir.resolve("opportunities_" + ts + ".csv");
        Path summary = outputDir.resolve("run_summary_" + ts + ".json");

        try (BufferedWriter w = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
            w.write(CsvSupport.joinRow(CSV_HEADER));
            w.newLine();
            int rank = 1;
            for (OpportunityRecord r : report.records) {
                w.write(CsvSupport.joinRow(csvRow(rank++, r)));
                w.newLine();
            }
        }
        Files.writeString(summary, summaryJson(report, telemetry).toString(2), StandardCharsets.UTF_8);
        LOG.info("artifacts written: {} ({} rows), {}", csv, report.records.size(), summary);
        return new Artifacts(csv, summary);
    }

    static List<String> csvRow(int rank, OpportunityRecord r) {
        return List.of(
                Integer.toString(rank),
                r.ticker,
                r.kind.label(),
                num(r.strike),
                r.expiration == null ? "" : r.expiration.toString(),
                r.contractSymbol == null ? "" : r.contractSymbol,
                num(r.spot),
                num(r.lastPrice),
                num(r.bid),
                num(r.ask),
                num(r.impliedVolatility),
                Long.toString(r.openInterest),
                Long.toString(r.volume),
                num(r.theoreticalValue),
                num(r.delta),
                num(r.vega),
                num(r.timeToExpiryYears),
                num(r.volatilityUsed),
                Boolean.toString(r.degeneratePricing),
                num(r.marketPrice),
                num(r.pricingGap),
                num(r.liquidity),
                num(r.spreadPenalty),
                num(r.sentimentAlignment),
                num(r.compositeScore),
                Boolean.toString(r.riskFlag),
                String.join(";", r.riskReasons == null ? List.of() : r.riskReasons),
                r.bucket.name(),
                r.side.name()
        );
    }

    /**
     * Round-trip representation so no precision is lost; NaN is written as an empty cell.
     */
    static String num(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        return Double.toString(value);
    }

    static JSONObject summaryJson(RunReport report, RunTelemetry telemetry) {
        JSONObject root = new JSONObject();
        root.put("run_id", report.runId);
        root.put("started_at", report.startedAt == null ? "" : report.startedAt.toString());
        root.put("finished_at", report.finishedAt == null ? "" : report.finishedAt.toString());
        root.put("cancelled", report.cancelled);
        root.put("sentiment_method", report.sentimentMethod);
        root.put("records_total", report.records.size());

        if (report.request != null) {
            JSONObject req = new JSONObject();
            req.put("tickers", new JSONArray(report.request.tickers == null ? List.of() : report.request.tickers));
            req.put("max_expirations", report.request.maxExpirations);
            req.put("risk_free_rate", report.request.riskFreeRate);
            req.put("headline_count", report.request.headlineCount);
            req.put("sentiment_mode", String.valueOf(report.request.sentimentMode));
            req.put("news_source", report.request.newsSource);
            req.put("query", report.request.query == null ? "" : report.request.query);
            req.put("top_per_ticker", report.request.topPerTicker);
            root.put("request", req);
        }

        JSONArray tickers = new JSONArray();
        for (TickerReport t : report.tickers.values()) {
            tickers.put(tickerJson(t));
        }
        root.put("tickers", tickers);

        if (telemetry != null) {
            JSONArray steps = new JSONArray();
            for (RunTelemetry.StepRecord step : telemetry.stepRecords()) {
                JSONObject s = new JSONObject();
                s.put("name", step.name());
                s.put("elapsed_ms", step.elapsedMs());
                s.put("items_in", step.itemsIn());
                s.put("items_out", step.itemsOut());
                s.put("errors", step.errorCount());
                if (!step.note().isBlank()) {
                    s.put("note", step.note());
                }
                steps.put(s);
            }
            root.put("steps", steps);
            root.put("errors_total", telemetry.errorsTotal());
        }
        return root;
    }

    private static JSONObject tickerJson(TickerReport t) {
        JSONObject o = new JSONObject();
        o.put("ticker", t.ticker);
        o.put("status", t.status.name());
        o.put("skip_reason", t.skipReason.label());
        if (!t.error.isEmpty()) {
            o.put("error", t.error);
        }
        o.put("warnings", new JSONArray(t.warnings));
        o.put("records", t.records.size());
        o.put("contracts_rejected", t.contractsRejected);
        if (t.quote != null) {
            o.put("spot", t.quote.spot);
            o.put("quote_time", t.quote.observedAt.toString());
        }
        if (t.sentiment != null) {
            o.put("sentiment", sentimentJson(t.sentiment));
        }
        return o;
    }

    private static JSONObject sentimentJson(SentimentSummary s) {
        JSONObject o = new JSONObject();
        o.put("method", s.methodUsed == null ? "" : s.methodUsed.label());
        o.put("mean", s.mean);
        o.put("std", s.std);
        o.put("count", s.count);
        o.put("effective_mean", s.effectiveMean());
        if (s.hasSocial()) {
            o.put("social_mean", s.socialMean);
            o.put("social_weight", s.socialWeight);
        }
        if (s.hasWarning()) {
            o.put("warning", s.warning);
        }
        o.put("top_positive", headlinesJson(s.topPositive));
        o.put("top_negative", headlinesJson(s.topNegative));
        return o;
    }

    private static JSONArray headlinesJson(List<ScoredHeadline> list) {
        JSONArray out = new JSONArray();
        if (list == null) {
            return out;
        }
        for (ScoredHeadline h : list) {
            JSONObject o = new JSONObject();
            o.put("index", h.index());
            o.put("score", Double.parseDouble(String.format(Locale.US, "%.4f", h.score())));
            o.put("text", h.headline().text);
            o.put("source", h.headline().source);
            o.put("url", h.headline().link);
            out.put(o);
        }
        return out;
    }
}
