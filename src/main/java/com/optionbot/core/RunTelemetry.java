package com.optionbot.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-run step timings and counters. Shared by ticker workers, so every accessor is synchronized.
 */
public final class RunTelemetry {
    public static final String STEP_SELF_TEST = "SELF_TEST";
    public static final String STEP_QUOTE_FETCH = "QUOTE_FETCH";
    public static final String STEP_CHAIN_FETCH = "CHAIN_FETCH";
    public static final String STEP_NEWS_FETCH = "NEWS_FETCH";
    public static final String STEP_SOCIAL_FETCH = "SOCIAL_FETCH";
    public static final String STEP_SENTIMENT = "SENTIMENT";
    public static final String STEP_SCORING = "SCORING";
    public static final String STEP_ARTIFACT_WRITE = "ARTIFACT_WRITE";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;

    private String sentimentMethod;
    private String sentimentReason;
    private int tickersRequested;
    private int tickersOk;
    private int tickersDegraded;
    private int tickersSkipped;
    private int contractsScored;
    private int contractsRejected;
    private int headlinesFetched;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runId, String trigger, Instant startedAt) {
        this.runId = blankTo(runId, "run");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.sentimentMethod = "unknown";
        this.sentimentReason = "";
    }

    public synchronized String runId() {
        return runId;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        String key = stepKey(name);
        steps.computeIfAbsent(key, StepStat::new);
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    /**
     * Closes the innermost open {@link #startStep} for this name; an unmatched end records zero elapsed time.
     */
    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = stepKey(name);
        Deque<Long> open = stepStartsNanos.get(key);
        long elapsedMs = 0L;
        if (open != null && !open.isEmpty()) {
            elapsedMs = (System.nanoTime() - open.pop()) / 1_000_000L;
        }
        accumulate(key, elapsedMs, itemsIn, itemsOut, errorCount).addNote(note);
    }

    /**
     * Adds elapsed time measured outside the start/end pair, e.g. by a ticker worker.
     */
    public synchronized void recordStep(String name, long elapsedMs, long itemsIn, long itemsOut, long errorCount) {
        accumulate(stepKey(name), elapsedMs, itemsIn, itemsOut, errorCount);
    }

    private StepStat accumulate(String key, long elapsedMs, long itemsIn, long itemsOut, long errorCount) {
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        stat.add(elapsedMs, itemsIn, itemsOut, errorCount);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
        return stat;
    }

    public synchronized void setSentimentMethod(String method, String reason) {
        this.sentimentMethod = blankTo(method, "unknown");
        this.sentimentReason = reason == null ? "" : reason.trim();
    }

    public synchronized void setTickersRequested(int count) {
        this.tickersRequested = Math.max(0, count);
    }

    public synchronized void recordTickerOk(boolean degraded) {
        if (degraded) {
            tickersDegraded++;
        } else {
            tickersOk++;
        }
    }

    public synchronized void recordTickerSkipped() {
        tickersSkipped++;
    }

    public synchronized void incrementContracts(int scored, int rejected) {
        this.contractsScored += Math.max(0, scored);
        this.contractsRejected += Math.max(0, rejected);
    }

    public synchronized void incrementHeadlines(int count) {
        this.headlinesFetched += Math.max(0, count);
    }

    public synchronized void incrementErrors(int count) {
        if (count <= 0) {
            return;
        }
        this.errorsTotal += count;
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>(steps.size());
        steps.values().forEach(stat -> out.add(stat.snapshot()));
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        String method = sentimentReason.isEmpty() ? sentimentMethod : sentimentMethod + " reason=" + sentimentReason;
        StringBuilder sb = new StringBuilder();
        line(sb, "run_id", runId);
        line(sb, "trigger", trigger);
        line(sb, "started_at", ISO.format(startedAt));
        line(sb, "finished_at", ISO.format(end));
        line(sb, "total_elapsed_ms", totalElapsedMs());
        line(sb, "sentiment_method", method);
        line(sb, "tickers_requested", tickersRequested);
        line(sb, "tickers_ok", tickersOk);
        line(sb, "tickers_degraded", tickersDegraded);
        line(sb, "tickers_skipped", tickersSkipped);
        line(sb, "contracts_scored", contractsScored);
        line(sb, "contracts_rejected", contractsRejected);
        line(sb, "headlines_fetched", headlinesFetched);
        line(sb, "errors_total", errorsTotal);
        sb.append("steps:\n");
        steps.values().forEach(stat -> sb.append("  ").append(stat.describe()).append('\n'));
        return sb.toString().trim();
    }

    private static void line(StringBuilder sb, String key, Object value) {
        sb.append(key).append('=').append(value).append('\n');
    }

    private static String stepKey(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }

        private void add(long elapsed, long in, long out, long errors) {
            elapsedMs += Math.max(0L, elapsed);
            itemsIn += Math.max(0L, in);
            itemsOut += Math.max(0L, out);
            errorCount += Math.max(0L, errors);
        }

        // repeated notes are kept once, in first-seen order
        private void addNote(String raw) {
            String text = raw == null ? "" : raw.trim();
            if (text.isEmpty() || note.contains(text)) {
                return;
            }
            note = note.isEmpty() ? text : note + "; " + text;
        }

        private StepRecord snapshot() {
            return new StepRecord(name, elapsedMs, itemsIn, itemsOut, errorCount, note);
        }

        private String describe() {
            String line = String.format(Locale.US, "%s elapsed_ms=%d in=%d out=%d err=%d",
                    name, elapsedMs, itemsIn, itemsOut, errorCount);
            return note.isEmpty() ? line : line + " note=" + note;
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String note
    ) {
    }
}
