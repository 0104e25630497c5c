package com.optionbot.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("run_1", "manual", Instant.parse("2026-02-23T00:00:00Z"));
        telemetry.setTickersRequested(3);
        telemetry.recordTickerOk(false);
        telemetry.recordTickerOk(true);
        telemetry.recordTickerSkipped();
        telemetry.startStep(RunTelemetry.STEP_NEWS_FETCH);
        telemetry.endStep(RunTelemetry.STEP_NEWS_FETCH, 10, 7, 1);
        telemetry.setSentimentMethod("lexicon", "sentiment.classifier=DISABLED_BY_CONFIG");
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("run_id=run_1"));
        assertTrue(summary.contains("trigger=manual"));
        assertTrue(summary.contains("total_elapsed_ms="));
        assertTrue(summary.contains("sentiment_method=lexicon reason=sentiment.classifier=DISABLED_BY_CONFIG"));
        assertTrue(summary.contains("tickers_ok=1"));
        assertTrue(summary.contains("tickers_degraded=1"));
        assertTrue(summary.contains("tickers_skipped=1"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains(RunTelemetry.STEP_NEWS_FETCH));
    }

    @Test
    void recordStep_shouldAccumulateAcrossWorkers() {
        RunTelemetry telemetry = new RunTelemetry("run_2", "manual", Instant.now());
        telemetry.recordStep("quote_fetch", 40, 1, 1, 0);
        telemetry.recordStep(RunTelemetry.STEP_QUOTE_FETCH, 60, 1, 0, 1);
        telemetry.incrementErrors(2);

        List<RunTelemetry.StepRecord> steps = telemetry.stepRecords();

        assertEquals(1, steps.size());
        assertEquals(RunTelemetry.STEP_QUOTE_FETCH, steps.get(0).name());
        assertEquals(100L, steps.get(0).elapsedMs());
        assertEquals(2L, steps.get(0).itemsIn());
        assertEquals(1L, steps.get(0).errorCount());
        assertEquals(3, telemetry.errorsTotal());
    }

    @Test
    void endStep_shouldMergeNotes() {
        RunTelemetry telemetry = new RunTelemetry(null, null, null);
        telemetry.startStep(RunTelemetry.STEP_SELF_TEST);
        telemetry.endStep(RunTelemetry.STEP_SELF_TEST, 1, 0, 1, "failed");
        telemetry.startStep(RunTelemetry.STEP_SELF_TEST);
        telemetry.endStep(RunTelemetry.STEP_SELF_TEST, 1, 0, 1, "failed");

        assertEquals("failed", telemetry.stepRecords().get(0).note());
        assertEquals("run", telemetry.runId());
    }
}
