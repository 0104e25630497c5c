package com.optionbot.runner;

import com.optionbot.core.RunTelemetry;
import com.optionbot.data.DataFetchException;
import com.optionbot.data.market.MarketDataProvider;
import com.optionbot.data.news.NewsProvider;
import com.optionbot.data.news.NewsProviders;
import com.optionbot.model.Headline;
import com.optionbot.model.HeadlineSet;
import com.optionbot.model.OpportunityRecord;
import com.optionbot.model.OptionContract;
import com.optionbot.model.Quote;
import com.optionbot.model.RunReport;
import com.optionbot.model.RunRequest;
import com.optionbot.model.ScanFailureReason;
import com.optionbot.model.SentimentMethod;
import com.optionbot.model.SentimentMode;
import com.optionbot.model.SentimentSummary;
import com.optionbot.model.TheoreticalResult;
import com.optionbot.model.TickerReport;
import com.optionbot.model.TickerStatus;
import com.optionbot.pricing.BlackScholesEngine;
import com.optionbot.pricing.TheoreticalPricer;
import com.optionbot.scoring.ContractScorer;
import com.optionbot.scoring.OpportunityRanking;
import com.optionbot.sentiment.SentimentAggregator;
import com.optionbot.sentiment.SocialSentimentService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Runs the per-ticker pipeline: quote, chain and headlines, one sentiment summary,
 * then pricing and scoring of every contract. Tickers run on a fixed pool; each external
 * fetch runs on a separate I/O pool under its own timeout.
 */
public final class OpportunityRunner {
    private static final Logger LOG = LogManager.getLogger(OpportunityRunner.class);
    public static final Pattern TICKER_PATTERN = Pattern.compile("^[A-Z][A-Z0-9.\\-^]{0,9}$");
    private static final long POLL_SLICE_MS = 200L;

    private final MarketDataProvider market;
    private final NewsProvider news;
    private final SentimentAggregator aggregator;
    private final SocialSentimentService social;
    private final double socialWeight;
    private final ContractScorer scorer;
    private final BlackScholesEngine engine;
    private final RunTelemetry telemetry;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile ExecutorService ioPool;

    public OpportunityRunner(
            MarketDataProvider market,
            NewsProvider news,
            SentimentAggregator aggregator,
            SocialSentimentService social,
            double socialWeight,
            ContractScorer scorer,
            BlackScholesEngine engine,
            RunTelemetry telemetry
    ) {
        if (market == null || news == null || aggregator == null || scorer == null || telemetry == null) {
            throw new IllegalArgumentException("market, news, aggregator, scorer and telemetry are required");
        }
        this.market = market;
        this.news = news;
        this.aggregator = aggregator;
        this.social = social;
        this.socialWeight = Math.max(0.0, Math.min(1.0, socialWeight));
        this.scorer = scorer;
        this.engine = engine == null ? new BlackScholesEngine() : engine;
        this.telemetry = telemetry;
    }

    /**
     * Stops issuing fetches; tickers not yet finished are reported as cancelled.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.warn("run cancellation requested");
            ExecutorService io = ioPool;
            if (io != null) {
                io.shutdownNow();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public RunReport run(RunRequest request) throws InterruptedException {
        Instant startedAt = Instant.now();
        List<String> requested = normalizeTickers(request.tickers);
        telemetry.setTickersRequested(requested.size());
        LOG.info("run {} tickers={} source={} mode={}", telemetry.runId(), requested, news.sourceLabel(), request.sentimentMode);

        Map<String, TickerReport> reports = new HashMap<>();
        List<String> runnable = new ArrayList<>();
        for (String ticker : requested) {
            if (TICKER_PATTERN.matcher(ticker).matches()) {
                runnable.add(ticker);
            } else {
                LOG.warn("ticker rejected: '{}'", ticker);
                reports.put(ticker, TickerReport.skipped(ticker, ScanFailureReason.INVALID_INPUT, "invalid ticker symbol"));
            }
        }

        ExecutorService io = Executors.newCachedThreadPool(daemonFactory("optionbot-io"));
        this.ioPool = io;
        if (cancelled.get()) {
            io.shutdownNow();
        }
        try {
            loadSocial(request);
            scanTickers(request, runnable, reports);
        } finally {
            io.shutdownNow();
            this.ioPool = null;
        }

        Map<String, TickerReport> ordered = new LinkedHashMap<>();
        List<OpportunityRecord> all = new ArrayList<>();
        Set<SentimentMethod> methods = EnumSet.noneOf(SentimentMethod.class);
        for (String ticker : requested) {
            TickerReport report = reports.get(ticker);
            if (report == null) {
                report = TickerReport.skipped(ticker, ScanFailureReason.CANCELLED, "not completed");
            }
            ordered.put(ticker, report);
            if (report.isSkipped()) {
                telemetry.recordTickerSkipped();
            } else {
                telemetry.recordTickerOk(report.status == TickerStatus.DEGRADED_SENTIMENT);
                all.addAll(report.records);
                if (report.sentiment != null && report.sentiment.methodUsed != null) {
                    methods.add(report.sentiment.methodUsed);
                }
            }
        }
        List<OpportunityRecord> ranked = OpportunityRanking.rank(all);
        String method = sentimentMethodLabel(methods, request.sentimentMode);
        telemetry.setSentimentMethod(method, aggregator.selector().resolution().toString());
        telemetry.finish();
        return new RunReport(
                telemetry.runId(),
                request,
                startedAt,
                Instant.now(),
                ranked,
                ordered,
                method,
                telemetry.getSummary(),
                cancelled.get()
        );
    }

    private void scanTickers(RunRequest request, List<String> tickers, Map<String, TickerReport> reports)
            throws InterruptedException {
        int total = tickers.size();
        if (total == 0) {
            return;
        }
        long deadlineNanos = request.runTimeoutSec > 0
                ? System.nanoTime() + TimeUnit.SECONDS.toNanos(request.runTimeoutSec)
                : Long.MAX_VALUE;
        TheoreticalPricer pricer = new TheoreticalPricer(engine, request.riskFreeRate, request.fallbackVolatility);

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(request.threads, total)), daemonFactory("optionbot-ticker"));
        CompletionService<TickerReport> completion = new ExecutorCompletionService<>(pool);
        Map<Future<TickerReport>, String> pending = new HashMap<>();
        for (String ticker : tickers) {
            pending.put(completion.submit(new TickerTask(ticker, request, pricer)), ticker);
        }

        String stopReason = "";
        try {
            int completed = 0;
            while (completed < total) {
                if (cancelled.get()) {
                    stopReason = "run cancelled";
                    break;
                }
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0L) {
                    stopReason = "run deadline of " + request.runTimeoutSec + "s exceeded";
                    cancel();
                    break;
                }
                long waitMs = Math.min(POLL_SLICE_MS, TimeUnit.NANOSECONDS.toMillis(remaining) + 1L);
                Future<TickerReport> future = completion.poll(waitMs, TimeUnit.MILLISECONDS);
                if (future == null) {
                    continue;
                }
                completed++;
                String ticker = pending.remove(future);
                TickerReport report = collect(ticker, future);
                reports.put(report.ticker, report);
                LOG.info("ticker {} done ({}/{}) status={} records={}", report.ticker, completed, total, report.status, report.records.size());
            }
        } finally {
            for (Map.Entry<Future<TickerReport>, String> entry : pending.entrySet()) {
                entry.getKey().cancel(true);
                String ticker = entry.getValue();
                if (!reports.containsKey(ticker)) {
                    reports.put(ticker, TickerReport.skipped(ticker, ScanFailureReason.CANCELLED,
                            stopReason.isEmpty() ? "run interrupted" : stopReason));
                }
            }
            pool.shutdownNow();
        }
    }

    private TickerReport collect(String ticker, Future<TickerReport> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.error("ticker {} failed", ticker, cause);
            telemetry.incrementErrors(1);
            return TickerReport.skipped(ticker, ScanFailureReason.OTHER,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private void loadSocial(RunRequest request) {
        if (social == null || socialWeight <= 0.0 || cancelled.get()) {
            return;
        }
        long started = System.nanoTime();
        int items = 0;
        int errors = 0;
        try {
            items = fetch("social feeds", social::load, request.fetchTimeoutSec * 4);
        } catch (DataFetchException e) {
            errors = 1;
            LOG.warn("social sentiment unavailable: {}", e.getMessage());
        }
        telemetry.recordStep(RunTelemetry.STEP_SOCIAL_FETCH, elapsedMs(started), 1, items, errors);
    }

    private <T> T fetch(String what, Callable<T> call, int timeoutSec) throws DataFetchException {
        if (cancelled.get()) {
            throw new DataFetchException(ScanFailureReason.CANCELLED, what + " skipped: run cancelled");
        }
        ExecutorService io = ioPool;
        if (io == null || io.isShutdown()) {
            throw new DataFetchException(ScanFailureReason.CANCELLED, what + " skipped: run is shutting down");
        }
        Future<T> future;
        try {
            future = io.submit(call);
        } catch (RejectedExecutionException e) {
            throw new DataFetchException(ScanFailureReason.CANCELLED, what + " skipped: run is shutting down", e);
        }
        try {
            return future.get(Math.max(1, timeoutSec), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DataFetchException(ScanFailureReason.TIMEOUT, what + " timed out after " + timeoutSec + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DataFetchException(ScanFailureReason.CANCELLED, what + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw DataFetchException.classify(what, cause, ScanFailureReason.OTHER);
        }
    }

    private final class TickerTask implements Callable<TickerReport> {
        private final String ticker;
        private final RunRequest request;
        private final TheoreticalPricer pricer;

        private TickerTask(String ticker, RunRequest request, TheoreticalPricer pricer) {
            this.ticker = ticker;
            this.request = request;
            this.pricer = pricer;
        }

        @Override
        public TickerReport call() {
            List<String> warnings = new ArrayList<>();

            long started = System.nanoTime();
            Quote quote;
            try {
                quote = fetch("quote " + ticker, () -> market.getQuote(ticker), request.fetchTimeoutSec);
                telemetry.recordStep(RunTelemetry.STEP_QUOTE_FETCH, elapsedMs(started), 1, 1, 0);
            } catch (DataFetchException e) {
                telemetry.recordStep(RunTelemetry.STEP_QUOTE_FETCH, elapsedMs(started), 1, 0, 1);
                return skip(e, ScanFailureReason.QUOTE_UNAVAILABLE);
            }
            if (!quote.hasValidSpot()) {
                LOG.warn("ticker {} skipped: non-positive spot {}", ticker, quote.spot);
                return TickerReport.skipped(ticker, ScanFailureReason.INVALID_INPUT, "spot price must be positive: " + quote.spot);
            }

            long chainStarted = System.nanoTime();
            List<OptionContract> chain;
            try {
                chain = fetch("option chain " + ticker,
                        () -> market.getOptionChain(ticker, request.maxExpirations, quote.observedAt),
                        request.fetchTimeoutSec);
                telemetry.recordStep(RunTelemetry.STEP_CHAIN_FETCH, elapsedMs(chainStarted), 1, chain.size(), 0);
            } catch (DataFetchException e) {
                telemetry.recordStep(RunTelemetry.STEP_CHAIN_FETCH, elapsedMs(chainStarted), 1, 0, 1);
                return skip(e, ScanFailureReason.CHAIN_UNAVAILABLE);
            }
            if (chain == null || chain.isEmpty()) {
                LOG.warn("ticker {} skipped: empty option chain", ticker);
                return TickerReport.skipped(ticker, ScanFailureReason.NO_OPTIONS, "option chain is empty");
            }

            boolean newsFailed = false;
            HeadlineSet headlines = HeadlineSet.empty(ticker, news.sourceLabel());
            if (request.headlineCount > 0) {
                long newsStarted = System.nanoTime();
                String key = NewsProviders.isTickerKeyed(news.sourceLabel()) ? ticker : request.newsKeyFor(ticker);
                try {
                    List<Headline> fetched = fetch("headlines " + ticker, () -> news.fetchHeadlines(key, request.headlineCount), request.fetchTimeoutSec);
                    headlines = new HeadlineSet(ticker, fetched, news.sourceLabel());
                    telemetry.incrementHeadlines(headlines.size());
                    telemetry.recordStep(RunTelemetry.STEP_NEWS_FETCH, elapsedMs(newsStarted), 1, headlines.size(), 0);
                } catch (DataFetchException e) {
                    newsFailed = true;
                    warnings.add("headlines unavailable (" + e.reason().label() + "): " + e.getMessage());
                    LOG.warn("ticker {} headlines unavailable, continuing without news: {}", ticker, e.getMessage());
                    telemetry.recordStep(RunTelemetry.STEP_NEWS_FETCH, elapsedMs(newsStarted), 1, 0, 1);
                }
            }

            long sentimentStarted = System.nanoTime();
            SentimentSummary sentiment = aggregator.summarize(headlines, request.sentimentMode);
            if (social != null && socialWeight > 0.0) {
                sentiment = SentimentAggregator.withSocial(sentiment, social.meanFor(ticker), socialWeight);
            }
            telemetry.recordStep(RunTelemetry.STEP_SENTIMENT, elapsedMs(sentimentStarted), headlines.size(), 1, 0);
            if (sentiment.hasWarning()) {
                warnings.add(sentiment.warning);
            }

            long scoringStarted = System.nanoTime();
            List<OpportunityRecord> records = new ArrayList<>(chain.size());
            int rejected = 0;
            for (OptionContract contract : chain) {
                String invalid = validate(contract);
                if (invalid != null) {
                    rejected++;
                    LOG.debug("contract rejected {}: {}", contract.contractSymbol, invalid);
                    continue;
                }
                TheoreticalResult theoretical;
                try {
                    theoretical = pricer.price(contract, quote);
                } catch (IllegalArgumentException e) {
                    rejected++;
                    LOG.debug("contract rejected {}: {}", contract.contractSymbol, e.getMessage());
                    continue;
                }
                records.add(scorer.score(contract, theoretical, sentiment));
            }
            if (rejected > 0) {
                warnings.add(rejected + " contracts rejected by input validation");
            }
            telemetry.incrementContracts(records.size(), rejected);
            telemetry.recordStep(RunTelemetry.STEP_SCORING, elapsedMs(scoringStarted), chain.size(), records.size(), 0);

            List<OpportunityRecord> ranked = OpportunityRanking.rankTop(records, request.topPerTicker);
            boolean degraded = newsFailed
                    || (request.sentimentMode == SentimentMode.AUTO && sentiment.methodUsed == SentimentMethod.LEXICON);
            return TickerReport.ok(ticker, degraded, warnings, quote, sentiment, ranked, rejected);
        }

        private TickerReport skip(DataFetchException e, ScanFailureReason fallback) {
            ScanFailureReason reason = e.reason() == ScanFailureReason.OTHER ? fallback : e.reason();
            LOG.warn("ticker {} skipped ({}): {}", ticker, reason.label(), e.getMessage());
            return TickerReport.skipped(ticker, reason, e.getMessage());
        }
    }

    static String validate(OptionContract contract) {
        if (contract == null) {
            return "null contract";
        }
        if (contract.kind == null) {
            return "missing option kind";
        }
        if (!Double.isFinite(contract.strike) || contract.strike <= 0.0) {
            return "strike must be positive: " + contract.strike;
        }
        if (contract.expiration == null) {
            return "missing expiration";
        }
        return null;
    }

    static List<String> normalizeTickers(List<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw != null) {
            for (String t : raw) {
                if (t == null || t.isBlank()) {
                    continue;
                }
                out.add(t.trim().toUpperCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(out);
    }

    static String sentimentMethodLabel(Set<SentimentMethod> used, SentimentMode mode) {
        if (used.isEmpty()) {
            return mode == SentimentMode.FALLBACK_ONLY ? SentimentMethod.LEXICON.label() : "none";
        }
        if (used.size() > 1) {
            return SentimentMethod.CLASSIFIER.label() + "+" + SentimentMethod.LEXICON.label();
        }
        return used.iterator().next().label();
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
