package com.optionbot.app;

import com.optionbot.config.Config;
import com.optionbot.core.RunTelemetry;
import com.optionbot.data.DataFetchException;
import com.optionbot.data.http.HttpClientEx;
import com.optionbot.data.market.MarketDataProvider;
import com.optionbot.data.market.YahooMarketDataService;
import com.optionbot.data.news.CsvHeadlineSource;
import com.optionbot.data.news.NewsProvider;
import com.optionbot.data.news.NewsProviders;
import com.optionbot.model.OpportunityRecord;
import com.optionbot.model.RunReport;
import com.optionbot.model.RunRequest;
import com.optionbot.model.SentimentMode;
import com.optionbot.model.TickerReport;
import com.optionbot.output.ArtifactWriter;
import com.optionbot.pricing.BlackScholesEngine;
import com.optionbot.pricing.PricingSelfTest;
import com.optionbot.pricing.PricingSelfTestException;
import com.optionbot.runner.OpportunityRunner;
import com.optionbot.scoring.ContractScorer;
import com.optionbot.scoring.ScoringPolicy;
import com.optionbot.sentiment.ClassifierScorer;
import com.optionbot.sentiment.LexiconScorer;
import com.optionbot.sentiment.ScorerSelector;
import com.optionbot.sentiment.SentimentAggregator;
import com.optionbot.sentiment.SentimentLexicon;
import com.optionbot.sentiment.SocialSentimentService;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class OptionBotApplication {
    private static final Logger LOG = LogManager.getLogger(OptionBotApplication.class);
    private static final DateTimeFormatter RUN_ID_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_SELF_TEST = 3;

    /** Command-line options that override one config key each. */
    private static final Map<String, String> OPTION_KEYS = Map.ofEntries(
            Map.entry("tickers", "pipeline.tickers"),
            Map.entry("max-expirations", "pipeline.max_expirations"),
            Map.entry("rate", "pipeline.risk_free_rate"),
            Map.entry("top-per-ticker", "pipeline.top_per_ticker"),
            Map.entry("threads", "pipeline.threads"),
            Map.entry("run-timeout", "pipeline.run_timeout_sec"),
            Map.entry("fetch-timeout", "fetch.timeout_sec"),
            Map.entry("headlines", "news.headline_count"),
            Map.entry("news-source", "news.source"),
            Map.entry("query", "news.query"),
            Map.entry("sentiment-mode", "sentiment.mode"),
            Map.entry("output-dir", "outputs.dir"),
            Map.entry("headlines-csv", "news.csv.path"),
            Map.entry("cache-hours", "news.cache.max_age_hours"),
            Map.entry("rss-hours", "sentiment.social.window_hours")
    );

    public static void main(String[] args) {
        int exit = new OptionBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("optionbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("optionbot", options);
            return EXIT_OK;
        }

        Config config;
        RunRequest request;
        try {
            config = Config.load(Path.of(".").toAbsolutePath().normalize());
            applyOverrides(cmd, config);
            request = RunRequest.fromConfig(config);
            validateRequest(request);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        installLogRoutingIfNeeded(config);

        String runId = "run_" + RUN_ID_FMT.format(Instant.now());
        RunTelemetry telemetry = new RunTelemetry(runId, cmd.hasOption("self-test") ? "self-test" : "cli", Instant.now());
        BlackScholesEngine engine = new BlackScholesEngine();

        telemetry.startStep(RunTelemetry.STEP_SELF_TEST);
        try {
            new PricingSelfTest(engine).verify();
            telemetry.endStep(RunTelemetry.STEP_SELF_TEST, 1, 1, 0);
        } catch (PricingSelfTestException e) {
            telemetry.endStep(RunTelemetry.STEP_SELF_TEST, 1, 0, e.failures().size(), "failed");
            LOG.error("aborting: {}", e.getMessage());
            return EXIT_SELF_TEST;
        }
        if (cmd.hasOption("self-test")) {
            System.out.println("pricing self-test passed");
            return EXIT_OK;
        }

        try {
            return runPipeline(cmd, config, request, telemetry, engine);
        } catch (IllegalArgumentException e) {
            LOG.error("configuration error: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("run interrupted");
            return EXIT_FATAL;
        } catch (Exception e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    private int runPipeline(
            CommandLine cmd,
            Config config,
            RunRequest request,
            RunTelemetry telemetry,
            BlackScholesEngine engine
    ) throws IOException, InterruptedException {
        HttpClientEx http = new HttpClientEx();
        MarketDataProvider market = new YahooMarketDataService(http, request.fetchTimeoutSec);
        NewsProvider news = NewsProviders.create(request.newsSource, config, http);
        LexiconScorer lexicon = new LexiconScorer(SentimentLexicon.loadDefault());

        boolean classifierConfigured = config.getBoolean("sentiment.classifier.enabled", true);
        boolean classifierWanted = classifierConfigured && request.sentimentMode == SentimentMode.AUTO;
        ScorerSelector selector = new ScorerSelector(classifierConfigured, true);

        SocialSentimentService social = null;
        double socialWeight = 0.0;
        if (config.getBoolean("sentiment.social.enabled", false)) {
            social = new SocialSentimentService(http, config.getList("sentiment.social.feeds"), lexicon,
                    request.fetchTimeoutSec, config.getHours("sentiment.social.window_hours", 24.0));
            socialWeight = config.getDouble("sentiment.social.weight", 0.25);
        }

        ContractScorer scorer = new ContractScorer(ScoringPolicy.fromConfig(config));
        LOG.info("score weights: {}", scorer.policy());

        try (ClassifierScorer classifier = classifierWanted ? new ClassifierScorer(config) : null) {
            SentimentAggregator aggregator = new SentimentAggregator(
                    classifier, lexicon, selector, config.getInt("sentiment.top_k", SentimentAggregator.DEFAULT_TOP_K));
            OpportunityRunner runner = new OpportunityRunner(
                    market, news, aggregator, social, socialWeight, scorer, engine, telemetry);

            Thread hook = new Thread(runner::cancel, "optionbot-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            RunReport report;
            try {
                report = runner.run(request);
            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException ignored) {
                    // JVM already shutting down; the hook has fired
                }
            }

            if (!cmd.hasOption("no-artifacts")) {
                telemetry.startStep(RunTelemetry.STEP_ARTIFACT_WRITE);
                ArtifactWriter.Artifacts artifacts = new ArtifactWriter(config.getPath("outputs.dir")).write(report, telemetry);
                telemetry.endStep(RunTelemetry.STEP_ARTIFACT_WRITE, report.records.size(), 2, 0);
                System.out.println("CSV: " + artifacts.csv().toAbsolutePath());
                System.out.println("Summary: " + artifacts.summary().toAbsolutePath());
            }

            printReport(report, Math.max(1, parseIntOption(cmd, "show", 10)));
            LOG.info("run telemetry\n{}", telemetry.getSummary());
            return EXIT_OK;
        }
    }

    private void printReport(RunReport report, int show) {
        for (TickerReport t : report.tickers.values()) {
            StringBuilder line = new StringBuilder();
            line.append(String.format(Locale.US, "%-6s %-18s", t.ticker, t.status));
            if (t.isSkipped()) {
                line.append(" reason=").append(t.skipReason.label());
                if (!t.error.isEmpty()) {
                    line.append(" (").append(t.error).append(')');
                }
            } else {
                line.append(String.format(Locale.US, " spot=%.2f records=%d rejected=%d",
                        t.quote.spot, t.records.size(), t.contractsRejected));
                if (t.sentiment != null) {
                    line.append(String.format(Locale.US, " sentiment=%s mean=%.3f n=%d",
                            t.sentiment.methodUsed.label(), t.sentiment.effectiveMean(), t.sentiment.count));
                }
            }
            System.out.println(line);
        }
        List<OpportunityRecord> records = report.records;
        int n = Math.min(show, records.size());
        if (n > 0) {
            System.out.println("Top " + n + " of " + records.size() + " contracts:");
        }
        for (int i = 0; i < n; i++) {
            OpportunityRecord r = records.get(i);
            System.out.println(String.format(Locale.US,
                    "%3d. %-6s %s %-4s K=%-9.2f mkt=%-8.2f fair=%-8.2f score=%7.2f %-7s %-4s%s",
                    i + 1, r.ticker, r.expiration, r.kind.label(), r.strike, r.marketPrice, r.theoreticalValue,
                    r.compositeScore, r.bucket, r.side, r.riskFlag ? " risk=" + String.join(",", r.riskReasons) : ""));
        }
    }

    static void applyOverrides(CommandLine cmd, Config config) {
        for (Map.Entry<String, String> entry : OPTION_KEYS.entrySet()) {
            if (cmd.hasOption(entry.getKey())) {
                config.put(entry.getValue(), cmd.getOptionValue(entry.getKey()));
            }
        }
        if (cmd.hasOption("fallback-only")) {
            config.put("sentiment.mode", "fallback-only");
        }
        if (cmd.hasOption("no-classifier")) {
            config.put("sentiment.classifier.enabled", "false");
        }
        if (cmd.hasOption("social")) {
            config.put("sentiment.social.enabled", "true");
        }
        if (cmd.hasOption("no-cache")) {
            config.put("news.cache.enabled", "false");
        }
        if (cmd.hasOption("tickers-from-headlines")) {
            config.put("pipeline.tickers", String.join(",", headlineTickers(config.getPath("news.csv.path"))));
        }
    }

    static List<String> headlineTickers(Path csv) {
        try {
            List<String> tickers = new CsvHeadlineSource(csv).tickers();
            LOG.info("{} tickers taken from the query column of {}", tickers.size(), csv);
            return tickers;
        } catch (DataFetchException e) {
            throw new IllegalArgumentException("cannot take tickers from headlines: " + e.getMessage(), e);
        }
    }

    static void validateRequest(RunRequest request) {
        if (request.tickers.isEmpty()) {
            throw new IllegalArgumentException("no tickers requested (pipeline.tickers or --tickers)");
        }
        if (!Double.isFinite(request.riskFreeRate)) {
            throw new IllegalArgumentException("risk-free rate must be a number");
        }
    }

    private static int parseIntOption(CommandLine cmd, String name, int fallback) {
        String raw = cmd.getOptionValue(name);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (OptionBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("optionbot.log.dir", logDir.toAbsolutePath().toString());
                // the context already exists (static loggers); reload it so the file appender picks up the dir
                ((LoggerContext) LogManager.getContext(false)).reconfigure();

                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("log routing enabled, dir={}", logDir.toAbsolutePath());
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("tickers").hasArg().argName("list").desc("comma-separated tickers, e.g. SPY,AAPL").build());
        options.addOption(Option.builder().longOpt("tickers-from-headlines").desc("take tickers from the query column of the headline csv").build());
        options.addOption(Option.builder().longOpt("max-expirations").hasArg().argName("n").desc("expirations per ticker").build());
        options.addOption(Option.builder().longOpt("rate").hasArg().argName("r").desc("annual risk-free rate, e.g. 0.045").build());
        options.addOption(Option.builder().longOpt("headlines").hasArg().argName("n").desc("headlines per ticker").build());
        options.addOption(Option.builder().longOpt("news-source").hasArg().argName("src").desc("yahoo | google | newsapi | csv").build());
        options.addOption(Option.builder().longOpt("query").hasArg().argName("text").desc("news query for query sources; {ticker} is substituted").build());
        options.addOption(Option.builder().longOpt("headlines-csv").hasArg().argName("file").desc("headline csv for the csv source and the newsapi cache").build());
        options.addOption(Option.builder().longOpt("cache-hours").hasArg().argName("h").desc("reuse newsapi headlines cached within this many hours (default 24)").build());
        options.addOption(Option.builder().longOpt("no-cache").desc("always call newsapi, ignoring cached headlines").build());
        options.addOption(Option.builder().longOpt("sentiment-mode").hasArg().argName("mode").desc("auto | fallback-only").build());
        options.addOption(Option.builder().longOpt("fallback-only").desc("score headlines with the lexicon only").build());
        options.addOption(Option.builder().longOpt("no-classifier").desc("disable the model classifier").build());
        options.addOption(Option.builder().longOpt("social").desc("blend RSS social sentiment into the news mean").build());
        options.addOption(Option.builder().longOpt("rss-hours").hasArg().argName("h").desc("social feed rolling window in hours (default 24)").build());
        options.addOption(Option.builder().longOpt("top-per-ticker").hasArg().argName("n").desc("keep the best n contracts per ticker (0 = all)").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n").desc("ticker worker threads").build());
        options.addOption(Option.builder().longOpt("fetch-timeout").hasArg().argName("sec").desc("timeout per external fetch").build());
        options.addOption(Option.builder().longOpt("run-timeout").hasArg().argName("sec").desc("deadline for the whole run (0 = none)").build());
        options.addOption(Option.builder().longOpt("output-dir").hasArg().argName("dir").desc("artifact directory").build());
        options.addOption(Option.builder().longOpt("no-artifacts").desc("skip writing CSV/JSON artifacts").build());
        options.addOption(Option.builder().longOpt("show").hasArg().argName("n").desc("ranked contracts to print (default 10)").build());
        options.addOption(Option.builder().longOpt("self-test").desc("run the pricing self-test and exit").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
