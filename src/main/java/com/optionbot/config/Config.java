package com.optionbot.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 * Resolution order: explicit overrides (CLI), working-directory {@code config.properties},
 * classpath {@code config.properties}, then built-in defaults.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("classpath config.properties unreadable, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Config backed only by defaults plus the given values. Used by tests and embedded callers.
     */
    public static Config of(Map<String, String> values) {
        Config config = new Config(Path.of(".").toAbsolutePath().normalize());
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                config.put(entry.getKey(), entry.getValue());
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    /**
     * Applies a runtime override (command-line option) on top of every file layer.
     */
    public void put(String key, String value) {
        if (key == null || key.trim().isEmpty() || value == null) {
            return;
        }
        overrideProps.setProperty(key.trim(), value);
        props.setProperty(key.trim(), value);
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * A window given in (fractional) hours; {@code null} when the value is zero, negative or not a number.
     */
    public Duration getHours(String key, double fallback) {
        double hours = getDouble(key, fallback);
        if (!Double.isFinite(hours) || hours <= 0.0) {
            return null;
        }
        return Duration.ofSeconds(Math.round(hours * 3600.0));
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("pipeline.tickers", "SPY");
        defaults.put("pipeline.max_expirations", "3");
        defaults.put("pipeline.risk_free_rate", "0.045");
        defaults.put("pipeline.top_per_ticker", "0");
        defaults.put("pipeline.threads", "3");
        defaults.put("pipeline.run_timeout_sec", "0");

        defaults.put("fetch.timeout_sec", "30");

        defaults.put("pricing.fallback_volatility", "0");

        defaults.put("news.source", "yahoo");
        defaults.put("news.query", "");
        defaults.put("news.headline_count", "20");
        defaults.put("news.lang", "en");
        defaults.put("news.region", "US");
        defaults.put("news.newsapi.base_url", "https://eventregistry.org/api/v1/article/getArticles");
        defaults.put("news.newsapi.api_key", "");
        defaults.put("news.csv.path", "newsapi_headlines.csv");
        defaults.put("news.csv.max_age_hours", "0");
        defaults.put("news.cache.enabled", "true");
        defaults.put("news.cache.max_age_hours", "24");

        defaults.put("sentiment.mode", "auto");
        defaults.put("sentiment.top_k", "3");
        defaults.put("sentiment.classifier.enabled", "true");
        defaults.put("sentiment.classifier.base_url", "http://127.0.0.1:11434");
        defaults.put("sentiment.classifier.model", "llama3.1:latest");
        defaults.put("sentiment.classifier.timeout_sec", "60");
        defaults.put("sentiment.social.enabled", "false");
        defaults.put("sentiment.social.weight", "0.25");
        defaults.put("sentiment.social.feeds", "");
        defaults.put("sentiment.social.window_hours", "24");

        defaults.put("score.weight.gap", "0.50");
        defaults.put("score.weight.liquidity", "0.20");
        defaults.put("score.weight.spread", "0.15");
        defaults.put("score.weight.sentiment", "0.15");

        return Collections.unmodifiableMap(defaults);
    }
}
