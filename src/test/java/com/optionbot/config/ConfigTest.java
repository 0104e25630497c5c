package com.optionbot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldLayerWorkingDirFileOverClasspathResource() throws Exception {
        Files.writeString(tempDir.resolve("config.properties"), "pipeline.tickers=QQQ, iwm\nfetch.timeout_sec=7\n");

        Config config = Config.load(tempDir);

        assertEquals(List.of("QQQ", "iwm"), config.getList("pipeline.tickers"));
        assertEquals(7, config.getInt("fetch.timeout_sec"));
        assertEquals("override", config.sourceOf("fetch.timeout_sec"));
        assertEquals("resource", config.sourceOf("news.source"));
        assertEquals(0.5, config.getDouble("score.weight.gap"), 1e-12);
    }

    @Test
    void put_shouldOverrideEveryLayer() {
        Config config = Config.of(Map.of("news.source", "google"));
        config.put("news.source", "csv");
        config.put("ignored", null);

        assertEquals("csv", config.getString("news.source"));
        assertEquals("override", config.sourceOf("news.source"));
        assertEquals("default", config.sourceOf("sentiment.mode"));
    }

    @Test
    void typedGetters_shouldFallBackOnBlankOrGarbage() {
        Config config = Config.of(Map.of(
                "pipeline.threads", "many",
                "sentiment.social.enabled", "yes",
                "news.query", "   "));

        assertEquals(3, config.getInt("pipeline.threads"));
        assertEquals(9, config.getInt("unknown.key", 9));
        assertTrue(config.getBoolean("sentiment.social.enabled"));
        assertFalse(config.getBoolean("unknown.flag", false));
        assertEquals("fallback", config.getString("news.query", "fallback"));
        assertEquals(config.workingDir().resolve("outputs"), config.getPath("outputs.dir"));
        assertThrows(IllegalArgumentException.class, () -> config.requireString("unknown.key"));
    }
}
