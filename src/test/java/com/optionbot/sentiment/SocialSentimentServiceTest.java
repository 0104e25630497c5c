package com.optionbot.sentiment;

import com.optionbot.data.http.HttpClientEx;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SocialSentimentServiceTest {
    private static final LexiconScorer LEXICON = new LexiconScorer(SentimentLexicon.parse("moon 2\ncrash -2\n"));

    @Test
    void extractCashtags_shouldFindUpperCasedSymbols() {
        assertEquals(Set.of("TSLA", "AMD"), SocialSentimentService.extractCashtags("$tsla to the moon, $AMD too, $5 pizza"));
        assertTrue(SocialSentimentService.extractCashtags(null).isEmpty());
    }

    @Test
    void meanFor_shouldPreferCashtagItemsThenOverallAverage() {
        SocialSentimentService service = new SocialSentimentService(null, List.of(), LEXICON, 5);
        service.ingest(List.of("$TSLA moon", "$TSLA crash crash", "market crash", ""));

        double moon = LexiconScorer.normalize(2.0);
        double doubleCrash = LexiconScorer.normalize(-4.0);
        double crash = LexiconScorer.normalize(-2.0);
        assertEquals((moon + doubleCrash) / 2.0, service.meanFor("tsla"), 1e-12);
        assertEquals((moon + doubleCrash + crash) / 3.0, service.meanFor("AAPL"), 1e-12);
    }

    @Test
    void meanFor_shouldBeNaNBeforeLoadOrWithoutItems() {
        SocialSentimentService service = new SocialSentimentService(null, List.of(), LEXICON, 5);
        assertTrue(Double.isNaN(service.meanFor("SPY")));
        service.ingest(List.of());
        assertTrue(Double.isNaN(service.meanFor("SPY")));
    }

    @Test
    void load_shouldSkipFailingFeeds() {
        String rss = "<rss><channel>"
                + "<item><title>$NVDA moon</title><description>&lt;p&gt;calls printing&lt;/p&gt;</description></item>"
                + "</channel></rss>";
        HttpClientEx http = new HttpClientEx() {
            @Override
            public String getText(String url, int timeoutSeconds) throws IOException {
                if (url.contains("broken")) {
                    throw new IOException("HTTP 503");
                }
                return rss;
            }
        };
        SocialSentimentService service = new SocialSentimentService(
                http, List.of("https://feeds.example/broken", "https://feeds.example/ok"), LEXICON, 5);

        assertEquals(1, service.load());
        assertEquals(LexiconScorer.normalize(2.0), service.meanFor("NVDA"), 1e-12);
    }

    @Test
    void load_shouldDropItemsPublishedBeforeTheWindow() {
        DateTimeFormatter rfc = DateTimeFormatter.RFC_1123_DATE_TIME;
        String recent = rfc.format(ZonedDateTime.now(ZoneOffset.UTC).minusHours(3));
        String old = rfc.format(ZonedDateTime.now(ZoneOffset.UTC).minusDays(5));
        String rss = "<rss><channel>"
                + "<item><title>$AMD moon</title><pubDate>" + recent + "</pubDate></item>"
                + "<item><title>$AMD crash</title><pubDate>" + old + "</pubDate></item>"
                + "<item><title>$AMD moon again</title></item>"
                + "</channel></rss>";
        HttpClientEx http = new HttpClientEx() {
            @Override
            public String getText(String url, int timeoutSeconds) {
                return rss;
            }
        };

        SocialSentimentService windowed = new SocialSentimentService(
                http, List.of("https://feeds.example/a"), LEXICON, 5, Duration.ofHours(24));
        SocialSentimentService unbounded = new SocialSentimentService(
                http, List.of("https://feeds.example/a"), LEXICON, 5);

        assertEquals(2, windowed.load());
        assertEquals(LexiconScorer.normalize(2.0), windowed.meanFor("AMD"), 1e-12);
        assertEquals(3, unbounded.load());
    }

    @Test
    void withinWindow_shouldKeepUndatedItems() {
        Instant cutoff = Instant.parse("2026-03-15T00:00:00Z");

        assertTrue(SocialSentimentService.withinWindow(null, cutoff));
        assertTrue(SocialSentimentService.withinWindow(ZonedDateTime.parse("2026-03-15T00:00:00Z"), cutoff));
        assertFalse(SocialSentimentService.withinWindow(ZonedDateTime.parse("2026-03-14T23:59:59Z"), cutoff));
        assertTrue(SocialSentimentService.withinWindow(ZonedDateTime.parse("2020-01-01T00:00:00Z"), null));
    }
}
