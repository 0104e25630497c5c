package com.optionbot.data.news;

import com.optionbot.data.DataFetchException;
import com.optionbot.model.Headline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvHeadlineSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void select_shouldMatchQueryAsWholeWord() {
        List<String> lines = List.of(
                "\uFEFFquery,title,source,publishedAt,url,fetched_at",
                "AAPL OR Apple,\"Apple, Inc. beats\",Reuters,2026-03-16T12:00:00Z,https://x/1,2026-03-16T13:00:00Z",
                "AAPLX,Unrelated fund,AP,,https://x/2,",
                "aapl,Second apple story,AP,,https://x/3,",
                "",
                "AAPL,Apple beats (updated),Reuters,,https://x/1,");

        List<Headline> headlines = CsvHeadlineSource.select(lines, "AAPL", 10);

        assertEquals(2, headlines.size());
        assertEquals("Apple beats (updated)", headlines.get(0).text);
        assertEquals("Second apple story", headlines.get(1).text);
        assertEquals(1, CsvHeadlineSource.select(lines, "AAPL", 1).size());
    }

    @Test
    void select_shouldReturnNothingWithoutRequiredColumns() {
        assertTrue(CsvHeadlineSource.select(List.of("a,b,c", "1,2,3"), "AAPL", 5).isEmpty());
        assertTrue(CsvHeadlineSource.select(List.of(), "AAPL", 5).isEmpty());
    }

    @Test
    void appendThenFetch_shouldRoundTripQuotedFields() throws Exception {
        CsvHeadlineSource source = new CsvHeadlineSource(tempDir.resolve("headlines.csv"));
        ZonedDateTime published = ZonedDateTime.of(2026, 3, 16, 12, 0, 0, 0, ZoneOffset.UTC);
        source.append("MSFT", List.of(
                new Headline("Microsoft says \"cloud demand\" strong, raises outlook", "CNBC", "https://x/m1", published)));
        source.append("MSFT", List.of(new Headline("Second story", "AP", "https://x/m2", null)));

        List<Headline> headlines = source.fetchHeadlines("msft", 5);

        assertEquals(2, headlines.size());
        assertEquals("Microsoft says \"cloud demand\" strong, raises outlook", headlines.get(0).text);
        assertEquals(published.toInstant(), headlines.get(0).publishedAt.toInstant());
    }

    @Test
    void fetchHeadlines_shouldFailForMissingFile() {
        CsvHeadlineSource source = new CsvHeadlineSource(tempDir.resolve("missing.csv"));
        assertThrows(DataFetchException.class, () -> source.fetchHeadlines("AAPL", 5));
    }

    @Test
    void select_shouldDropRowsFetchedBeforeTheCutoff() {
        List<String> lines = List.of(
                "query,title,source,publishedAt,url,fetched_at",
                "TSLA,Old recall story,AP,,https://x/1,2026-03-10T09:00:00Z",
                "TSLA,Fresh delivery numbers,AP,,https://x/2,2026-03-16T09:00:00Z",
                "TSLA,Undated import,AP,,https://x/3,",
                "TSLA,Garbled timestamp,AP,,https://x/4,yesterday");

        List<Headline> fresh = CsvHeadlineSource.select(lines, q -> q.contains("TSLA"), 10, Instant.parse("2026-03-15T00:00:00Z"));

        assertEquals(List.of("Fresh delivery numbers", "Undated import"), fresh.stream().map(h -> h.text).toList());
        assertEquals(4, CsvHeadlineSource.select(lines, "TSLA", 10).size());
    }

    @Test
    void fetchHeadlines_shouldApplyMaxAgeToFetchedAt() throws Exception {
        Path csv = tempDir.resolve("aged.csv");
        String recent = Instant.now().minus(Duration.ofHours(2)).toString();
        String stale = Instant.now().minus(Duration.ofDays(3)).toString();
        Files.write(csv, List.of(
                "query,title,source,publishedAt,url,fetched_at",
                "AMD,Stale chip story,AP,,https://x/1," + stale,
                "AMD,Recent chip story,AP,,https://x/2," + recent), StandardCharsets.UTF_8);

        assertEquals(2, new CsvHeadlineSource(csv).fetchHeadlines("AMD", 10).size());
        List<Headline> aged = new CsvHeadlineSource(csv, Duration.ofHours(24)).fetchHeadlines("AMD", 10);
        assertEquals(List.of("Recent chip story"), aged.stream().map(h -> h.text).toList());
    }

    @Test
    void cached_shouldMatchTheExactQueryOnly() throws Exception {
        CsvHeadlineSource source = new CsvHeadlineSource(tempDir.resolve("cache.csv"));
        source.append("NVDA OR Nvidia", List.of(new Headline("Nvidia unveils new chip", "Reuters", "https://x/n1", null)));
        source.append("NVDA", List.of(new Headline("NVDA options busy", "AP", "https://x/n2", null)));

        List<Headline> cached = source.cached("nvda or nvidia", 10, Duration.ofHours(1));

        assertEquals(List.of("Nvidia unveils new chip"), cached.stream().map(h -> h.text).toList());
        assertTrue(source.cached("NVDA OR Nvidia", 10, null).isEmpty());
        assertTrue(new CsvHeadlineSource(tempDir.resolve("missing.csv")).cached("NVDA", 10, Duration.ofHours(1)).isEmpty());
    }

    @Test
    void extractTickers_shouldCollectUpperCaseSymbolsFromQueries() {
        List<String> lines = List.of(
                "query,title,source,publishedAt,url,fetched_at",
                "AAPL OR Apple,t1,s,,u1,",
                "$tsla,t2,s,,u2,",
                "\"MSFT AND cloud\",t3,s,,u3,",
                "stock market,t4,s,,u4,",
                "AAPL,t5,s,,u5,",
                "$NVDA earnings,t6,s,,u6,");

        List<String> tickers = CsvHeadlineSource.extractTickers(lines);

        assertEquals(List.of("AAPL", "MSFT", "NVDA"), tickers);
        assertFalse(tickers.contains("OR"));
        assertTrue(CsvHeadlineSource.extractTickers(List.of("title,url", "AAPL,u")).isEmpty());
    }
}
