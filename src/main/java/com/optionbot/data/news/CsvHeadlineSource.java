package com.optionbot.data.news;

import com.optionbot.core.CsvSupport;
import com.optionbot.data.DataFetchException;
import com.optionbot.model.Headline;
import com.optionbot.model.ScanFailureReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline headlines from a local CSV with columns {@code query,title,source,publishedAt,url,fetched_at}.
 * A row matches when its query names the requested ticker or query as a whole word.
 * With a max age, rows whose {@code fetched_at} is older are ignored; rows without one are kept.
 */
public class CsvHeadlineSource implements NewsProvider {
    private static final Logger LOG = LogManager.getLogger(CsvHeadlineSource.class);
    static final List<String> HEADER = List.of("query", "title", "source", "publishedAt", "url", "fetched_at");
    private static final Pattern TICKER_TOKEN = Pattern.compile("(?<![A-Za-z0-9$])\\$?([A-Z]{2,5})(?![A-Za-z0-9])");
    private static final Set<String> QUERY_OPERATORS = Set.of("OR", "AND", "NOT");

    private final Path path;
    private final Duration maxAge;

    public CsvHeadlineSource(Path path) {
        this(path, null);
    }

    /**
     * @param maxAge rows fetched longer ago than this are skipped; {@code null} or non-positive keeps every row
     */
    public CsvHeadlineSource(Path path, Duration maxAge) {
        this.path = path;
        this.maxAge = maxAge == null || maxAge.isZero() || maxAge.isNegative() ? null : maxAge;
    }

    @Override
    public String sourceLabel() {
        return "csv";
    }

    public Path path() {
        return path;
    }

    @Override
    public List<Headline> fetchHeadlines(String tickerOrQuery, int count) throws DataFetchException {
        if (count <= 0 || tickerOrQuery == null || tickerOrQuery.isBlank()) {
            return List.of();
        }
        Instant cutoff = maxAge == null ? null : Instant.now().minus(maxAge);
        return select(readLines(), wordMatch(tickerOrQuery.trim()), count, cutoff);
    }

    /**
     * Rows cached under exactly this query and fetched within {@code maxAge}. A missing or unreadable
     * file is a cache miss, not an error.
     */
    public List<Headline> cached(String query, int count, Duration maxAge) {
        if (count <= 0 || query == null || query.isBlank() || maxAge == null || !Files.exists(path)) {
            return List.of();
        }
        String key = query.trim();
        try {
            return select(readLines(), q -> q.trim().equalsIgnoreCase(key), count, Instant.now().minus(maxAge));
        } catch (DataFetchException e) {
            LOG.warn("headline cache miss for '{}': {}", key, e.getMessage());
            return List.of();
        }
    }

    /**
     * Distinct tickers named in the query column, sorted. A token counts when it is written as
     * 2-5 upper-case letters (optionally as a cashtag) and is not a boolean operator.
     */
    public List<String> tickers() throws DataFetchException {
        return extractTickers(readLines());
    }

    static List<String> extractTickers(List<String> lines) {
        if (lines.isEmpty()) {
            return List.of();
        }
        Integer queryCol = columnIndex(lines.get(0)).get("query");
        if (queryCol == null) {
            LOG.warn("headline csv has no query column");
            return List.of();
        }
        Set<String> out = new TreeSet<>();
        for (int i = 1; i < lines.size(); i++) {
            Matcher m = TICKER_TOKEN.matcher(column(CsvSupport.splitLine(lines.get(i)), queryCol));
            while (m.find()) {
                if (!QUERY_OPERATORS.contains(m.group(1))) {
                    out.add(m.group(1));
                }
            }
        }
        return new ArrayList<>(out);
    }

    static List<Headline> select(List<String> lines, String key, int count) {
        return select(lines, wordMatch(key), count, null);
    }

    static List<Headline> select(List<String> lines, Predicate<String> queryMatch, int count, Instant cutoff) {
        if (lines.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> columns = columnIndex(lines.get(0));
        Integer queryCol = columns.get("query");
        Integer titleCol = columns.get("title");
        if (queryCol == null || titleCol == null) {
            LOG.warn("headline csv has no query/title columns");
            return List.of();
        }

        // later rows win for the same url; first-seen position is kept
        Map<String, Headline> byUrl = new LinkedHashMap<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            List<String> cols = CsvSupport.splitLine(line);
            String query = column(cols, queryCol);
            String title = column(cols, titleCol).trim();
            if (title.isEmpty() || !queryMatch.test(query)) {
                continue;
            }
            if (cutoff != null && !fetchedSince(column(cols, columns.get("fetched_at")), cutoff)) {
                continue;
            }
            String url = column(cols, columns.get("url")).trim();
            Headline headline = new Headline(
                    title,
                    column(cols, columns.get("source")),
                    url,
                    NewsApiClient.parseTimestamp(column(cols, columns.get("publishedat")))
            );
            byUrl.put(url.isEmpty() ? title : url, headline);
        }
        List<Headline> out = new ArrayList<>(byUrl.values());
        return out.size() > count ? List.copyOf(out.subList(0, count)) : out;
    }

    /**
     * Appends fetched headlines under the given query, writing the header for a new file.
     * Failures are logged and do not affect the fetch that produced the rows.
     */
    public synchronized void append(String query, List<Headline> headlines) {
        if (headlines == null || headlines.isEmpty()) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean writeHeader = !Files.exists(path);
            String fetchedAt = OffsetDateTime.ofInstant(Instant.now(), ZoneOffset.UTC).toString();
            try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                if (writeHeader) {
                    w.write(CsvSupport.joinRow(HEADER));
                    w.newLine();
                }
                for (Headline h : headlines) {
                    w.write(CsvSupport.joinRow(List.of(
                            query,
                            h.text,
                            h.source,
                            h.publishedAt == null ? "" : h.publishedAt.toOffsetDateTime().toString(),
                            h.link,
                            fetchedAt
                    )));
                    w.newLine();
                }
            }
            LOG.info("cached {} headlines for '{}' in {}", headlines.size(), query, path);
        } catch (IOException e) {
            LOG.warn("could not cache headlines to {}: {}", path, e.getMessage());
        }
    }

    static boolean fetchedSince(String fetchedAt, Instant cutoff) {
        if (fetchedAt == null || fetchedAt.isBlank()) {
            return true;
        }
        ZonedDateTime fetched = NewsApiClient.parseTimestamp(fetchedAt);
        return fetched != null && !fetched.toInstant().isBefore(cutoff);
    }

    private List<String> readLines() throws DataFetchException {
        if (!Files.exists(path)) {
            throw new DataFetchException(ScanFailureReason.OTHER, "headline csv not found: " + path);
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DataFetchException(ScanFailureReason.OTHER, "headline csv unreadable: " + path, e);
        }
    }

    private static Predicate<String> wordMatch(String key) {
        Pattern word = Pattern.compile("(?i)(?<![A-Za-z0-9])" + Pattern.quote(key) + "(?![A-Za-z0-9])");
        return query -> word.matcher(query).find();
    }

    private static Map<String, Integer> columnIndex(String headerLine) {
        Map<String, Integer> columns = new HashMap<>();
        List<String> header = CsvSupport.splitLine(stripBom(headerLine));
        for (int c = 0; c < header.size(); c++) {
            columns.put(header.get(c).trim().toLowerCase(Locale.ROOT), c);
        }
        return columns;
    }

    private static String column(List<String> cols, Integer index) {
        if (index == null || index < 0 || index >= cols.size()) {
            return "";
        }
        return cols.get(index);
    }

    private static String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }
}
