package com.optionbot.sentiment;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Term valences, negators and intensifiers read from a plain text resource.
 * <pre>
 * term valence          # valence on a -4..4 scale
 * negate term           # flips the next three tokens
 * boost term delta      # scales the next sentiment term by (1 + delta)
 * </pre>
 */
public final class SentimentLexicon {
    public static final String DEFAULT_RESOURCE = "sentiment-lexicon.txt";

    private final Map<String, Double> valences;
    private final Set<String> negators;
    private final Map<String, Double> boosters;

    private SentimentLexicon(Map<String, Double> valences, Set<String> negators, Map<String, Double> boosters) {
        this.valences = Collections.unmodifiableMap(valences);
        this.negators = Collections.unmodifiableSet(negators);
        this.boosters = Collections.unmodifiableMap(boosters);
    }

    public static SentimentLexicon loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static SentimentLexicon loadResource(String resource) {
        InputStream in = SentimentLexicon.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("sentiment lexicon resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read sentiment lexicon " + resource, e);
        }
    }

    public static SentimentLexicon parse(String text) {
        try {
            return parse(new StringReader(text == null ? "" : text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static SentimentLexicon parse(Reader source) throws IOException {
        Map<String, Double> valences = new HashMap<>();
        Set<String> negators = new HashSet<>();
        Map<String, Double> boosters = new HashMap<>();
        BufferedReader reader = new BufferedReader(source);
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] parts = trimmed.split("\\s+");
            String head = parts[0].toLowerCase(Locale.ROOT);
            if ("negate".equals(head) && parts.length == 2) {
                negators.add(parts[1].toLowerCase(Locale.ROOT));
            } else if ("boost".equals(head) && parts.length == 3) {
                boosters.put(parts[1].toLowerCase(Locale.ROOT), parseNumber(parts[2], lineNo));
            } else if (parts.length == 2) {
                valences.put(head, parseNumber(parts[1], lineNo));
            } else {
                throw new IllegalArgumentException("malformed lexicon line " + lineNo + ": " + trimmed);
            }
        }
        return new SentimentLexicon(valences, negators, boosters);
    }

    private static double parseNumber(String raw, int lineNo) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad number on lexicon line " + lineNo + ": " + raw, e);
        }
    }

    public Double valence(String token) {
        return valences.get(token);
    }

    public boolean isNegator(String token) {
        return negators.contains(token);
    }

    public Double boost(String token) {
        return boosters.get(token);
    }

    public int size() {
        return valences.size();
    }
}
