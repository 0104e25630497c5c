package com.optionbot.model;

import java.util.Locale;

public enum SentimentMode {
    AUTO,
    FALLBACK_ONLY;

    public static SentimentMode parse(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (value.isEmpty() || "auto".equals(value)) {
            return AUTO;
        }
        if ("fallback-only".equals(value) || "fallback".equals(value) || "lexicon".equals(value)) {
            return FALLBACK_ONLY;
        }
        throw new IllegalArgumentException("sentiment mode must be auto or fallback-only: " + raw);
    }
}
