package com.optionbot.model;

import java.util.Locale;

public enum ScanFailureReason {
    NONE("none"),
    INVALID_INPUT("invalid_input"),
    QUOTE_UNAVAILABLE("quote_unavailable"),
    CHAIN_UNAVAILABLE("chain_unavailable"),
    NO_OPTIONS("no_options"),
    TIMEOUT("timeout"),
    RATE_LIMIT("rate_limit"),
    PARSE_ERROR("parse_error"),
    CANCELLED("cancelled"),
    OTHER("other");

    private final String label;

    ScanFailureReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ScanFailureReason fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return NONE;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (ScanFailureReason reason : values()) {
            if (reason.label.equals(target)) {
                return reason;
            }
        }
        return OTHER;
    }
}
