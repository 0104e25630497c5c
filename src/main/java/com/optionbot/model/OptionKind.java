package com.optionbot.model;

import java.util.Locale;

public enum OptionKind {
    CALL("call", 1),
    PUT("put", -1);

    private final String label;
    private final int sign;

    OptionKind(String label, int sign) {
        this.label = label;
        this.sign = sign;
    }

    public String label() {
        return label;
    }

    /**
     * +1 for calls, -1 for puts: the direction of the underlying move that benefits a holder.
     */
    public int sign() {
        return sign;
    }

    public static OptionKind fromLabel(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if ("call".equals(value) || "c".equals(value) || "calls".equals(value)) {
            return CALL;
        }
        if ("put".equals(value) || "p".equals(value) || "puts".equals(value)) {
            return PUT;
        }
        throw new IllegalArgumentException("unknown option kind: " + raw);
    }
}
