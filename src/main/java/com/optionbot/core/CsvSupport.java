package com.optionbot.core;

import java.util.ArrayList;
import java.util.List;

public final class CsvSupport {
    private CsvSupport() {
    }

    /**
     * Splits one CSV line; double quotes group fields and {@code ""} inside quotes is a literal quote.
     */
    public static List<String> splitLine(String line) {
        List<String> out = new ArrayList<>();
        if (line == null) {
            return out;
        }
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (inQuote && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuote = !inQuote;
                }
            } else if (ch == ',' && !inQuote) {
                out.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        out.add(current.toString());
        return out;
    }

    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        String flat = value.replace('\r', ' ').replace('\n', ' ');
        if (flat.indexOf(',') >= 0 || flat.indexOf('"') >= 0) {
            return '"' + flat.replace("\"", "\"\"") + '"';
        }
        return flat;
    }

    public static String joinRow(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(values.get(i)));
        }
        return sb.toString();
    }
}
