package com.optionbot.model;

import java.time.ZonedDateTime;

public final class Headline {
    public final String text;
    public final String source;
    public final String link;
    public final ZonedDateTime publishedAt;

    public Headline(String text, String source, String link, ZonedDateTime publishedAt) {
        this.text = text == null ? "" : text.trim();
        this.source = source == null ? "" : source.trim();
        this.link = link == null ? "" : link.trim();
        this.publishedAt = publishedAt;
    }
}
