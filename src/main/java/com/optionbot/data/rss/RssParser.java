package com.optionbot.data.rss;

import org.jsoup.Jsoup;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * RSS 2.0 and Atom items. Markup in titles and descriptions is stripped with jsoup.
 */
public final class RssParser {

    private RssParser() {
    }

    public record RssItem(String title, String link, String source, String description, ZonedDateTime publishedAt) {
    }

    /**
     * @throws IllegalArgumentException when the document is not well-formed XML
     */
    public static List<RssItem> parse(String xml, int maxItems) {
        List<RssItem> out = new ArrayList<>();
        if (xml == null || xml.isBlank() || maxItems <= 0) {
            return out;
        }
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            doc = factory.newDocumentBuilder()
                    .parse(new ByteArrayInputStream(xml.trim().getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalArgumentException("unparseable feed: " + e.getMessage(), e);
        }

        NodeList items = doc.getElementsByTagName("item");
        boolean atom = items.getLength() == 0;
        if (atom) {
            items = doc.getElementsByTagName("entry");
        }
        for (int i = 0; i < items.getLength() && out.size() < maxItems; i++) {
            Element item = (Element) items.item(i);
            String title = clean(text(item, "title"));
            if (title.isEmpty()) {
                continue;
            }
            String link = atom ? atomLink(item) : nonNull(text(item, "link")).trim();
            String description = clean(atom ? firstNonBlank(text(item, "summary"), text(item, "content")) : text(item, "description"));
            ZonedDateTime published = parseDate(atom ? firstNonBlank(text(item, "updated"), text(item, "published")) : text(item, "pubDate"));
            out.add(new RssItem(title, link, sourceText(item, title, link), description, published));
        }
        return out;
    }

    static String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return Jsoup.parse(raw).text().replaceAll("\\s+", " ").trim();
    }

    private static ZonedDateTime parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException ignored) {
            // fall through to ISO-8601, used by Atom feeds
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static String atomLink(Element entry) {
        NodeList links = entry.getElementsByTagName("link");
        for (int i = 0; i < links.getLength(); i++) {
            Element link = (Element) links.item(i);
            String href = link.getAttribute("href");
            if (href != null && !href.isBlank()) {
                return href.trim();
            }
        }
        return "";
    }

    private static String text(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0) {
            return null;
        }
        Node n = nl.item(0);
        return n == null ? null : n.getTextContent();
    }

    private static String sourceText(Element item, String title, String link) {
        String source = text(item, "source");
        if (source != null && !source.trim().isEmpty()) {
            return source.trim();
        }

        // aggregators append the outlet to the title as "headline - Outlet"
        if (title.contains(" - ")) {
            String guessed = title.substring(title.lastIndexOf(" - ") + 3).trim();
            if (!guessed.isEmpty()) {
                return guessed;
            }
        }

        if (!link.isEmpty()) {
            try {
                String host = URI.create(link).getHost();
                if (host != null && !host.isBlank()) {
                    return host.trim();
                }
            } catch (IllegalArgumentException ignored) {
                return "";
            }
        }
        return "";
    }

    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }

    private static String nonNull(String value) {
        return value == null ? "" : value;
    }
}
