package com.groundwave.zettelkasten.io;

import org.xml.sax.Attributes;
import org.xml.sax.helpers.DefaultHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * SAX handler for a DAV: multistatus response body.
 * Collects href, resourcetype, getcontentlength and getlastmodified of every response element.
 */
class MultistatusHandler extends DefaultHandler {

    static final String DAV_NAMESPACE = "DAV:";

    private final List<WebDavEntry> entries = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();

    private boolean inResponse;
    private boolean inResourceType;
    private String href;
    private boolean collection;
    private long contentLength;
    private Instant lastModified;

    List<WebDavEntry> getEntries() {
        return entries;
    }

    @Override
    public void startElement(String uri, String localName, String qName, Attributes attributes) {
        text.setLength(0);
        if (!DAV_NAMESPACE.equals(uri)) {
            return;
        }

        if ("response".equals(localName)) {
            inResponse = true;
            href = null;
            collection = false;
            contentLength = 0;
            lastModified = null;
        } else if ("resourcetype".equals(localName)) {
            inResourceType = true;
        } else if ("collection".equals(localName) && inResourceType) {
            collection = true;
        }
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        text.append(ch, start, length);
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
        if (!DAV_NAMESPACE.equals(uri) || !inResponse) {
            return;
        }

        String value = text.toString().trim();
        if ("href".equals(localName)) {
            href = value;
        } else if ("resourcetype".equals(localName)) {
            inResourceType = false;
        } else if ("getcontentlength".equals(localName)) {
            contentLength = parseLength(value);
        } else if ("getlastmodified".equals(localName)) {
            lastModified = parseLastModified(value);
        } else if ("response".equals(localName)) {
            inResponse = false;
            if (href != null && !href.isEmpty()) {
                entries.add(toEntry());
            }
        }
        text.setLength(0);
    }

    private WebDavEntry toEntry() {
        String path = decodePath(href);
        return WebDavEntry.builder()
            .path(path)
            .name(lastSegment(path))
            .directory(collection)
            .size(contentLength)
            .modified(lastModified)
            .build();
    }

    /**
     * Hrefs may be absolute URLs or absolute paths; both are reduced to a decoded path.
     */
    static String decodePath(String rawHref) {
        String rawPath = rawHref;
        if (rawHref.startsWith("http://") || rawHref.startsWith("https://")) {
            rawPath = URI.create(rawHref).getRawPath();
        }
        return URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    static String lastSegment(String path) {
        String trimmed = path;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static long parseLength(String value) {
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Instant parseLastModified(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
