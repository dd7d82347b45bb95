package com.groundwave.zettelkasten.io;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the org-roam anchors the zettelkasten relies on from raw Org content.
 *
 * None of these methods fail on ill-formed Org; they fall back to defaults instead.
 * Ids and link targets are returned in lower case.
 */
@Component
public class OrgParser {

    public static final String UNTITLED = "Untitled Note";

    static final String UUID_REGEX =
        "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}";

    private static final Pattern UUID = Pattern.compile("^" + UUID_REGEX + "$");
    private static final Pattern PROPERTIES_START = Pattern.compile("^\\s*:PROPERTIES:\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROPERTIES_END = Pattern.compile("^\\s*:END:\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ID_PROPERTY = Pattern.compile("^\\s*:ID:\\s+(" + UUID_REGEX + ")\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE = Pattern.compile("^\\s*#\\+TITLE:\\s+(.+?)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ACCESS_PUBLIC = Pattern.compile("^\\s*#\\+access:\\s*public\\s*$",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern ACCESS_HOME = Pattern.compile("^\\s*#\\+access:\\s*home\\s*$",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern DATE_DIRECTIVE = Pattern.compile("^\\s*#\\+DATE:\\s*[<\\[]?(\\d{4}-\\d{2}-\\d{2})",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern ID_LINK = Pattern.compile("\\[\\[id:(" + UUID_REGEX + ")\\](?:\\[([^\\]]*)\\])?\\]");

    /**
     * Id of the note: the first {@code :ID:} property inside a properties drawer.
     */
    public Optional<String> extractId(String content) {
        if (content == null) {
            return Optional.empty();
        }

        boolean inProperties = false;
        for (String line : content.lines().toList()) {
            if (!inProperties) {
                if (PROPERTIES_START.matcher(line).matches()) {
                    inProperties = true;
                }
                continue;
            }

            if (PROPERTIES_END.matcher(line).matches()) {
                inProperties = false;
                continue;
            }

            Matcher idMatcher = ID_PROPERTY.matcher(line);
            if (idMatcher.matches()) {
                return Optional.of(idMatcher.group(1).toLowerCase(Locale.ROOT));
            }
        }

        return Optional.empty();
    }

    /**
     * Value of the first {@code #+TITLE:} directive, or {@value #UNTITLED}.
     */
    public String extractTitle(String content) {
        if (content == null) {
            return UNTITLED;
        }

        for (String line : content.lines().toList()) {
            Matcher titleMatcher = TITLE.matcher(line);
            if (titleMatcher.matches()) {
                return titleMatcher.group(1);
            }
        }

        return UNTITLED;
    }

    /**
     * True iff some line reads {@code #+access: public}, ignoring case and surrounding whitespace.
     */
    public boolean isPublic(String content) {
        return content != null && ACCESS_PUBLIC.matcher(content).find();
    }

    /**
     * True iff some line reads {@code #+access: home}.
     */
    public boolean isHomeAccessible(String content) {
        return content != null && ACCESS_HOME.matcher(content).find();
    }

    /**
     * Day named by a {@code #+DATE:} directive, if it parses as YYYY-MM-DD.
     */
    public Optional<LocalDate> extractDateOverride(String content) {
        if (content == null) {
            return Optional.empty();
        }

        Matcher dateMatcher = DATE_DIRECTIVE.matcher(content);
        if (!dateMatcher.find()) {
            return Optional.empty();
        }

        try {
            return Optional.of(LocalDate.parse(dateMatcher.group(1)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Targets of all {@code [[id:uuid]]} and {@code [[id:uuid][label]]} links in order of appearance.
     * Duplicates are kept.
     */
    public List<String> extractLinks(String content) {
        List<String> targets = new ArrayList<>();
        if (content == null) {
            return targets;
        }

        Matcher linkMatcher = ID_LINK.matcher(content);
        while (linkMatcher.find()) {
            targets.add(linkMatcher.group(1).toLowerCase(Locale.ROOT));
        }
        return targets;
    }

    /**
     * RFC 4122 textual form check. Guards every id that is used to build a request.
     */
    public boolean isValidUuid(String id) {
        return id != null && UUID.matcher(id).matches();
    }
}
