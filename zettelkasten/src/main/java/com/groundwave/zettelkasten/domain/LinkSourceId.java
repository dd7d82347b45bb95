package com.groundwave.zettelkasten.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Source of a link in the link graph: either a note (by UUID) or a daily journal note.
 *
 * Daily notes carry no id of their own and are keyed as {@code daily:YYYY-MM-DD}.
 * Link lists expose the canonical string form.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LinkSourceId {

    public static final String DAILY_PREFIX = "daily:";

    public enum Kind {
        NOTE,
        DAILY
    }

    Kind kind;
    String noteId;
    LocalDate date;

    public static LinkSourceId note(String noteId) {
        return new LinkSourceId(Kind.NOTE, noteId, null);
    }

    public static LinkSourceId daily(LocalDate date) {
        return new LinkSourceId(Kind.DAILY, null, date);
    }

    /**
     * Parse a canonical string form back into a source id.
     */
    public static Optional<LinkSourceId> parse(String canonical) {
        if (canonical == null || canonical.isBlank()) {
            return Optional.empty();
        }
        if (!canonical.startsWith(DAILY_PREFIX)) {
            return Optional.of(note(canonical));
        }
        try {
            return Optional.of(daily(LocalDate.parse(canonical.substring(DAILY_PREFIX.length()))));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public boolean isDaily() {
        return kind == Kind.DAILY;
    }

    public String canonical() {
        return isDaily() ? DAILY_PREFIX + date : noteId;
    }

    @Override
    public String toString() {
        return canonical();
    }
}
