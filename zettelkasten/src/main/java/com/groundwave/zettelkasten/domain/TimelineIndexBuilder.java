package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.error.BuildException;
import com.groundwave.zettelkasten.error.RemoteFetchException;
import com.groundwave.zettelkasten.io.NoteSource;
import com.groundwave.zettelkasten.io.OrgParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Places timestamped zettels ({@code YYYYMMDDHHMMSS-slug.org}) on a per-day timeline.
 *
 * A {@code #+DATE:} directive naming a different day moves the note to that day at midnight.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TimelineIndexBuilder {

    static final Pattern TIMESTAMPED_FILE = Pattern.compile("^(\\d{14})-.*\\.org$");

    static final Comparator<TimelineNote> NEWEST_FIRST = Comparator
        .comparing(TimelineNote::getTimestamp).reversed()
        .thenComparing(TimelineNote::getFilename);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("uuuuMMddHHmmss")
        .withResolverStyle(ResolverStyle.STRICT);

    private final NoteSource noteSource;
    private final OrgParser orgParser;
    private final Clock clock;

    /**
     * Build the timeline from a notes-root listing.
     *
     * @throws BuildException if the build is cancelled
     */
    public TimelineIndex build(List<String> mainFiles) throws BuildException {
        log.info("Building zettelkasten timeline note cache...");
        Instant startTime = clock.instant();

        String indexFile = noteSource.indexFilename();
        Map<String, List<TimelineNote>> byDate = new HashMap<>();
        int filesProcessed = 0;
        int filesSkipped = 0;

        for (String file : mainFiles) {
            if (Thread.currentThread().isInterrupted()) {
                throw new BuildException("Timeline cache build cancelled");
            }

            if (file.equals(indexFile)) {
                continue;
            }

            Matcher nameMatcher = TIMESTAMPED_FILE.matcher(file);
            if (!nameMatcher.matches()) {
                continue;
            }

            Optional<OffsetDateTime> parsedTimestamp = parseFileTimestamp(nameMatcher.group(1));
            if (parsedTimestamp.isEmpty()) {
                filesSkipped++;
                continue;
            }

            String content;
            try {
                content = noteSource.fetchMain(file);
            } catch (RemoteFetchException e) {
                log.warn("Skipping unreadable note file {}: {}", file, e.getMessage());
                filesSkipped++;
                continue;
            }

            Optional<String> noteId = orgParser.extractId(content);
            if (noteId.isEmpty()) {
                filesSkipped++;
                continue;
            }

            String title = orgParser.extractTitle(content);
            if (OrgParser.UNTITLED.equals(title)) {
                title = file.substring(0, file.length() - ".org".length());
            }

            OffsetDateTime timestamp = parsedTimestamp.get();
            LocalDate day = timestamp.toLocalDate();
            Optional<LocalDate> override = orgParser.extractDateOverride(content);
            if (override.isPresent() && !override.get().equals(day)) {
                day = override.get();
                timestamp = OffsetDateTime.of(day, LocalTime.MIDNIGHT, timestamp.getOffset());
            }

            String dateString = day.toString();
            byDate.computeIfAbsent(dateString, k -> new ArrayList<>()).add(TimelineNote.builder()
                .id(noteId.get())
                .title(title)
                .filename(file)
                .timestamp(timestamp)
                .dateString(dateString)
                .build());
            filesProcessed++;
        }

        Map<String, List<TimelineNote>> sorted = new HashMap<>();
        byDate.forEach((date, notes) -> {
            notes.sort(NEWEST_FIRST);
            sorted.put(date, List.copyOf(notes));
        });

        TimelineIndex index = TimelineIndex.builder()
            .byDate(Collections.unmodifiableMap(sorted))
            .builtAt(clock.instant())
            .filesProcessed(filesProcessed)
            .filesSkipped(filesSkipped)
            .build();

        log.info("Zettelkasten note cache built: {} files processed, {} skipped, {} dates, took {}ms",
            filesProcessed, filesSkipped, sorted.size(),
            Duration.between(startTime, index.getBuiltAt()).toMillis());

        return index;
    }

    /**
     * Parse the 14-digit filename prefix as a UTC timestamp.
     */
    static Optional<OffsetDateTime> parseFileTimestamp(String digits) {
        try {
            return Optional.of(LocalDateTime.parse(digits, FILE_TIMESTAMP).atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
