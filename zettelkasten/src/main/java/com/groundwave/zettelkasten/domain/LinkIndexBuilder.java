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
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Scans the notes root and the daily directory and builds the link graph.
 *
 * Notes are keyed by their {@code :ID:}; daily notes by {@code daily:YYYY-MM-DD}.
 * Files that cannot be fetched or carry no usable source id are skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LinkIndexBuilder {

    static final Pattern DAILY_FILE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}\\.org$");

    private final NoteSource noteSource;
    private final OrgParser orgParser;
    private final Clock clock;

    /**
     * Build a link index from pre-fetched directory listings.
     *
     * @param mainFiles  org files of the notes root
     * @param dailyFiles org files of the daily directory
     * @throws BuildException if the build is cancelled
     */
    public LinkIndex build(List<String> mainFiles, List<String> dailyFiles) throws BuildException {
        log.info("Building backlink cache...");
        Instant startTime = clock.instant();

        Map<String, List<String>> backlinks = new HashMap<>();
        Map<String, List<String>> forwardLinks = new HashMap<>();
        Map<String, Boolean> publicMap = new HashMap<>();
        int filesProcessed = 0;
        int filesSkipped = 0;

        List<WorkItem> workItems = new ArrayList<>();
        mainFiles.forEach(file -> workItems.add(new WorkItem(file, false)));
        dailyFiles.forEach(file -> workItems.add(new WorkItem(file, true)));

        for (WorkItem item : workItems) {
            checkCancelled();

            Optional<LinkSourceId> dailySource = Optional.empty();
            if (item.daily) {
                dailySource = dailySourceId(item.filename);
                if (dailySource.isEmpty()) {
                    filesSkipped++;
                    continue;
                }
            }

            String content;
            try {
                content = item.daily
                    ? noteSource.fetchDaily(item.filename)
                    : noteSource.fetchMain(item.filename);
            } catch (RemoteFetchException e) {
                log.warn("Skipping unreadable file {}: {}", item.filename, e.getMessage());
                filesSkipped++;
                continue;
            }

            LinkSourceId sourceId;
            if (item.daily) {
                sourceId = dailySource.get();
            } else {
                Optional<String> noteId = orgParser.extractId(content);
                if (noteId.isEmpty()) {
                    // No ID property, not part of the graph
                    filesSkipped++;
                    continue;
                }
                sourceId = LinkSourceId.note(noteId.get());
                publicMap.put(noteId.get(), orgParser.isPublic(content));
            }

            String source = sourceId.canonical();
            Set<String> uniqueTargets = new LinkedHashSet<>(orgParser.extractLinks(content));
            for (String target : uniqueTargets) {
                List<String> sources = backlinks.computeIfAbsent(target, k -> new ArrayList<>());
                if (!sources.contains(source)) {
                    sources.add(source);
                }
            }

            // Files sharing an id contribute to one source
            Set<String> targets = new TreeSet<>(uniqueTargets);
            List<String> previous = forwardLinks.get(source);
            if (previous != null) {
                log.warn("Duplicate note id {} in {}, merging links", source, item.filename);
                targets.addAll(previous);
            }
            forwardLinks.put(source, new ArrayList<>(targets));

            filesProcessed++;
        }

        LinkIndex index = LinkIndex.builder()
            .backlinks(freeze(backlinks))
            .forwardLinks(freeze(forwardLinks))
            .publicMap(Map.copyOf(publicMap))
            .builtAt(clock.instant())
            .filesProcessed(filesProcessed)
            .filesSkipped(filesSkipped)
            .build();

        log.info("Backlink cache built: {} files processed, {} skipped, {} backlink entries, took {}ms",
            filesProcessed, filesSkipped, backlinks.size(),
            Duration.between(startTime, index.getBuiltAt()).toMillis());

        return index;
    }

    /**
     * Daily source id for a {@code YYYY-MM-DD.org} filename.
     */
    static Optional<LinkSourceId> dailySourceId(String filename) {
        if (!DAILY_FILE.matcher(filename).matches()) {
            return Optional.empty();
        }
        try {
            LocalDate date = LocalDate.parse(filename.substring(0, filename.length() - ".org".length()));
            return Optional.of(LinkSourceId.daily(date));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> links) {
        Map<String, List<String>> frozen = new HashMap<>();
        links.forEach((key, values) -> frozen.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(frozen);
    }

    private static void checkCancelled() throws BuildException {
        if (Thread.currentThread().isInterrupted()) {
            throw new BuildException("Backlink cache build cancelled");
        }
    }

    private static class WorkItem {
        private final String filename;
        private final boolean daily;

        WorkItem(String filename, boolean daily) {
            this.filename = filename;
            this.daily = daily;
        }
    }
}
