package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.error.BuildException;
import com.groundwave.zettelkasten.error.RemoteFetchException;
import com.groundwave.zettelkasten.io.NoteSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory link graph, journal and timeline over the WebDAV notes directory.
 *
 * Each index is rebuilt off-lock and published as a whole; queries copy out of the
 * currently published snapshot. The three indexes advance independently.
 */
@Component
@Slf4j
public class ZettelkastenCache {

    private final NoteSource noteSource;
    private final LinkIndexBuilder linkIndexBuilder;
    private final JournalIndexBuilder journalIndexBuilder;
    private final TimelineIndexBuilder timelineIndexBuilder;

    private final PublishedSnapshot<LinkIndex> links = new PublishedSnapshot<>();
    private final PublishedSnapshot<JournalIndex> journal = new PublishedSnapshot<>();
    private final PublishedSnapshot<TimelineIndex> timeline = new PublishedSnapshot<>();

    public ZettelkastenCache(NoteSource noteSource,
                             LinkIndexBuilder linkIndexBuilder,
                             JournalIndexBuilder journalIndexBuilder,
                             TimelineIndexBuilder timelineIndexBuilder) {
        this.noteSource = noteSource;
        this.linkIndexBuilder = linkIndexBuilder;
        this.journalIndexBuilder = journalIndexBuilder;
        this.timelineIndexBuilder = timelineIndexBuilder;
    }

    // ---- Queries ----

    /**
     * Sources linking to {@code targetId}; daily notes appear as {@code daily:YYYY-MM-DD}.
     */
    public List<String> getBacklinks(String targetId) {
        String key = normalize(targetId);
        return links.read(index -> copyOf(index.getBacklinks().get(key))).orElseGet(ArrayList::new);
    }

    public List<String> getForwardLinks(String sourceId) {
        String key = normalize(sourceId);
        return links.read(index -> copyOf(index.getForwardLinks().get(key))).orElseGet(ArrayList::new);
    }

    public boolean isPublic(String noteId) {
        String key = normalize(noteId);
        return links.read(index -> index.getPublicMap().getOrDefault(key, false)).orElse(false);
    }

    /**
     * All journal entries, newest first.
     */
    public List<JournalEntry> getJournalEntries() {
        return journal.read(index -> {
            List<JournalEntry> entries = new ArrayList<>(index.getEntries().values());
            entries.sort(Comparator.comparing(JournalEntry::getDate).reversed());
            return entries;
        }).orElseGet(ArrayList::new);
    }

    /**
     * Journal entry for a day.
     *
     * @param dateString YYYY-MM-DD; anything else yields empty
     */
    public Optional<JournalEntry> getJournalEntry(String dateString) {
        if (dateString == null) {
            return Optional.empty();
        }
        try {
            LocalDate.parse(dateString);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        return journal.read(index -> index.getEntries().get(dateString));
    }

    /**
     * Copy of the timeline with day keys ordered newest first.
     */
    public Map<String, List<TimelineNote>> getTimelineByDate() {
        return timeline.read(index -> {
            Map<String, List<TimelineNote>> copy = new LinkedHashMap<>();
            index.getByDate().keySet().stream()
                .sorted(Comparator.reverseOrder())
                .forEach(day -> copy.put(day, new ArrayList<>(index.getByDate().get(day))));
            return copy;
        }).orElseGet(LinkedHashMap::new);
    }

    public Optional<Instant> getLastLinkBuildAt() {
        return links.read(LinkIndex::getBuiltAt);
    }

    public Optional<Instant> getLastJournalBuildAt() {
        return journal.read(JournalIndex::getBuiltAt);
    }

    public Optional<Instant> getLastTimelineBuildAt() {
        return timeline.read(TimelineIndex::getBuiltAt);
    }

    // ---- Refresh ----

    /**
     * List both directories once and rebuild all three indexes.
     *
     * A failing builder does not stop the others; the first failure is rethrown at the end.
     *
     * @throws BuildException if the notes root cannot be listed, a builder fails or the refresh is cancelled
     */
    public void refreshAll() throws BuildException {
        log.info("Refreshing zettelkasten caches...");
        List<String> mainFiles = listMain();
        List<String> dailyFiles = listDaily();

        BuildException firstFailure = null;

        try {
            links.publish(linkIndexBuilder.build(mainFiles, dailyFiles));
        } catch (BuildException e) {
            log.error("Backlink cache build failed: {}", e.getMessage());
            firstFailure = e;
        }

        if (!Thread.currentThread().isInterrupted()) {
            try {
                journal.publish(journalIndexBuilder.build(dailyFiles));
            } catch (BuildException e) {
                log.error("Journal cache build failed: {}", e.getMessage());
                firstFailure = firstFailure == null ? e : firstFailure;
            }
        }

        if (!Thread.currentThread().isInterrupted()) {
            try {
                timeline.publish(timelineIndexBuilder.build(mainFiles));
            } catch (BuildException e) {
                log.error("Timeline cache build failed: {}", e.getMessage());
                firstFailure = firstFailure == null ? e : firstFailure;
            }
        }

        if (firstFailure != null) {
            throw firstFailure;
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new BuildException("Zettelkasten refresh cancelled");
        }
    }

    public void refreshLinks() throws BuildException {
        links.publish(linkIndexBuilder.build(listMain(), listDaily()));
    }

    public void refreshJournal() throws BuildException {
        journal.publish(journalIndexBuilder.build(listDaily()));
    }

    public void refreshTimeline() throws BuildException {
        timeline.publish(timelineIndexBuilder.build(listMain()));
    }

    private List<String> listMain() throws BuildException {
        try {
            return noteSource.listMainFiles();
        } catch (RemoteFetchException e) {
            throw new BuildException("Failed to list zettelkasten directory: " + e.getMessage(), e);
        }
    }

    private List<String> listDaily() throws BuildException {
        try {
            return noteSource.listDailyFiles();
        } catch (RemoteFetchException e) {
            if (e.isNotFound()) {
                return List.of();
            }
            throw new BuildException("Failed to list daily directory: " + e.getMessage(), e);
        }
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }

    private static String normalize(String id) {
        return id == null ? "" : id.toLowerCase(Locale.ROOT);
    }
}
