package com.groundwave.zettelkasten.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.groundwave.zettelkasten.domain.CacheRefreshWorker;
import com.groundwave.zettelkasten.domain.ChatNote;
import com.groundwave.zettelkasten.domain.JournalEntry;
import com.groundwave.zettelkasten.domain.LinkSourceId;
import com.groundwave.zettelkasten.domain.Note;
import com.groundwave.zettelkasten.domain.NoteRenderer;
import com.groundwave.zettelkasten.domain.NoteSummary;
import com.groundwave.zettelkasten.domain.TimelineNote;
import com.groundwave.zettelkasten.domain.ZettelkastenCache;
import com.groundwave.zettelkasten.error.ConfigException;
import com.groundwave.zettelkasten.error.ZettelkastenException;
import com.groundwave.zettelkasten.io.OrgHtmlRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator commands for inspecting and refreshing the zettelkasten caches.
 */
@ShellComponent
@Slf4j
public class ZettelkastenShellCommands {

    private final ZettelkastenCache cache;
    private final NoteRenderer noteRenderer;
    private final CacheRefreshWorker refreshWorker;
    private final ObjectMapper objectMapper;

    public ZettelkastenShellCommands(ZettelkastenCache cache, NoteRenderer noteRenderer,
                                     CacheRefreshWorker refreshWorker) {
        this.cache = cache;
        this.noteRenderer = noteRenderer;
        this.refreshWorker = refreshWorker;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @ShellMethod(key = "zk refresh", value = "Rebuild the zettelkasten caches now")
    public String refresh(
            @ShellOption(defaultValue = "all", help = "all, links, journal or timeline") String scope,
            @ShellOption(defaultValue = "false", help = "Wake the background worker instead of refreshing inline") boolean background) {
        if (background) {
            if (!refreshWorker.isRunning()) {
                return "Background refresh is not running.";
            }
            refreshWorker.refreshNow();
            return "Background refresh requested.";
        }

        log.info("Refreshing zettelkasten caches ({})", scope);
        try {
            if ("links".equals(scope)) {
                cache.refreshLinks();
            } else if ("journal".equals(scope)) {
                cache.refreshJournal();
            } else if ("timeline".equals(scope)) {
                cache.refreshTimeline();
            } else if ("all".equals(scope)) {
                cache.refreshAll();
            } else {
                return "Unknown scope: " + scope + " (use all, links, journal or timeline)";
            }
            return "Refresh completed.\n\n" + status();
        } catch (ZettelkastenException e) {
            log.error("Refresh failed", e);
            return "Refresh failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "zk status", value = "Show when each cache was last built")
    public String status() {
        StringBuilder result = new StringBuilder();
        result.append("Zettelkasten caches:\n");
        result.append(String.format("- Links:    %s\n", describe(cache.getLastLinkBuildAt())));
        result.append(String.format("- Journal:  %s (%d entries)\n",
            describe(cache.getLastJournalBuildAt()), cache.getJournalEntries().size()));
        result.append(String.format("- Timeline: %s (%d days)\n",
            describe(cache.getLastTimelineBuildAt()), cache.getTimelineByDate().size()));
        result.append(String.format("- Background refresh: %s, %d completed\n",
            refreshWorker.isRunning() ? "running" : "stopped", refreshWorker.getCompletedRefreshes()));
        return result.toString();
    }

    @ShellMethod(key = "zk backlinks", value = "List notes linking to a note")
    public String backlinks(String id, @ShellOption(defaultValue = "false") boolean json) {
        List<String> sources = cache.getBacklinks(id);
        if (json) {
            return toJson(sources);
        }
        if (sources.isEmpty()) {
            return "No backlinks for " + id;
        }

        StringBuilder result = new StringBuilder();
        result.append(String.format("Backlinks to %s (%d):\n", id, sources.size()));
        for (String source : sources) {
            Optional<LinkSourceId> parsed = LinkSourceId.parse(source);
            if (parsed.isPresent() && parsed.get().isDaily()) {
                result.append("  journal ").append(parsed.get().getDate()).append("\n");
            } else {
                result.append("  ").append(source).append("\n");
            }
        }
        return result.toString();
    }

    @ShellMethod(key = "zk links", value = "List notes a note links to")
    public String links(String id, @ShellOption(defaultValue = "false") boolean json) {
        List<String> targets = noteRenderer.getNoteLinks(id);
        if (json) {
            return toJson(targets);
        }
        if (targets.isEmpty()) {
            return "No links from " + id;
        }
        return String.format("Links from %s (%d):\n  %s\n", id, targets.size(), String.join("\n  ", targets));
    }

    @ShellMethod(key = "zk note", value = "Render a note by id")
    public String note(
            String id,
            @ShellOption(defaultValue = OrgHtmlRenderer.DEFAULT_BASE_PATH, help = "Base path for id links") String basePath,
            @ShellOption(defaultValue = "false", help = "Print the raw Org body") boolean raw,
            @ShellOption(defaultValue = "false") boolean json) {
        try {
            if (raw) {
                Optional<ChatNote> chatNote = noteRenderer.getNoteForChat(id);
                if (chatNote.isEmpty()) {
                    return "Note not found: " + id;
                }
                return json ? toJson(chatNote.get()) : chatNote.get().getRawBody();
            }

            Optional<Note> note = noteRenderer.renderNote(id, basePath);
            if (note.isEmpty()) {
                return "Note not found: " + id;
            }
            return json ? toJson(note.get()) : formatNote(note.get());
        } catch (ZettelkastenException e) {
            log.error("Failed to render note {}", id, e);
            return "Failed to render note: " + e.getMessage();
        }
    }

    @ShellMethod(key = "zk index", value = "Render the index note, or the home note with --home")
    public String index(@ShellOption(defaultValue = "false") boolean home,
                        @ShellOption(defaultValue = "false") boolean json) {
        try {
            Note note = home ? noteRenderer.renderHomeNote() : noteRenderer.renderIndexNote();
            return json ? toJson(note) : formatNote(note);
        } catch (ZettelkastenException | ConfigException e) {
            log.error("Failed to render index note", e);
            return "Failed to render index note: " + e.getMessage();
        }
    }

    @ShellMethod(key = "zk notes", value = "List all notes with ids")
    public String notes(@ShellOption(defaultValue = "false") boolean json) {
        try {
            List<NoteSummary> notes = noteRenderer.listNotes();
            if (json) {
                return toJson(notes);
            }

            StringBuilder result = new StringBuilder();
            result.append(String.format("%d notes:\n", notes.size()));
            for (NoteSummary note : notes) {
                result.append(String.format("  %s  %s%s\n", note.getId(), note.getTitle(),
                    note.isPublic() ? " [public]" : ""));
            }
            return result.toString();
        } catch (ZettelkastenException e) {
            log.error("Failed to list notes", e);
            return "Failed to list notes: " + e.getMessage();
        }
    }

    @ShellMethod(key = "zk journal", value = "List journal entries, or show one day with --date")
    public String journal(@ShellOption(defaultValue = ShellOption.NULL, help = "YYYY-MM-DD") String date,
                          @ShellOption(defaultValue = "false") boolean json) {
        if (date != null) {
            Optional<JournalEntry> entry = cache.getJournalEntry(date);
            if (entry.isEmpty()) {
                return "No journal entry for " + date;
            }
            return json ? toJson(entry.get()) : entry.get().getTitle() + "\n\n" + entry.get().getHtmlBody();
        }

        List<JournalEntry> entries = cache.getJournalEntries();
        if (json) {
            return toJson(entries);
        }

        StringBuilder result = new StringBuilder();
        result.append(String.format("%d journal entries:\n", entries.size()));
        for (JournalEntry entry : entries) {
            result.append(String.format("  %s  %s%s\n", entry.getDateString(), entry.getTitle(),
                entry.isHasMore() ? " ..." : ""));
        }
        return result.toString();
    }

    @ShellMethod(key = "zk timeline", value = "Show timestamped notes grouped by day")
    public String timeline(@ShellOption(defaultValue = "false") boolean json) {
        Map<String, List<TimelineNote>> byDate = cache.getTimelineByDate();
        if (json) {
            return toJson(byDate);
        }

        StringBuilder result = new StringBuilder();
        byDate.forEach((day, notes) -> {
            result.append(day).append(":\n");
            for (TimelineNote note : notes) {
                result.append(String.format("  %s  %s\n", note.getTimestamp().toLocalTime(), note.getTitle()));
            }
        });
        return result.length() == 0 ? "Timeline is empty." : result.toString();
    }

    private static String formatNote(Note note) {
        return String.format("%s (%s)%s\n\n%s", note.getTitle(), note.getFilename(),
            note.isPublic() ? " [public]" : "", note.getHtmlBody());
    }

    private static String describe(Optional<Instant> builtAt) {
        return builtAt.map(Instant::toString).orElse("never built");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize result", e);
            return "Failed to serialize result: " + e.getMessage();
        }
    }
}
