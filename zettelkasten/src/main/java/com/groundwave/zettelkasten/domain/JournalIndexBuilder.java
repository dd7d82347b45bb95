package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.error.BuildException;
import com.groundwave.zettelkasten.error.RemoteFetchException;
import com.groundwave.zettelkasten.error.RenderException;
import com.groundwave.zettelkasten.io.NoteSource;
import com.groundwave.zettelkasten.io.OrgHtmlRenderer;
import com.groundwave.zettelkasten.io.OrgParser;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the journal from the daily directory: rendered body plus a short preview per day.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JournalIndexBuilder {

    static final int PREVIEW_MAX_PARAGRAPHS = 2;
    static final int PREVIEW_MAX_CHARS = 480;

    private static final Pattern HEADLINE = Pattern.compile("^\\*+\\s.*$");

    private final NoteSource noteSource;
    private final OrgParser orgParser;
    private final OrgHtmlRenderer htmlRenderer;
    private final Clock clock;

    /**
     * Build the journal from a daily directory listing.
     *
     * @throws BuildException if the build is cancelled
     */
    public JournalIndex build(List<String> dailyFiles) throws BuildException {
        log.info("Building journal cache...");
        Instant startTime = clock.instant();

        Map<String, JournalEntry> entries = new HashMap<>();
        int filesProcessed = 0;
        int filesSkipped = 0;

        for (String file : dailyFiles) {
            if (Thread.currentThread().isInterrupted()) {
                throw new BuildException("Journal cache build cancelled");
            }

            if (!LinkIndexBuilder.DAILY_FILE.matcher(file).matches()) {
                continue;
            }

            String dateString = file.substring(0, file.length() - ".org".length());
            LocalDate date;
            try {
                date = LocalDate.parse(dateString);
            } catch (DateTimeParseException e) {
                filesSkipped++;
                continue;
            }

            String content;
            try {
                content = noteSource.fetchDaily(file);
            } catch (RemoteFetchException e) {
                log.warn("Skipping unreadable journal file {}: {}", file, e.getMessage());
                filesSkipped++;
                continue;
            }

            String htmlBody;
            try {
                htmlBody = htmlRenderer.render(content);
            } catch (RenderException e) {
                log.warn("Skipping journal file {} due to parse error: {}", file, e.getMessage());
                filesSkipped++;
                continue;
            }

            Preview preview = buildPreview(content, PREVIEW_MAX_PARAGRAPHS, PREVIEW_MAX_CHARS);
            String previewHtml = "";
            if (!preview.getText().isEmpty()) {
                try {
                    previewHtml = htmlRenderer.render(preview.getText());
                } catch (RenderException e) {
                    log.warn("Failed to parse journal preview {}: {}", file, e.getMessage());
                }
            }

            String title = orgParser.extractTitle(content);
            if (OrgParser.UNTITLED.equals(title)) {
                title = dateString;
            }

            entries.put(dateString, JournalEntry.builder()
                .date(date)
                .dateString(dateString)
                .filename(file)
                .title(title)
                .htmlBody(htmlBody)
                .previewHtml(previewHtml)
                .hasMore(preview.isHasMore())
                .updatedAt(clock.instant())
                .build());
            filesProcessed++;
        }

        JournalIndex index = JournalIndex.builder()
            .entries(Map.copyOf(entries))
            .builtAt(clock.instant())
            .filesProcessed(filesProcessed)
            .filesSkipped(filesSkipped)
            .build();

        log.info("Journal cache built: {} files processed, {} skipped, {} entries, took {}ms",
            filesProcessed, filesSkipped, entries.size(),
            Duration.between(startTime, index.getBuiltAt()).toMillis());

        return index;
    }

    /**
     * Leading paragraphs of a daily note, skipping the property drawer, the title and headlines.
     *
     * hasMore is set when paragraphs were dropped or the text was cut at maxChars.
     */
    static Preview buildPreview(String content, int maxParagraphs, int maxChars) {
        List<String> paragraphs = new ArrayList<>();
        List<String> current = new ArrayList<>();
        boolean inProperties = false;

        for (String line : content.lines().toList()) {
            String trimmed = line.trim();
            if (trimmed.equalsIgnoreCase(":PROPERTIES:")) {
                inProperties = true;
                continue;
            }
            if (inProperties) {
                if (trimmed.equalsIgnoreCase(":END:")) {
                    inProperties = false;
                }
                continue;
            }
            if (trimmed.toUpperCase(Locale.ROOT).startsWith("#+TITLE:") || HEADLINE.matcher(line).matches()) {
                continue;
            }

            if (trimmed.isEmpty()) {
                if (!current.isEmpty()) {
                    paragraphs.add(String.join("\n", current));
                    current.clear();
                }
                continue;
            }

            current.add(line);
        }

        if (!current.isEmpty()) {
            paragraphs.add(String.join("\n", current));
        }

        boolean hasMore = false;
        if (paragraphs.size() > maxParagraphs) {
            paragraphs = paragraphs.subList(0, maxParagraphs);
            hasMore = true;
        }

        String preview = String.join("\n\n", paragraphs).trim();
        if (preview.isEmpty()) {
            return new Preview("", false);
        }

        if (preview.length() > maxChars) {
            int end = Character.isHighSurrogate(preview.charAt(maxChars - 1)) ? maxChars - 1 : maxChars;
            preview = preview.substring(0, end).trim();
            hasMore = true;
        }

        return new Preview(preview, hasMore);
    }

    @Value
    static class Preview {
        String text;
        boolean hasMore;
    }
}
