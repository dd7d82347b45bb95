package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.io.OrgHtmlRenderer;
import com.groundwave.zettelkasten.io.OrgParser;
import com.groundwave.zettelkasten.support.InMemoryNoteSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class JournalIndexBuilderTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private InMemoryNoteSource source;
    private JournalIndexBuilder builder;

    @BeforeEach
    void setUp() {
        source = new InMemoryNoteSource();
        builder = new JournalIndexBuilder(source, new OrgParser(), new OrgHtmlRenderer(""),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JournalIndex build() throws Exception {
        return builder.build(source.listDailyFiles());
    }

    @Test
    void testShortDailyHasNoMore() throws Exception {
        source.daily("2024-01-01.org", "#+TITLE: New Year\nSaw [[id:33333333-3333-3333-3333-333333333333][three]].\n");

        JournalEntry entry = build().getEntries().get("2024-01-01");

        assertNotNull(entry);
        assertEquals(LocalDate.of(2024, 1, 1), entry.getDate());
        assertEquals("New Year", entry.getTitle());
        assertEquals("2024-01-01.org", entry.getFilename());
        assertFalse(entry.isHasMore());
        assertTrue(entry.getHtmlBody().contains("href=\"/zk/33333333-3333-3333-3333-333333333333\""));
        assertTrue(entry.getPreviewHtml().contains("three"));
        assertEquals(NOW, entry.getUpdatedAt());
    }

    @Test
    void testTitleFallsBackToDate() throws Exception {
        source.daily("2024-02-29.org", "Leap day\n");

        assertEquals("2024-02-29", build().getEntries().get("2024-02-29").getTitle());
    }

    @Test
    void testPreviewSkipsDrawerTitleAndHeadlines() {
        String content = """
            :PROPERTIES:
            :ID: 11111111-1111-1111-1111-111111111111
            :END:
            #+TITLE: Day
            * Morning
            First paragraph
            continues here.

            ** Later
            Second paragraph.

            Third paragraph.
            """;

        JournalIndexBuilder.Preview preview = JournalIndexBuilder.buildPreview(content, 2, 480);

        assertEquals("First paragraph\ncontinues here.\n\nSecond paragraph.", preview.getText());
        assertTrue(preview.isHasMore());
    }

    @Test
    void testPreviewTruncatesLongText() {
        String content = "x".repeat(600) + "\n";

        JournalIndexBuilder.Preview preview = JournalIndexBuilder.buildPreview(content, 2, 480);

        assertEquals(480, preview.getText().length());
        assertTrue(preview.isHasMore());
    }

    @Test
    void testTruncationKeepsSurrogatePairsWhole() {
        String content = "x".repeat(479) + "\uD83D\uDE00" + "y".repeat(100) + "\n";

        JournalIndexBuilder.Preview preview = JournalIndexBuilder.buildPreview(content, 2, 480);

        assertEquals("x".repeat(479), preview.getText());
        assertTrue(preview.isHasMore());
    }

    @Test
    void testEmptyPreview() {
        JournalIndexBuilder.Preview preview = JournalIndexBuilder.buildPreview("#+TITLE: Only a title\n* Heading\n", 2, 480);

        assertEquals("", preview.getText());
        assertFalse(preview.isHasMore());
    }

    @Test
    void testInvalidAndUnreadableFilesAreSkipped() throws Exception {
        source.daily("2024-01-01.org", "ok\n")
            .daily("2024-02-30.org", "bad date\n")
            .daily("2024-01-02.org", "binary\u0000\n")
            .daily("2024-01-03.org", "unreadable\n")
            .unreadable("2024-01-03.org")
            .daily("scratch.org", "not a daily\n");

        JournalIndex index = build();

        assertEquals(1, index.getEntries().size());
        assertTrue(index.getEntries().containsKey("2024-01-01"));
        assertEquals(3, index.getFilesSkipped());
    }
}
