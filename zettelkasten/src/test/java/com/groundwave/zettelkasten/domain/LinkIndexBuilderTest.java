package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.error.BuildException;
import com.groundwave.zettelkasten.io.OrgParser;
import com.groundwave.zettelkasten.support.InMemoryNoteSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.groundwave.zettelkasten.support.OrgNotes.*;
import static org.junit.jupiter.api.Assertions.*;

class LinkIndexBuilderTest {

    private static final String A = "aaaaaaaa-0000-0000-0000-000000000001";
    private static final String B = "bbbbbbbb-0000-0000-0000-000000000002";
    private static final String C = "cccccccc-0000-0000-0000-000000000003";
    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private InMemoryNoteSource source;
    private LinkIndexBuilder builder;

    @BeforeEach
    void setUp() {
        source = new InMemoryNoteSource();
        builder = new LinkIndexBuilder(source, new OrgParser(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private LinkIndex build() throws Exception {
        return builder.build(source.listMainFiles(), source.listDailyFiles());
    }

    @Test
    void testBacklinksFromNotesAndDailies() throws Exception {
        source.main("a.org", note(A, "A", "Links to " + link(B, "B") + "\n"))
            .main("b.org", note(B, "B", "No links\n"))
            .daily("2024-05-01.org", "#+TITLE: May Day\nMet " + link(B) + "\n");

        LinkIndex index = build();

        assertEquals(List.of(A, "daily:2024-05-01"), index.getBacklinks().get(B));
        assertEquals(List.of(B), index.getForwardLinks().get("daily:2024-05-01"));
        assertEquals(List.of(), index.getForwardLinks().get(B));
        assertEquals(NOW, index.getBuiltAt());
        assertEquals(3, index.getFilesProcessed());
    }

    @Test
    void testDuplicateLinksCountOnce() throws Exception {
        source.main("a.org", note(A, "A", link(B) + " " + link(C) + " " + link(B, "again") + "\n"));

        LinkIndex index = build();

        assertEquals(List.of(A), index.getBacklinks().get(B));
        assertEquals(List.of(B, C), index.getForwardLinks().get(A));
    }

    @Test
    void testForwardLinksAreSorted() throws Exception {
        source.main("a.org", note(A, "A", link(C) + " then " + link(B) + "\n"));

        assertEquals(List.of(B, C), build().getForwardLinks().get(A));
    }

    @Test
    void testSelfLinkIsRecorded() throws Exception {
        source.main("a.org", note(A, "A", "Me: " + link(A) + "\n"));

        LinkIndex index = build();

        assertEquals(List.of(A), index.getBacklinks().get(A));
        assertEquals(List.of(A), index.getForwardLinks().get(A));
    }

    @Test
    void testBacklinksAndForwardLinksAgree() throws Exception {
        source.main("a.org", note(A, "A", link(B) + link(C) + "\n"))
            .main("b.org", note(B, "B", link(C) + link(A) + "\n"))
            .main("c.org", note(C, "C", link(C) + "\n"))
            .daily("2024-05-02.org", link(A) + link(C) + "\n");

        LinkIndex index = build();

        for (Map.Entry<String, List<String>> forward : index.getForwardLinks().entrySet()) {
            for (String target : forward.getValue()) {
                assertTrue(index.getBacklinks().get(target).contains(forward.getKey()),
                    forward.getKey() + " -> " + target + " missing from backlinks");
            }
        }
        for (Map.Entry<String, List<String>> back : index.getBacklinks().entrySet()) {
            for (String sourceId : back.getValue()) {
                assertTrue(index.getForwardLinks().get(sourceId).contains(back.getKey()),
                    sourceId + " -> " + back.getKey() + " missing from forward links");
            }
        }
    }

    @Test
    void testFilesSharingAnIdMergeTheirLinks() throws Exception {
        source.main("a.org", note(A, "A", link(B) + "\n"))
            .main("a-copy.org", note(A, "A copy", link(C) + " " + link(B) + "\n"));

        LinkIndex index = build();

        assertEquals(List.of(B, C), index.getForwardLinks().get(A));
        assertEquals(List.of(A), index.getBacklinks().get(B));
        assertEquals(List.of(A), index.getBacklinks().get(C));
        assertEquals(2, index.getFilesProcessed());
    }

    @Test
    void testPublicMapCoversNotesOnly() throws Exception {
        source.main("a.org", note(A, "A", "#+ACCESS: Public\n"))
            .main("b.org", note(B, "B", "#+access: friends\n"))
            .daily("2024-05-01.org", "#+access: public\n");

        LinkIndex index = build();

        assertEquals(Map.of(A, true, B, false), index.getPublicMap());
    }

    @Test
    void testUnusableFilesAreSkipped() throws Exception {
        source.main("a.org", note(A, "A", link(B) + "\n"))
            .main("no-id.org", "#+TITLE: No id\n" + link(B) + "\n")
            .main("broken.org", note(C, "C", link(B) + "\n"))
            .unreadable("broken.org")
            .daily("notes.org", link(B) + "\n")
            .daily("2024-13-45.org", link(B) + "\n");

        LinkIndex index = build();

        assertEquals(List.of(A), index.getBacklinks().get(B));
        assertEquals(1, index.getFilesProcessed());
        assertEquals(4, index.getFilesSkipped());
        assertEquals(0, source.getFetchCount("notes.org"));
        assertEquals(0, source.getFetchCount("2024-13-45.org"));
    }

    @Test
    void testSnapshotIsImmutable() throws Exception {
        source.main("a.org", note(A, "A", link(B) + "\n"));

        LinkIndex index = build();

        assertThrows(UnsupportedOperationException.class, () -> index.getBacklinks().get(B).add(C));
        assertThrows(UnsupportedOperationException.class, () -> index.getForwardLinks().put(C, List.of()));
    }

    @Test
    void testCancelledBuildFails() {
        source.main("a.org", note(A, "A", link(B) + "\n"));

        Thread.currentThread().interrupt();
        assertThrows(BuildException.class, this::build);
        assertEquals(0, source.getTotalFetches());
    }
}
