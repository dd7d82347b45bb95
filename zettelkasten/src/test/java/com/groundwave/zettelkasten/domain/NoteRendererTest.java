package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.error.ConfigException;
import com.groundwave.zettelkasten.error.InvalidNoteIdException;
import com.groundwave.zettelkasten.error.RemoteFetchException;
import com.groundwave.zettelkasten.error.RenderException;
import com.groundwave.zettelkasten.error.RestrictedNoteException;
import com.groundwave.zettelkasten.io.OrgHtmlRenderer;
import com.groundwave.zettelkasten.io.OrgParser;
import com.groundwave.zettelkasten.support.InMemoryNoteSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.groundwave.zettelkasten.domain.ZettelkastenCacheTest.*;
import static com.groundwave.zettelkasten.support.OrgNotes.*;
import static org.junit.jupiter.api.Assertions.*;

class NoteRendererTest {

    private InMemoryNoteSource source;
    private ZettelkastenCache cache;
    private NoteRenderer renderer;

    @BeforeEach
    void setUp() {
        source = new InMemoryNoteSource()
            .main("index.org", note(ID_1, "Index", "Start at " + link(ID_2, "A") + "\n"))
            .main("a.org", note(ID_2, "A", "See " + link(ID_3, "X") + "\n"))
            .main("b.org", note(ID_3, "B", ""));
        cache = newCache(source);
        OrgParser parser = new OrgParser();
        renderer = new NoteRenderer(source, new NoteIdResolver(source, parser), parser,
            new OrgHtmlRenderer("https://groundwave.example.com"), cache);
    }

    @Test
    void testRenderNote() throws Exception {
        Note note = renderer.renderNote(ID_2, "/zk").orElseThrow();

        assertEquals(ID_2, note.getId());
        assertEquals("A", note.getTitle());
        assertEquals("a.org", note.getFilename());
        assertFalse(note.isPublic());
        assertEquals("<p>See <a href=\"/zk/" + ID_3 + "\">X</a></p>\n", note.getHtmlBody());
    }

    @Test
    void testUnknownNoteIsEmpty() throws Exception {
        assertEquals(Optional.empty(), renderer.renderNote("99999999-9999-9999-9999-999999999999", "/zk"));
    }

    @Test
    void testInvalidIdIsRejected() {
        assertThrows(InvalidNoteIdException.class, () -> renderer.renderNote("index", "/zk"));
        assertEquals(0, source.getListCalls());
    }

    @Test
    void testLinkToPublicNoteIsNotRestricted() throws Exception {
        source.main("b.org", publicNote(ID_3, "B", ""));
        cache.refreshAll();

        Note note = renderer.renderNote(ID_2, "/note").orElseThrow();

        assertEquals("<p>See <a href=\"/note/" + ID_3 + "\">X</a></p>\n", note.getHtmlBody());
    }

    @Test
    void testLinkToPrivateNoteIsRestricted() throws Exception {
        cache.refreshAll();

        Note note = renderer.renderNote(ID_2, "/note/").orElseThrow();

        assertEquals("<p>See <a class=\"restricted-link\" href=\"/note/" + ID_3 + "\">X</a></p>\n",
            note.getHtmlBody());
    }

    @Test
    void testUppercaseLinkToPrivateNoteIsRestricted() throws Exception {
        String privateId = "abcdef12-3333-3333-3333-333333333333";
        source.main("a.org", note(ID_2, "A", "See " + link(privateId.toUpperCase(), "X") + "\n"))
            .main("d.org", note(privateId, "D", ""));
        cache.refreshAll();

        Note note = renderer.renderNote(ID_2, "/note").orElseThrow();

        assertEquals("<p>See <a class=\"restricted-link\" href=\"/note/" + privateId + "\">X</a></p>\n",
            note.getHtmlBody());
    }

    @Test
    void testNoAnnotationBeforeFirstBuild() throws Exception {
        Note note = renderer.renderNote(ID_2, "/note").orElseThrow();

        assertFalse(note.getHtmlBody().contains(NoteRenderer.RESTRICTED_LINK_CLASS));
    }

    @Test
    void testOtherBasePathsAreNotAnnotated() throws Exception {
        cache.refreshAll();

        assertFalse(renderer.renderNote(ID_2, "/zk").orElseThrow().getHtmlBody().contains("restricted-link"));
    }

    @Test
    void testRestrictedClassMergesWithExistingClass() throws Exception {
        cache.refreshAll();
        String link = "/note/" + ID_3;

        assertEquals("<a class=\"internal restricted-link\" href=\"" + link + "\">",
            renderer.annotateRestrictedLinks("<a class=\"internal\" href=\"" + link + "\">"));
        assertEquals("<a class=\"restricted-link internal\" href=\"" + link + "\">",
            renderer.annotateRestrictedLinks("<a class=\"restricted-link internal\" href=\"" + link + "\">"));
    }

    @Test
    void testRenderIndexNote() throws Exception {
        Note index = renderer.renderIndexNote();

        assertEquals(ID_1, index.getId());
        assertEquals("index.org", index.getFilename());
        assertTrue(index.getHtmlBody().contains("href=\"/zk/" + ID_2 + "\""));
        assertEquals(0, source.getListCalls());
    }

    @Test
    void testRenderHomeNote() throws Exception {
        source.homeFilename("home.org")
            .main("home.org", note("66666666-6666-6666-6666-666666666666", "Home Index",
                "#+access: home\n" + link(ID_2, "Note One") + "\n"));

        Note home = renderer.renderHomeNote();

        assertEquals("Home Index", home.getTitle());
        assertTrue(home.getHtmlBody().contains("href=\"/home/" + ID_2 + "\""));
    }

    @Test
    void testHomeNoteRequiresAccessDirective() {
        source.homeFilename("home.org").main("home.org", note("66666666-6666-6666-6666-666666666666", "Home", ""));

        assertThrows(RestrictedNoteException.class, renderer::renderHomeNote);
    }

    @Test
    void testHomeNoteRequiresConfiguration() {
        assertThrows(ConfigException.class, renderer::renderHomeNote);
    }

    @Test
    void testBrokenNoteFailsToRender() {
        source.main("b.org", note(ID_3, "B", "bad\u0000bytes\n"));

        assertThrows(RenderException.class, () -> renderer.renderNote(ID_3, "/zk"));
    }

    @Test
    void testDeletedNoteFailsToFetch() throws Exception {
        renderer.renderNote(ID_3, "/zk");
        source.removeMain("b.org");

        RemoteFetchException e = assertThrows(RemoteFetchException.class, () -> renderer.renderNote(ID_3, "/zk"));
        assertTrue(e.isNotFound());
    }

    @Test
    void testListNotesSortedByTitle() throws Exception {
        source.main("c.org", publicNote("55555555-5555-5555-5555-555555555555", "apple", ""))
            .main("no-id.org", "#+TITLE: Orphan\n");

        List<NoteSummary> notes = renderer.listNotes();

        assertEquals(List.of("A", "apple", "B", "Index"), notes.stream().map(NoteSummary::getTitle).toList());
        assertTrue(notes.get(1).isPublic());
    }

    @Test
    void testNoteForChatKeepsRawBody() throws Exception {
        ChatNote chatNote = renderer.getNoteForChat(ID_2).orElseThrow();

        assertEquals("A", chatNote.getTitle());
        assertTrue(chatNote.getRawBody().contains("[[id:" + ID_3 + "][X]]"));
    }

    @Test
    void testNoteLinksComeFromCache() throws Exception {
        assertTrue(renderer.getNoteLinks(ID_2).isEmpty());

        cache.refreshAll();

        assertEquals(List.of(ID_3), renderer.getNoteLinks(ID_2));
    }
}
