package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.error.ConfigException;
import com.groundwave.zettelkasten.error.InvalidNoteIdException;
import com.groundwave.zettelkasten.error.RemoteFetchException;
import com.groundwave.zettelkasten.error.RenderException;
import com.groundwave.zettelkasten.error.RestrictedNoteException;
import com.groundwave.zettelkasten.io.NoteSource;
import com.groundwave.zettelkasten.io.OrgHtmlRenderer;
import com.groundwave.zettelkasten.io.OrgParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches notes by id and renders them to HTML for the different site areas.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NoteRenderer {

    public static final String PUBLIC_BASE_PATH = "/note";
    public static final String HOME_BASE_PATH = "/home";
    public static final String RESTRICTED_LINK_CLASS = "restricted-link";

    private static final Pattern NOTE_LINK = Pattern.compile("<a([^>]*?)href=\"(/note/([a-f0-9\\-]+))\"([^>]*)>",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern CLASS_ATTR = Pattern.compile("\\sclass=\"([^\"]*)\"");

    private final NoteSource noteSource;
    private final NoteIdResolver idResolver;
    private final OrgParser orgParser;
    private final OrgHtmlRenderer htmlRenderer;
    private final ZettelkastenCache cache;

    /**
     * Render a note with id links pointing at {@code basePath}.
     *
     * Under {@value #PUBLIC_BASE_PATH}, links to notes that are not public get the
     * {@value #RESTRICTED_LINK_CLASS} class once the link index has been built.
     *
     * @return empty if no file carries that id
     */
    public Optional<Note> renderNote(String id, String basePath)
            throws InvalidNoteIdException, RemoteFetchException, RenderException {
        Optional<String> filename = idResolver.resolve(id);
        if (filename.isEmpty()) {
            return Optional.empty();
        }

        String content = noteSource.fetchMain(filename.get());
        String html = htmlRenderer.render(content, basePath);

        String trimmedBase = basePath == null ? "" : basePath.trim().replaceAll("/+$", "");
        if (PUBLIC_BASE_PATH.equals(trimmedBase)) {
            html = annotateRestrictedLinks(html);
        }

        return Optional.of(Note.builder()
            .id(id.toLowerCase(Locale.ROOT))
            .title(orgParser.extractTitle(content))
            .filename(filename.get())
            .isPublic(orgParser.isPublic(content))
            .htmlBody(html)
            .build());
    }

    public Optional<Note> renderNote(String id) throws InvalidNoteIdException, RemoteFetchException, RenderException {
        return renderNote(id, OrgHtmlRenderer.DEFAULT_BASE_PATH);
    }

    /**
     * Render the configured index note. It is fetched by filename, so it needs no id.
     */
    public Note renderIndexNote() throws RemoteFetchException, RenderException {
        return renderByFilename(noteSource.indexFilename(), OrgHtmlRenderer.DEFAULT_BASE_PATH);
    }

    /**
     * Render the home index note for non-admin visitors.
     *
     * @throws ConfigException         if no home note is configured
     * @throws RestrictedNoteException unless the note carries {@code #+access: home} or {@code #+access: public}
     */
    public Note renderHomeNote() throws RemoteFetchException, RenderException, RestrictedNoteException {
        String homeFile = noteSource.homeFilename()
            .orElseThrow(() -> new ConfigException("groundwave.zk.home-path (WEBDAV_HOME_PATH) not configured"));

        String content = noteSource.fetchMain(homeFile);
        if (!orgParser.isHomeAccessible(content) && !orgParser.isPublic(content)) {
            log.warn("Home index note is not visible to non-admin users: {}", homeFile);
            throw new RestrictedNoteException("Home index must include #+access: home or #+access: public");
        }
        return toNote(homeFile, content, HOME_BASE_PATH);
    }

    /**
     * Every note in the notes root that has an id, ordered by title ignoring case.
     */
    public List<NoteSummary> listNotes() throws RemoteFetchException {
        List<NoteSummary> notes = new ArrayList<>();
        for (String file : noteSource.listMainFiles()) {
            String content;
            try {
                content = noteSource.fetchMain(file);
            } catch (RemoteFetchException e) {
                log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }

            Optional<String> noteId = orgParser.extractId(content);
            if (noteId.isEmpty()) {
                continue;
            }

            notes.add(NoteSummary.builder()
                .id(noteId.get())
                .title(orgParser.extractTitle(content))
                .isPublic(orgParser.isPublic(content))
                .build());
        }

        notes.sort(Comparator.comparing(summary -> summary.getTitle().toLowerCase(Locale.ROOT)));
        return notes;
    }

    /**
     * Raw Org body of a note, for prompting.
     */
    public Optional<ChatNote> getNoteForChat(String id) throws InvalidNoteIdException, RemoteFetchException {
        Optional<String> filename = idResolver.resolve(id);
        if (filename.isEmpty()) {
            return Optional.empty();
        }

        String content = noteSource.fetchMain(filename.get());
        return Optional.of(ChatNote.builder()
            .id(id.toLowerCase(Locale.ROOT))
            .title(orgParser.extractTitle(content))
            .rawBody(content)
            .build());
    }

    /**
     * Forward links of a note as last indexed.
     */
    public List<String> getNoteLinks(String id) {
        return cache.getForwardLinks(id);
    }

    /**
     * Add {@value #RESTRICTED_LINK_CLASS} to every {@code /note/<uuid>} anchor whose target is not public.
     * Left untouched until the link index has been built once.
     */
    String annotateRestrictedLinks(String html) {
        if (cache.getLastLinkBuildAt().isEmpty()) {
            return html;
        }

        Matcher linkMatcher = NOTE_LINK.matcher(html);
        StringBuilder result = new StringBuilder();
        while (linkMatcher.find()) {
            String link = linkMatcher.group();
            String replacement = cache.isPublic(linkMatcher.group(3)) ? link : markRestricted(link);
            linkMatcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        linkMatcher.appendTail(result);
        return result.toString();
    }

    private static String markRestricted(String link) {
        Matcher classMatcher = CLASS_ATTR.matcher(link);
        if (!classMatcher.find()) {
            return link.replaceFirst("<a", "<a class=\"" + RESTRICTED_LINK_CLASS + "\"");
        }

        String classes = classMatcher.group(1);
        boolean present = Arrays.asList(classes.trim().split("\\s+")).contains(RESTRICTED_LINK_CLASS);
        if (present) {
            return link;
        }
        return link.substring(0, classMatcher.start())
            + " class=\"" + classes + " " + RESTRICTED_LINK_CLASS + "\""
            + link.substring(classMatcher.end());
    }

    private Note renderByFilename(String filename, String basePath) throws RemoteFetchException, RenderException {
        return toNote(filename, noteSource.fetchMain(filename), basePath);
    }

    private Note toNote(String filename, String content, String basePath) throws RenderException {
        return Note.builder()
            .id(orgParser.extractId(content).orElse(""))
            .title(orgParser.extractTitle(content))
            .filename(filename)
            .isPublic(orgParser.isPublic(content))
            .htmlBody(htmlRenderer.render(content, basePath))
            .build();
    }
}
