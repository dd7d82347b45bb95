package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.error.InvalidNoteIdException;
import com.groundwave.zettelkasten.error.RemoteFetchException;
import com.groundwave.zettelkasten.io.NoteSource;
import com.groundwave.zettelkasten.io.OrgParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps note ids to filenames in the notes root.
 *
 * Misses trigger a scan of the directory that records every id it reads along the way.
 * Nothing is evicted; a moved note is corrected by the next scan that reads it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NoteIdResolver {

    private final NoteSource noteSource;
    private final OrgParser orgParser;

    private final Map<String, String> filenamesById = new ConcurrentHashMap<>();

    /**
     * Find the file carrying {@code :ID: id}.
     *
     * @return filename, or empty if no file in the current listing has that id
     * @throws InvalidNoteIdException if {@code id} is not a UUID; checked before any request
     * @throws RemoteFetchException   if the notes root cannot be listed
     */
    public Optional<String> resolve(String id) throws InvalidNoteIdException, RemoteFetchException {
        if (!orgParser.isValidUuid(id)) {
            throw new InvalidNoteIdException(id);
        }
        String noteId = id.toLowerCase(Locale.ROOT);

        String cached = filenamesById.get(noteId);
        if (cached != null) {
            return Optional.of(cached);
        }

        log.info("Cache miss for ID, scanning WebDAV directory: {}", noteId);
        List<String> files = noteSource.listMainFiles();

        for (String file : files) {
            String content;
            try {
                content = noteSource.fetchMain(file);
            } catch (RemoteFetchException e) {
                log.warn("Failed to fetch file during ID scan {}: {}", file, e.getMessage());
                continue;
            }

            Optional<String> fileId = orgParser.extractId(content);
            if (fileId.isEmpty()) {
                continue;
            }

            filenamesById.put(fileId.get(), file);
            if (fileId.get().equals(noteId)) {
                log.debug("Resolved note {} to {}", noteId, file);
                return Optional.of(file);
            }
        }

        return Optional.empty();
    }

    /**
     * Filename currently recorded for {@code id}, without scanning.
     */
    Optional<String> cachedFilename(String id) {
        return Optional.ofNullable(filenamesById.get(id.toLowerCase(Locale.ROOT)));
    }

    int size() {
        return filenamesById.size();
    }
}
