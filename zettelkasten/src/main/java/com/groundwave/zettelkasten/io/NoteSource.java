package com.groundwave.zettelkasten.io;

import com.groundwave.zettelkasten.error.RemoteFetchException;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the notes directory and its {@code daily/} subdirectory.
 *
 * Listings contain plain {@code .org} filenames (no directories) sorted by name.
 */
public interface NoteSource {

    /**
     * List the org files of the notes root.
     *
     * @throws RemoteFetchException if the directory cannot be listed
     */
    List<String> listMainFiles() throws RemoteFetchException;

    /**
     * List the org files of the daily subdirectory. A missing subdirectory yields an empty list.
     *
     * @throws RemoteFetchException if the directory exists but cannot be listed
     */
    List<String> listDailyFiles() throws RemoteFetchException;

    String fetchMain(String filename) throws RemoteFetchException;

    String fetchDaily(String filename) throws RemoteFetchException;

    /**
     * Filename of the configured index note within the notes root.
     */
    String indexFilename();

    /**
     * Filename of the configured home note, if any.
     */
    Optional<String> homeFilename();
}
