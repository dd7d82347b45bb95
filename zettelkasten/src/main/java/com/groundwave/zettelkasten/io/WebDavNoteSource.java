package com.groundwave.zettelkasten.io;

import com.groundwave.zettelkasten.config.ZettelkastenConfig;
import com.groundwave.zettelkasten.error.RemoteFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link NoteSource} backed by the configured WebDAV directory.
 */
@Slf4j
@RequiredArgsConstructor
public class WebDavNoteSource implements NoteSource {

    private final ZettelkastenConfig config;
    private final WebDavClient client;

    @Override
    public List<String> listMainFiles() throws RemoteFetchException {
        List<WebDavEntry> entries = client.listDirectory(config.getBaseUrl());
        log.info("Found {} WebDAV directory items at {}", entries.size(), config.getBaseUrl());
        return orgFilenames(entries);
    }

    @Override
    public List<String> listDailyFiles() throws RemoteFetchException {
        List<WebDavEntry> entries = client.listDirectory(config.getDailyBaseUrl());
        log.info("Found {} WebDAV daily directory items at {}", entries.size(), config.getDailyBaseUrl());
        return orgFilenames(entries);
    }

    @Override
    public String fetchMain(String filename) throws RemoteFetchException {
        return client.fetchString(config.getBaseUrl() + encodeSegment(filename));
    }

    @Override
    public String fetchDaily(String filename) throws RemoteFetchException {
        return client.fetchString(config.getDailyBaseUrl() + encodeSegment(filename));
    }

    @Override
    public String indexFilename() {
        return config.getIndexFile();
    }

    @Override
    public Optional<String> homeFilename() {
        return config.resolveHomeFile();
    }

    private static List<String> orgFilenames(List<WebDavEntry> entries) {
        return entries.stream()
            .filter(entry -> !entry.isDirectory())
            .map(WebDavEntry::getName)
            .filter(name -> name.endsWith(".org"))
            .sorted(Comparator.naturalOrder())
            .toList();
    }

    private static String encodeSegment(String filename) {
        return URLEncoder.encode(filename, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
