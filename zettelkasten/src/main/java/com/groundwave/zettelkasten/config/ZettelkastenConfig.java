package com.groundwave.zettelkasten.config;

import com.groundwave.zettelkasten.error.ConfigException;
import lombok.Builder;
import lombok.Value;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Optional;

/**
 * Resolved zettelkasten configuration derived from {@link ZettelkastenProperties}.
 *
 * zkPath https://dav.example.com/org/abc-index.org resolves to
 * baseUrl https://dav.example.com/org/ and indexFile abc-index.org.
 */
@Value
@Builder
public class ZettelkastenConfig {

    public static final String DAILY_DIRECTORY = "daily/";

    String baseUrl;
    String indexFile;
    String homePath;
    String username;
    String password;
    String siteBaseUrl;
    Duration requestTimeout;

    public static ZettelkastenConfig from(ZettelkastenProperties properties) {
        if (isBlank(properties.getZkPath())) {
            throw new ConfigException("groundwave.zk.zk-path (WEBDAV_ZK_PATH) not configured");
        }

        NoteLocation index = parseNoteLocation(properties.getZkPath().trim(), "zk-path");

        return ZettelkastenConfig.builder()
            .baseUrl(index.getDirectoryUrl())
            .indexFile(index.getFilename())
            .homePath(isBlank(properties.getHomePath()) ? null : properties.getHomePath().trim())
            .username(properties.getWebdavUsername())
            .password(properties.getWebdavPassword())
            .siteBaseUrl(properties.getSiteBaseUrl())
            .requestTimeout(properties.getRequestTimeout() != null
                ? properties.getRequestTimeout() : Duration.ofSeconds(3))
            .build();
    }

    public String getDailyBaseUrl() {
        return baseUrl + DAILY_DIRECTORY;
    }

    /**
     * Basic auth is only applied when both username and password are present.
     */
    public boolean hasCredentials() {
        return !isBlank(username) && !isBlank(password);
    }

    /**
     * Filename of the home index note.
     *
     * @return empty when no home path is configured
     * @throws ConfigException if the home path is malformed or lives in another directory
     */
    public Optional<String> resolveHomeFile() {
        if (homePath == null) {
            return Optional.empty();
        }

        NoteLocation home = parseNoteLocation(homePath, "home-path");
        if (!home.getDirectoryUrl().equals(baseUrl)) {
            throw new ConfigException("home-path must be in the same directory as zk-path: "
                + home.getDirectoryUrl() + " != " + baseUrl);
        }
        return Optional.of(home.getFilename());
    }

    private static NoteLocation parseNoteLocation(String rawUrl, String key) {
        URI uri;
        try {
            uri = new URI(rawUrl);
        } catch (URISyntaxException e) {
            throw new ConfigException("invalid " + key + " URL: " + rawUrl, e);
        }

        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new ConfigException(key + " must be an absolute URL: " + rawUrl);
        }

        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        int slash = path.lastIndexOf('/');
        String filename = slash >= 0 ? path.substring(slash + 1) : path;
        if (filename.isEmpty()) {
            throw new ConfigException(key + " must include a filename: " + rawUrl);
        }
        if (!filename.endsWith(".org")) {
            throw new ConfigException(key + " must point to a .org file: " + rawUrl);
        }

        String directory = slash >= 0 ? path.substring(0, slash + 1) : "/";
        if (!directory.startsWith("/")) {
            directory = "/" + directory;
        }

        // Directory stays encoded for URL building, filename is kept as listed by PROPFIND
        String decodedPath = uri.getPath() == null ? "" : uri.getPath();
        String decodedFilename = decodedPath.substring(decodedPath.lastIndexOf('/') + 1);

        return new NoteLocation(uri.getScheme() + "://" + uri.getRawAuthority() + directory, decodedFilename);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    private static class NoteLocation {
        String directoryUrl;
        String filename;
    }
}
