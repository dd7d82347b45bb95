package com.groundwave.zettelkasten.io;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One member of a WebDAV collection as reported by PROPFIND.
 */
@Value
@Builder
public class WebDavEntry {
    String path;       // decoded href path, e.g. /org/daily/2024-01-01.org
    String name;       // last path segment
    boolean directory;
    long size;
    Instant modified;  // null when the server did not report getlastmodified
}
