package com.groundwave.zettelkasten.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A zettelkasten note rendered to HTML.
 */
@Value
@Builder
public class Note {
    String id;
    String title;
    String filename;
    boolean isPublic;
    String htmlBody;
}
