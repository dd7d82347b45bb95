package com.groundwave.zettelkasten.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Lightweight listing entry for note pickers.
 */
@Value
@Builder
public class NoteSummary {
    String id;
    String title;
    boolean isPublic;
}
