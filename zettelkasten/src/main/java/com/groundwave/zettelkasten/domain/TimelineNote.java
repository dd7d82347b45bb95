package com.groundwave.zettelkasten.domain;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * A timestamped zettel ({@code YYYYMMDDHHMMSS-*.org}) placed on the timeline.
 */
@Value
@Builder
public class TimelineNote {
    String id;
    String title;
    String filename;
    OffsetDateTime timestamp;
    String dateString;
}
