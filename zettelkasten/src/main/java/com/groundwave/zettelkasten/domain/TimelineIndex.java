package com.groundwave.zettelkasten.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable timeline snapshot: timestamped notes bucketed by day, newest first within a day.
 */
@Value
@Builder
public class TimelineIndex {
    Map<String, List<TimelineNote>> byDate;
    Instant builtAt;
    int filesProcessed;
    int filesSkipped;
}
