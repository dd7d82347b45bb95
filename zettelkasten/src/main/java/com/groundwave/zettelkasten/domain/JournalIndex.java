package com.groundwave.zettelkasten.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable journal snapshot keyed by date string (YYYY-MM-DD).
 */
@Value
@Builder
public class JournalIndex {
    Map<String, JournalEntry> entries;
    Instant builtAt;
    int filesProcessed;
    int filesSkipped;
}
