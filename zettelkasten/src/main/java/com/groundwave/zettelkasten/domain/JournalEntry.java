package com.groundwave.zettelkasten.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A daily journal note ({@code daily/YYYY-MM-DD.org}) with its rendered body and preview.
 */
@Value
@Builder
public class JournalEntry {
    LocalDate date;
    String dateString;
    String filename;
    String title;
    String htmlBody;
    String previewHtml;  // empty when the preview could not be rendered
    boolean hasMore;
    Instant updatedAt;
}
