package com.groundwave.zettelkasten.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A note with its raw Org content, used as prompt context.
 */
@Value
@Builder
public class ChatNote {
    String id;
    String title;
    String rawBody;
}
