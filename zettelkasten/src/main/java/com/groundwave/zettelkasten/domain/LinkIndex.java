package com.groundwave.zettelkasten.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable link-graph snapshot produced by one {@link LinkIndexBuilder} pass.
 *
 * For every pair (s, t): t is in forwardLinks[s] iff s is in backlinks[t].
 */
@Value
@Builder
public class LinkIndex {
    Map<String, List<String>> backlinks;     // target id -> sources, in scan order
    Map<String, List<String>> forwardLinks;  // source id -> unique targets, sorted
    Map<String, Boolean> publicMap;          // note id -> #+access: public
    Instant builtAt;
    int filesProcessed;
    int filesSkipped;
}
