package com.consullo.cup.capture;

import com.consullo.cup.core.Envelope;
import java.util.Map;

/**
 * Outcome of pruning an envelope.
 *
 * @param envelope pruned envelope sharing the canonical metadata
 * @param detail detail level applied
 * @param counts before/after node counts
 * @param clipped hidden-node counts keyed by the id of the surviving container that holds them
 * @since 1.0
 */
public record PruneResult(Envelope envelope, DetailLevel detail, PruneCounts counts, Map<String, ClippedCounts> clipped) {

  public PruneResult {
    if (envelope == null || detail == null || counts == null || clipped == null) {
      throw new IllegalArgumentException("envelope/detail/counts/clipped must not be null.");
    }
    clipped = Map.copyOf(clipped);
  }

  public PruneResult(Envelope envelope, DetailLevel detail, PruneCounts counts) {
    this(envelope, detail, counts, Map.of());
  }

  /**
   * Returns the hidden-node counts recorded for a node.
   *
   * @param nodeId node id
   * @return counts, {@link ClippedCounts#NONE} when nothing is hidden
   */
  public ClippedCounts clippedFor(String nodeId) {
    ClippedCounts c = clipped.get(nodeId);
    return c == null ? ClippedCounts.NONE : c;
  }
}
