package com.consullo.cup.capture;

/**
 * Node counts reported by a pruning pass.
 *
 * @param before nodes in the canonical tree
 * @param after nodes in the pruned tree
 * @since 1.0
 */
public record PruneCounts(int before, int after) {
}
