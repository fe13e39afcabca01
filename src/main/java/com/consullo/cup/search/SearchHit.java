package com.consullo.cup.search;

import com.consullo.cup.core.Node;

/**
 * One ranked search result.
 *
 * @param node matched node with children removed
 * @param score combined relevance score
 * @param index pre-order position in the searched tree
 * @since 1.0
 */
public record SearchHit(Node node, double score, int index) {
}
