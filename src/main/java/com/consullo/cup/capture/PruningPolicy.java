package com.consullo.cup.capture;

import com.consullo.cup.core.Node;

/**
 * Per-node decisions used by the {@link PruningEngine}.
 *
 * <p>The engine owns traversal, viewport bookkeeping and counting; a policy only classifies single nodes.
 *
 * @since 1.0
 */
public interface PruningPolicy {

  /**
   * Returns true if the node's bounds narrow the viewport for its descendants.
   *
   * @param node node
   * @return true for scrollable containers and viewports
   */
  boolean isClipBearing(Node node);

  /**
   * Returns true if the node is exempt from viewport clipping.
   *
   * @param node node
   * @return true if kept regardless of position
   */
  boolean isAlwaysKept(Node node);

  /**
   * Returns true if the node should be dropped with its subtree regardless of its descendants.
   *
   * @param node non-root node
   * @param parent its parent in the canonical tree
   * @return true if dropped
   */
  boolean shouldDrop(Node node, Node parent);

  /**
   * Returns true if the node carries information on its own, even without surviving children.
   *
   * @param node node
   * @return true if relevant
   */
  boolean isRelevant(Node node);

  /**
   * Returns true if the node is a structural wrapper that may be replaced by its only surviving child.
   *
   * @param node node
   * @return true if collapsible
   */
  boolean isCollapsible(Node node);
}
