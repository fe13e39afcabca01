package com.consullo.cup.capture;

import com.consullo.cup.core.Bounds;
import com.consullo.cup.core.Envelope;
import com.consullo.cup.core.Node;
import com.consullo.cup.core.Trees;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces a reduced copy of an envelope for a given {@link DetailLevel}.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>{@code FULL} returns the canonical tree untouched.</li>
 * <li>{@code STANDARD} and {@code COMPACT} walk the tree once with an explicit stack. Subtree drops and viewport
 * clipping are decided on the way down, relevance and wrapper collapse on the way up.</li>
 * <li>{@code MINIMAL} reduces the standard result to interactive nodes and their ancestors.</li>
 * </ul>
 * Roots always survive and surviving nodes keep their ids and relative order. Subtrees clipped away are tallied
 * by direction on the nearest surviving ancestor so the output can say how much is hidden.
 * </p>
 */
public final class PruningEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(PruningEngine.class);

  private final PruningPolicy policy;

  public PruningEngine(PruningPolicy policy) {
    if (policy == null) {
      throw new IllegalArgumentException("policy must not be null.");
    }
    this.policy = policy;
  }

  /**
   * Prunes an envelope.
   *
   * @param envelope canonical envelope
   * @param detail detail level
   * @return pruned envelope and counts
   */
  public PruneResult prune(Envelope envelope, DetailLevel detail) {
    if (envelope == null || detail == null) {
      throw new IllegalArgumentException("envelope/detail must not be null.");
    }
    int before = Trees.count(envelope.tree());
    Map<String, ClippedCounts> clipped = new LinkedHashMap<>();
    List<Node> tree;
    switch (detail) {
      case FULL:
        tree = envelope.tree();
        break;
      case MINIMAL:
        tree = minimal(standard(envelope, clipped));
        clipped.keySet().retainAll(new HashSet<>(Trees.ids(tree)));
        break;
      default:
        tree = standard(envelope, clipped);
        break;
    }
    int after = Trees.count(tree);
    LOGGER.debug("prune: detail={} before={} after={} clipped containers={}",
        detail.wireName(), before, after, clipped.size());
    Envelope pruned = detail == DetailLevel.FULL ? envelope : envelope.withTree(tree);
    return new PruneResult(pruned, detail, new PruneCounts(before, after), clipped);
  }

  private List<Node> standard(Envelope envelope, Map<String, ClippedCounts> clipped) {
    Bounds screen = envelope.screen().toBounds();
    List<Node> out = new ArrayList<>(envelope.tree().size());
    for (Node root : envelope.tree()) {
      out.add(pruneRoot(root, screen, clipped));
    }
    return out;
  }

  private Node pruneRoot(Node root, Bounds screen, Map<String, ClippedCounts> clipped) {
    Bounds rootClip;
    if (!root.bounds().isEmpty()) {
      rootClip = root.bounds();
    } else if (!screen.isEmpty()) {
      rootClip = screen;
    } else {
      rootClip = null;
    }

    Deque<Frame> stack = new ArrayDeque<>();
    Frame rootFrame = new Frame(root, rootClip, null);
    stack.push(rootFrame);
    Node result = root;

    while (!stack.isEmpty()) {
      Frame f = stack.peek();
      List<Node> children = f.node.children();
      if (f.next < children.size()) {
        Node child = children.get(f.next++);
        if (policy.shouldDrop(child, f.node)) {
          continue;
        }
        if (isClipped(child, f.clip)) {
          f.countClipped(child, f.clip);
          continue;
        }
        stack.push(new Frame(child, narrow(child, f.clip), f));
        continue;
      }

      stack.pop();
      if (f.parent == null) {
        result = f.node.withChildren(f.survivors);
        f.recordClipped(clipped);
        continue;
      }
      if (f.survivors.isEmpty() && !policy.isRelevant(f.node)) {
        f.parent.absorbClipped(f);
        continue;
      }
      if (f.survivors.size() == 1 && policy.isCollapsible(f.node)) {
        f.parent.survivors.add(f.survivors.get(0));
        f.parent.absorbClipped(f);
        continue;
      }
      f.parent.survivors.add(f.node.withChildren(f.survivors));
      f.recordClipped(clipped);
    }
    return result;
  }

  private boolean isClipped(Node node, Bounds clip) {
    return clip != null && !policy.isAlwaysKept(node) && !node.bounds().intersects(clip);
  }

  private Bounds narrow(Node node, Bounds clip) {
    if (!policy.isClipBearing(node) || node.bounds().isEmpty()) {
      return clip;
    }
    return clip == null ? node.bounds() : clip.intersect(node.bounds());
  }

  private static List<Node> minimal(List<Node> standardTree) {
    List<Node> out = new ArrayList<>(standardTree.size());
    for (Node root : standardTree) {
      Deque<Frame> stack = new ArrayDeque<>();
      stack.push(new Frame(root, null, null));
      Node kept = root;
      while (!stack.isEmpty()) {
        Frame f = stack.peek();
        List<Node> children = f.node.children();
        if (f.next < children.size()) {
          stack.push(new Frame(children.get(f.next++), null, f));
          continue;
        }
        stack.pop();
        if (f.parent == null) {
          kept = f.node.withChildren(f.survivors);
        } else if (f.node.isActionable() || !f.survivors.isEmpty()) {
          f.parent.survivors.add(f.node.withChildren(f.survivors));
        }
      }
      out.add(kept);
    }
    return out;
  }

  private static final class Frame {
    final Node node;
    final Bounds clip;
    final Frame parent;
    final List<Node> survivors = new ArrayList<>();
    int next;
    int above;
    int below;
    int left;
    int right;

    Frame(Node node, Bounds clip, Frame parent) {
      this.node = node;
      this.clip = clip;
      this.parent = parent;
    }

    /** Tallies a child subtree lying outside the clip, by the side it lies on. */
    void countClipped(Node child, Bounds clip) {
      Bounds b = child.bounds();
      int size = Trees.count(List.of(child));
      // a zero-area node inside the clip lies on no side and is not tallied
      if (b.bottom() <= clip.y()) {
        above += size;
      } else if (b.y() >= clip.bottom()) {
        below += size;
      } else if (b.right() <= clip.x()) {
        left += size;
      } else if (b.x() >= clip.right()) {
        right += size;
      }
    }

    void absorbClipped(Frame dropped) {
      above += dropped.above;
      below += dropped.below;
      left += dropped.left;
      right += dropped.right;
    }

    void recordClipped(Map<String, ClippedCounts> out) {
      if (above + below + left + right > 0) {
        out.put(node.id(), new ClippedCounts(above, below, left, right));
      }
    }
  }
}
