package com.consullo.cup.capture;

import java.util.ArrayList;
import java.util.List;

/**
 * Number of nodes a container hides outside its visible area, by the direction one would scroll to reveal them.
 *
 * @param above nodes entirely above the visible area
 * @param below nodes entirely below the visible area
 * @param left nodes entirely left of the visible area
 * @param right nodes entirely right of the visible area
 * @since 1.0
 */
public record ClippedCounts(int above, int below, int left, int right) {

  public static final ClippedCounts NONE = new ClippedCounts(0, 0, 0, 0);

  public ClippedCounts {
    if (above < 0 || below < 0 || left < 0 || right < 0) {
      throw new IllegalArgumentException("clipped counts must not be negative.");
    }
  }

  public int total() {
    return above + below + left + right;
  }

  /**
   * Returns the scroll directions that reveal hidden nodes, in up, down, left, right order.
   *
   * @return direction words
   */
  public List<String> directions() {
    List<String> out = new ArrayList<>(4);
    if (above > 0) {
      out.add("up");
    }
    if (below > 0) {
      out.add("down");
    }
    if (left > 0) {
      out.add("left");
    }
    if (right > 0) {
      out.add("right");
    }
    return out;
  }
}
