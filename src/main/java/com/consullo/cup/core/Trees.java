package com.consullo.cup.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Stack-based helpers over node forests.
 *
 * @since 1.0
 */
public final class Trees {

  private Trees() {
  }

  /**
   * Counts all nodes in a forest.
   *
   * @param roots roots
   * @return total node count
   */
  public static int count(List<Node> roots) {
    int total = 0;
    Deque<Node> stack = new ArrayDeque<>(roots);
    while (!stack.isEmpty()) {
      Node n = stack.pop();
      total++;
      for (Node c : n.children()) {
        stack.push(c);
      }
    }
    return total;
  }

  /**
   * Returns every node of a forest in depth-first pre-order.
   *
   * @param roots roots
   * @return nodes in pre-order
   */
  public static List<Node> preOrder(List<Node> roots) {
    List<Node> out = new ArrayList<>();
    Deque<Node> stack = new ArrayDeque<>();
    for (int i = roots.size() - 1; i >= 0; i--) {
      stack.push(roots.get(i));
    }
    while (!stack.isEmpty()) {
      Node n = stack.pop();
      out.add(n);
      List<Node> children = n.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return out;
  }

  /**
   * Returns the ids of a forest in pre-order.
   *
   * @param roots roots
   * @return ids
   */
  public static List<String> ids(List<Node> roots) {
    List<Node> nodes = preOrder(roots);
    List<String> out = new ArrayList<>(nodes.size());
    for (Node n : nodes) {
      out.add(n.id());
    }
    return out;
  }
}
