package com.consullo.cup.capture;

import com.consullo.cup.core.Node;
import com.consullo.cup.core.taxonomy.Action;
import com.consullo.cup.core.taxonomy.Role;
import com.consullo.cup.core.taxonomy.State;
import java.util.EnumSet;
import java.util.Set;

/**
 * Default pruning heuristics.
 *
 * <p>
 * Drops window chrome, decorative images, empty or redundant text and off-screen noise; keeps anything named,
 * interactive or carrying a notable state. Unnamed generic, group and region containers with a single surviving
 * child collapse into that child.
 * </p>
 */
public final class DefaultPruningPolicy implements PruningPolicy {

  private static final Set<Role> CHROME_ROLES = EnumSet.of(Role.SCROLLBAR, Role.SEPARATOR, Role.TITLEBAR);
  private static final Set<Role> VIEWPORT_ROLES = EnumSet.of(Role.WINDOW, Role.DIALOG, Role.ALERTDIALOG, Role.DOCUMENT);
  private static final Set<Role> ALWAYS_KEPT_ROLES = EnumSet.of(Role.WINDOW, Role.DOCUMENT, Role.APPLICATION);
  private static final Set<Role> COLLAPSIBLE_ROLES = EnumSet.of(Role.GENERIC, Role.GROUP, Role.REGION);

  @Override
  public boolean isClipBearing(Node node) {
    return VIEWPORT_ROLES.contains(node.role()) || node.actions().contains(Action.SCROLL);
  }

  @Override
  public boolean isAlwaysKept(Node node) {
    return ALWAYS_KEPT_ROLES.contains(node.role());
  }

  @Override
  public boolean shouldDrop(Node node, Node parent) {
    Role role = node.role();
    if (CHROME_ROLES.contains(role)) {
      return true;
    }
    // Decorative image.
    if (role == Role.IMG && !node.hasName() && node.actions().isEmpty()) {
      return true;
    }
    if (role == Role.TEXT && !node.hasName()) {
      return true;
    }
    // Off-screen elements are kept only when they can be acted on after scrolling.
    if (node.states().contains(State.OFFSCREEN) && !node.isActionable()) {
      return true;
    }
    // Redundant label: the parent already carries the name.
    return role == Role.TEXT && parent != null && parent.hasName() && parent.children().size() == 1;
  }

  @Override
  public boolean isRelevant(Node node) {
    return node.hasName() || node.isActionable() || node.hasNotableState();
  }

  @Override
  public boolean isCollapsible(Node node) {
    return COLLAPSIBLE_ROLES.contains(node.role())
        && !node.hasName()
        && !node.isActionable()
        && !node.hasNotableState();
  }
}
