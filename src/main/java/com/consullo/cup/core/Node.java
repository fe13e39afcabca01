package com.consullo.cup.core;

import com.consullo.cup.core.taxonomy.Action;
import com.consullo.cup.core.taxonomy.Role;
import com.consullo.cup.core.taxonomy.State;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, normalized UI element.
 *
 * <p>
 * Ids are unique within one envelope only; two captures of the same UI may number the same element
 * differently. Children keep the source order (visual or tab order).
 * </p>
 */
public final class Node {

  private final String id;
  private final Role role;
  private final String name;
  private final Bounds bounds;
  private final Set<State> states;
  private final Set<Action> actions;
  private final Object value;
  private final List<Node> children;
  private final Map<String, Object> platformExtra;

  private Node(Builder b) {
    this.id = b.id;
    this.role = b.role;
    this.name = b.name;
    this.bounds = b.bounds;
    this.states = Collections.unmodifiableSet(b.states.isEmpty() ? EnumSet.noneOf(State.class) : EnumSet.copyOf(b.states));
    this.actions = Collections.unmodifiableSet(b.actions.isEmpty() ? EnumSet.noneOf(Action.class) : EnumSet.copyOf(b.actions));
    this.value = b.value;
    this.children = List.copyOf(b.children);
    this.platformExtra = Collections.unmodifiableMap(new LinkedHashMap<>(b.platformExtra));
  }

  public String id() {
    return id;
  }

  public Role role() {
    return role;
  }

  /**
   * Returns the accessible label, or null when the element has none.
   *
   * @return name or null
   */
  public String name() {
    return name;
  }

  public Bounds bounds() {
    return bounds;
  }

  public Set<State> states() {
    return states;
  }

  public Set<Action> actions() {
    return actions;
  }

  /**
   * Returns the scalar value (String, Number or Boolean) or null.
   *
   * @return value or null
   */
  public Object value() {
    return value;
  }

  public List<Node> children() {
    return children;
  }

  public Map<String, Object> platformExtra() {
    return platformExtra;
  }

  public boolean hasName() {
    return name != null;
  }

  /**
   * Returns true if the element supports at least one action other than focus.
   *
   * @return true when interactive
   */
  public boolean isActionable() {
    for (Action a : actions) {
      if (a.isActionable()) {
        return true;
      }
    }
    return false;
  }

  public boolean hasNotableState() {
    for (State s : states) {
      if (s.isNotable()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns a copy of this node with the given children.
   *
   * @param newChildren replacement children
   * @return node copy
   */
  public Node withChildren(List<Node> newChildren) {
    if (sameInstances(newChildren, children)) {
      return this;
    }
    return toBuilder().children(newChildren).build();
  }

  private static boolean sameInstances(List<Node> a, List<Node> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (a.get(i) != b.get(i)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns a copy of this node with no children.
   *
   * @return leaf copy
   */
  public Node withoutChildren() {
    return children.isEmpty() ? this : withChildren(List.of());
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .role(role)
        .name(name)
        .bounds(bounds)
        .states(states)
        .actions(actions)
        .value(value)
        .children(children)
        .platformExtra(platformExtra);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Node)) {
      return false;
    }
    Node other = (Node) o;
    return id.equals(other.id)
        && role == other.role
        && Objects.equals(name, other.name)
        && bounds.equals(other.bounds)
        && states.equals(other.states)
        && actions.equals(other.actions)
        && Objects.equals(value, other.value)
        && children.equals(other.children)
        && platformExtra.equals(other.platformExtra);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, role, name, bounds, states, actions, value, children, platformExtra);
  }

  @Override
  public String toString() {
    return "Node{" + id + " " + role.wireName() + (name == null ? "" : " \"" + name + "\"") + ", children=" + children.size() + "}";
  }

  public static final class Builder {

    private String id;
    private Role role = Role.GENERIC;
    private String name;
    private Bounds bounds = Bounds.ZERO;
    private final Set<State> states = EnumSet.noneOf(State.class);
    private final Set<Action> actions = EnumSet.noneOf(Action.class);
    private Object value;
    private final List<Node> children = new ArrayList<>();
    private final Map<String, Object> platformExtra = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder role(Role role) {
      this.role = role;
      return this;
    }

    /**
     * Sets the name. The value is trimmed; blank names are stored as absent.
     *
     * @param name raw name
     * @return this builder
     */
    public Builder name(String name) {
      if (name == null) {
        this.name = null;
      } else {
        String trimmed = name.trim();
        this.name = trimmed.isEmpty() ? null : trimmed;
      }
      return this;
    }

    public Builder bounds(Bounds bounds) {
      this.bounds = bounds;
      return this;
    }

    public Builder states(Collection<State> states) {
      this.states.clear();
      this.states.addAll(states);
      return this;
    }

    public Builder state(State state) {
      this.states.add(state);
      return this;
    }

    public Builder actions(Collection<Action> actions) {
      this.actions.clear();
      this.actions.addAll(actions);
      return this;
    }

    public Builder action(Action action) {
      this.actions.add(action);
      return this;
    }

    public Builder value(Object value) {
      this.value = value;
      return this;
    }

    public Builder children(List<Node> children) {
      this.children.clear();
      this.children.addAll(children);
      return this;
    }

    public Builder child(Node child) {
      this.children.add(child);
      return this;
    }

    public Builder platformExtra(Map<String, Object> platformExtra) {
      this.platformExtra.clear();
      if (platformExtra != null) {
        this.platformExtra.putAll(platformExtra);
      }
      return this;
    }

    public Node build() {
      if (id == null || id.isEmpty()) {
        throw new IllegalArgumentException("id must not be empty.");
      }
      if (role == null || bounds == null) {
        throw new IllegalArgumentException("role/bounds must not be null.");
      }
      if (value != null && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
        throw new IllegalArgumentException("value must be a String, Number or Boolean: " + value.getClass().getName());
      }
      return new Node(this);
    }
  }
}
