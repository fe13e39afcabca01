package com.consullo.cup.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw accessibility record as produced by a platform adapter, before normalization.
 *
 * <p>
 * Role, state and action strings are in the platform's native vocabulary. Children may be appended after
 * construction because adapters often discover them incrementally; the graph is therefore not guaranteed to
 * be acyclic.
 * </p>
 */
public final class RawElement {

  private final Object nativeId;
  private final String role;
  private final String name;
  private final Object value;
  private final Bounds bounds;
  private final Set<String> states;
  private final Set<String> actions;
  private final Map<String, Object> attributes;
  private final List<RawElement> children;

  private RawElement(Builder b) {
    this.nativeId = b.nativeId;
    this.role = b.role;
    this.name = b.name;
    this.value = b.value;
    this.bounds = b.bounds;
    this.states = Collections.unmodifiableSet(new LinkedHashSet<>(b.states));
    this.actions = Collections.unmodifiableSet(new LinkedHashSet<>(b.actions));
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
    this.children = new ArrayList<>(b.children);
  }

  /**
   * Returns the adapter's identity for the underlying native element, or null when the adapter has none.
   *
   * @return native identity or null
   */
  public Object nativeId() {
    return nativeId;
  }

  public String role() {
    return role;
  }

  public String name() {
    return name;
  }

  public Object value() {
    return value;
  }

  /**
   * Returns the element rectangle, or null when the platform did not report one.
   *
   * @return bounds or null
   */
  public Bounds bounds() {
    return bounds;
  }

  public Set<String> states() {
    return states;
  }

  public Set<String> actions() {
    return actions;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  public List<RawElement> children() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Appends a child discovered after construction.
   *
   * @param child child element
   * @return this element
   */
  public RawElement addChild(RawElement child) {
    if (child == null) {
      throw new IllegalArgumentException("child must not be null.");
    }
    children.add(child);
    return this;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private Object nativeId;
    private String role;
    private String name;
    private Object value;
    private Bounds bounds;
    private final Set<String> states = new LinkedHashSet<>();
    private final Set<String> actions = new LinkedHashSet<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<RawElement> children = new ArrayList<>();

    private Builder() {
    }

    public Builder nativeId(Object nativeId) {
      this.nativeId = nativeId;
      return this;
    }

    public Builder role(String role) {
      this.role = role;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder value(Object value) {
      this.value = value;
      return this;
    }

    public Builder bounds(Bounds bounds) {
      this.bounds = bounds;
      return this;
    }

    public Builder bounds(double x, double y, double w, double h) {
      this.bounds = new Bounds(x, y, w, h);
      return this;
    }

    public Builder states(String... states) {
      Collections.addAll(this.states, states);
      return this;
    }

    public Builder actions(String... actions) {
      Collections.addAll(this.actions, actions);
      return this;
    }

    public Builder attribute(String key, Object value) {
      this.attributes.put(key, value);
      return this;
    }

    public Builder child(RawElement child) {
      this.children.add(child);
      return this;
    }

    public RawElement build() {
      return new RawElement(this);
    }
  }
}
