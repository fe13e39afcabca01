package com.consullo.cup.format;

import com.consullo.cup.core.Bounds;
import com.consullo.cup.core.Envelope;
import com.consullo.cup.core.Node;
import com.consullo.cup.core.WindowInfo;
import com.consullo.cup.core.taxonomy.Action;
import com.consullo.cup.core.taxonomy.State;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Writes envelopes as structured JSON.
 *
 * <p>
 * Absent optional fields are omitted rather than written as null, except {@code app}, which is always present and
 * null when the capture has no single application. Nodes use the keys {@code id, role, name,
 * bounds, states, actions, value, children, platform_extra}; role, state and action values are wire names.
 * </p>
 */
public final class EnvelopeJsonWriter {

  private final boolean pretty;

  public EnvelopeJsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Serializes an envelope to a JSON string.
   *
   * @param envelope envelope
   * @return JSON text
   * @throws JsonProcessingException if Jackson fails to write a platform-extra value
   */
  public String write(Envelope envelope) throws JsonProcessingException {
    if (envelope == null) {
      throw new IllegalArgumentException("envelope must not be null.");
    }
    ObjectNode root = toJsonTree(envelope);
    return pretty
        ? JsonSupport.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root)
        : JsonSupport.MAPPER.writeValueAsString(root);
  }

  /**
   * Converts an envelope to a Jackson tree.
   *
   * @param envelope envelope
   * @return JSON object
   */
  public ObjectNode toJsonTree(Envelope envelope) {
    ObjectNode root = JsonSupport.MAPPER.createObjectNode();
    root.put("version", envelope.version());
    root.put("platform", envelope.platform().wireName());
    root.put("timestamp", envelope.timestamp().toEpochMilli());
    ObjectNode screen = root.putObject("screen");
    screen.put("w", envelope.screen().w());
    screen.put("h", envelope.screen().h());
    if (envelope.screen().scale() != 1.0) {
      screen.put("scale", envelope.screen().scale());
    }
    root.put("scope", envelope.scope().wireName());
    if (envelope.app() == null) {
      root.putNull("app");
    } else {
      ObjectNode app = root.putObject("app");
      if (envelope.app().name() != null) {
        app.put("name", envelope.app().name());
      }
      if (envelope.app().pid() != null) {
        app.put("pid", envelope.app().pid());
      }
      if (envelope.app().bundleId() != null) {
        app.put("bundleId", envelope.app().bundleId());
      }
    }
    ArrayNode tree = root.putArray("tree");
    writeNodes(tree, envelope.tree());
    if (!envelope.windows().isEmpty()) {
      ArrayNode windows = root.putArray("windows");
      for (WindowInfo w : envelope.windows()) {
        ObjectNode o = windows.addObject();
        o.put("title", w.title());
        if (w.pid() != null) {
          o.put("pid", w.pid());
        }
        if (w.bundleId() != null) {
          o.put("bundleId", w.bundleId());
        }
        o.put("foreground", w.foreground());
        if (w.bounds() != null) {
          putBounds(o.putObject("bounds"), w.bounds());
        }
        if (w.url() != null) {
          o.put("url", w.url());
        }
      }
    }
    return root;
  }

  private static void writeNodes(ArrayNode target, List<Node> roots) {
    Deque<Pending> stack = new ArrayDeque<>();
    for (int i = roots.size() - 1; i >= 0; i--) {
      stack.push(new Pending(roots.get(i), target));
    }
    while (!stack.isEmpty()) {
      Pending top = stack.pop();
      Node n = top.node;
      ObjectNode o = top.target.addObject();
      o.put("id", n.id());
      o.put("role", n.role().wireName());
      if (n.name() != null) {
        o.put("name", n.name());
      }
      putBounds(o.putObject("bounds"), n.bounds());
      if (!n.states().isEmpty()) {
        ArrayNode states = o.putArray("states");
        for (State s : n.states()) {
          states.add(s.wireName());
        }
      }
      if (!n.actions().isEmpty()) {
        ArrayNode actions = o.putArray("actions");
        for (Action a : n.actions()) {
          actions.add(a.wireName());
        }
      }
      if (n.value() != null) {
        o.set("value", JsonSupport.MAPPER.valueToTree(n.value()));
      }
      // Children are appended in order, so push them last-first.
      List<Node> children = n.children();
      if (!children.isEmpty()) {
        ArrayNode childArray = o.putArray("children");
        for (int i = children.size() - 1; i >= 0; i--) {
          stack.push(new Pending(children.get(i), childArray));
        }
      }
      if (!n.platformExtra().isEmpty()) {
        ObjectNode extra = o.putObject("platform_extra");
        for (Map.Entry<String, Object> e : n.platformExtra().entrySet()) {
          extra.set(e.getKey(), JsonSupport.MAPPER.valueToTree(e.getValue()));
        }
      }
    }
  }

  private static void putBounds(ObjectNode o, Bounds b) {
    putNumber(o, "x", b.x());
    putNumber(o, "y", b.y());
    putNumber(o, "w", b.w());
    putNumber(o, "h", b.h());
  }

  private static void putNumber(ObjectNode o, String key, double v) {
    if (v == Math.rint(v) && Math.abs(v) < Long.MAX_VALUE) {
      o.put(key, (long) v);
    } else {
      o.put(key, v);
    }
  }

  /** A node waiting to be appended to the array of its parent. */
  private static final class Pending {
    final Node node;
    final ArrayNode target;

    Pending(Node node, ArrayNode target) {
      this.node = node;
      this.target = target;
    }
  }
}
