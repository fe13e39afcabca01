package com.consullo.cup.format;

import com.consullo.cup.core.RawElement;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads raw adapter records from JSON, as recorded by adapters for fixtures and replays.
 *
 * <p>
 * Accepts either a single element object or an array of root elements. Element keys: {@code role, name, value,
 * bounds {x,y,w,h}, states, actions, children, attributes, nativeId}; all are optional.
 * </p>
 */
public final class RawTreeJsonReader {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  /**
   * Reads raw roots from a stream. The stream is not closed.
   *
   * @param in JSON input
   * @return raw roots
   * @throws IOException if the input is not valid JSON
   */
  public List<RawElement> read(InputStream in) throws IOException {
    if (in == null) {
      throw new IllegalArgumentException("in must not be null.");
    }
    return read(JsonSupport.MAPPER.readTree(in));
  }

  /**
   * Reads raw roots from a JSON string.
   *
   * @param json JSON text
   * @return raw roots
   * @throws IOException if the input is not valid JSON
   */
  public List<RawElement> read(String json) throws IOException {
    if (json == null) {
      throw new IllegalArgumentException("json must not be null.");
    }
    return read(JsonSupport.MAPPER.readTree(json));
  }

  /**
   * Reads raw roots from a parsed JSON tree.
   *
   * @param root object or array node
   * @return raw roots
   * @throws IOException if the tree is neither an object nor an array
   */
  public List<RawElement> read(JsonNode root) throws IOException {
    if (root == null || !(root.isArray() || root.isObject())) {
      throw new IOException("Expected a JSON object or array of raw elements.");
    }
    List<JsonNode> rootNodes = new ArrayList<>();
    if (root.isArray()) {
      root.forEach(rootNodes::add);
    } else {
      rootNodes.add(root);
    }

    List<RawElement> out = new ArrayList<>();
    Deque<Pending> stack = new ArrayDeque<>();
    for (JsonNode n : rootNodes) {
      RawElement e = toElement(n);
      out.add(e);
      stack.push(new Pending(n, e));
    }
    // Children are attached in document order after their parent exists.
    while (!stack.isEmpty()) {
      Pending top = stack.pop();
      JsonNode children = top.json.get("children");
      if (children == null || !children.isArray()) {
        continue;
      }
      for (JsonNode c : children) {
        if (!c.isObject()) {
          continue;
        }
        RawElement child = toElement(c);
        top.element.addChild(child);
        stack.push(new Pending(c, child));
      }
    }
    return out;
  }

  private static RawElement toElement(JsonNode n) {
    RawElement.Builder b = RawElement.builder()
        .role(text(n, "role"))
        .name(text(n, "name"));
    JsonNode nativeId = n.get("nativeId");
    if (nativeId != null && !nativeId.isNull()) {
      b.nativeId(nativeId.isNumber() ? (Object) nativeId.asLong() : nativeId.asText());
    }
    JsonNode value = n.get("value");
    if (value != null && value.isValueNode() && !value.isNull()) {
      if (value.isBoolean()) {
        b.value(value.booleanValue());
      } else if (value.isNumber()) {
        b.value(value.numberValue());
      } else {
        b.value(value.asText());
      }
    }
    JsonNode bounds = n.get("bounds");
    if (bounds != null && bounds.isObject()) {
      b.bounds(bounds.path("x").asDouble(), bounds.path("y").asDouble(),
          bounds.path("w").asDouble(), bounds.path("h").asDouble());
    }
    for (String s : strings(n.get("states"))) {
      b.states(s);
    }
    for (String a : strings(n.get("actions"))) {
      b.actions(a);
    }
    JsonNode attributes = n.get("attributes");
    if (attributes != null && attributes.isObject()) {
      Map<String, Object> map = JsonSupport.MAPPER.convertValue(attributes, MAP_TYPE);
      for (Map.Entry<String, Object> e : map.entrySet()) {
        b.attribute(e.getKey(), e.getValue());
      }
    }
    return b.build();
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return v == null || v.isNull() ? null : v.asText();
  }

  private static List<String> strings(JsonNode array) {
    List<String> out = new ArrayList<>();
    if (array != null && array.isArray()) {
      Iterator<JsonNode> it = array.elements();
      while (it.hasNext()) {
        JsonNode v = it.next();
        if (v.isTextual()) {
          out.add(v.asText());
        }
      }
    }
    return out;
  }

  /** A parsed element whose JSON children have not been attached yet. */
  private static final class Pending {
    final JsonNode json;
    final RawElement element;

    Pending(JsonNode json, RawElement element) {
      this.json = json;
      this.element = element;
    }
  }
}
