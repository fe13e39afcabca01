package com.consullo.cup.demo;

import com.consullo.cup.core.Bounds;
import com.consullo.cup.core.Platform;
import com.consullo.cup.core.PlatformAdapter;
import com.consullo.cup.core.RawElement;
import com.consullo.cup.core.ScreenInfo;
import com.consullo.cup.core.WindowInfo;
import com.consullo.cup.format.JsonSupport;
import com.consullo.cup.format.RawTreeJsonReader;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Platform adapter that replays a recorded desktop from a JSON fixture.
 *
 * <p>
 * Fixture layout:
 * <pre>
 * {
 *   "platform": "windows",
 *   "screen": {"w": 1920, "h": 1080, "scale": 1.0},
 *   "windows": [{"title": "...", "pid": 42, "foreground": true, "bounds": {...}, "url": "...", "tree": {...}}],
 *   "desktop": {"title": "Desktop", "tree": {...}}
 * }
 * </pre>
 * Trees use the raw element layout read by {@link RawTreeJsonReader}. Each window's handle is its position in the
 * {@code windows} array (the desktop uses {@value #DESKTOP_HANDLE}), so windows sharing a title keep their own trees.
 * </p>
 *
 * @since 1.0
 */
public final class FixturePlatformAdapter implements PlatformAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FixturePlatformAdapter.class);

  static final String DESKTOP_HANDLE = "desktop";

  private final JsonNode fixture;
  private final RawTreeJsonReader reader = new RawTreeJsonReader();
  private final Map<Object, JsonNode> treesByHandle = new LinkedHashMap<>();
  private final List<WindowInfo> windows = new ArrayList<>();
  private Platform platform;
  private ScreenInfo screen;
  private WindowInfo desktop;

  private FixturePlatformAdapter(JsonNode fixture) {
    this.fixture = fixture;
  }

  /**
   * Loads a fixture from the classpath.
   *
   * @param resource absolute resource path such as "/fixtures/demo-window.json"
   * @return adapter
   * @throws IOException if the resource is missing or not valid JSON
   */
  public static FixturePlatformAdapter fromResource(String resource) throws IOException {
    Validate.notBlank(resource, "resource must not be blank");
    try (InputStream in = FixturePlatformAdapter.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Fixture not found on classpath: " + resource);
      }
      return new FixturePlatformAdapter(JsonSupport.getJsonMapper().readTree(in));
    }
  }

  @Override
  public Platform platform() {
    return platform != null ? platform : Platform.fromWireName(fixture.path("platform").asText("web"));
  }

  @Override
  public void initialize() throws Exception {
    if (screen != null) {
      return;
    }
    platform = Platform.fromWireName(fixture.path("platform").asText("web"));
    JsonNode s = fixture.path("screen");
    screen = new ScreenInfo(s.path("w").asInt(0), s.path("h").asInt(0), s.path("scale").asDouble(1.0));
    int index = 0;
    for (JsonNode w : fixture.path("windows")) {
      WindowInfo info = toWindow(w, index++);
      windows.add(info);
      treesByHandle.put(info.handle(), w.get("tree"));
    }
    JsonNode d = fixture.get("desktop");
    if (d != null && d.isObject()) {
      desktop = toWindow(d, DESKTOP_HANDLE);
      treesByHandle.put(desktop.handle(), d.get("tree"));
    }
    LOGGER.debug("initialize: platform={} windows={} desktop={}", platform.wireName(), windows.size(), desktop != null);
  }

  @Override
  public ScreenInfo screenInfo() throws Exception {
    return screen;
  }

  @Override
  public WindowInfo foregroundWindow() throws Exception {
    for (WindowInfo w : windows) {
      if (w.foreground()) {
        return w;
      }
    }
    if (windows.isEmpty()) {
      throw new IllegalStateException("Fixture has no windows.");
    }
    return windows.get(0);
  }

  @Override
  public List<WindowInfo> allWindows() throws Exception {
    return List.copyOf(windows);
  }

  @Override
  public List<WindowInfo> windowList() throws Exception {
    return List.copyOf(windows);
  }

  @Override
  public WindowInfo desktopWindow() throws Exception {
    return desktop;
  }

  @Override
  public List<RawElement> captureTree(List<WindowInfo> targets, int maxDepth) throws Exception {
    List<RawElement> out = new ArrayList<>();
    for (WindowInfo w : targets) {
      JsonNode tree = w.handle() == null ? null : treesByHandle.get(w.handle());
      if (tree == null || tree.isNull()) {
        LOGGER.warn("captureTree: no recorded tree for window '{}'", w.title());
        continue;
      }
      out.addAll(reader.read(tree));
    }
    return out;
  }

  private static WindowInfo toWindow(JsonNode w, Object handle) {
    JsonNode b = w.get("bounds");
    Bounds bounds = b == null || !b.isObject()
        ? null
        : new Bounds(b.path("x").asDouble(), b.path("y").asDouble(), b.path("w").asDouble(), b.path("h").asDouble());
    JsonNode pid = w.get("pid");
    return new WindowInfo(
        w.path("title").asText("(untitled)"),
        pid != null && pid.canConvertToInt() ? pid.asInt() : null,
        w.hasNonNull("bundleId") ? w.get("bundleId").asText() : null,
        w.path("foreground").asBoolean(false),
        bounds,
        w.hasNonNull("url") ? w.get("url").asText() : null,
        handle);
  }
}
