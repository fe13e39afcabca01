package com.consullo.cup.core;

import java.time.Instant;
import java.util.List;

/**
 * One normalized capture: metadata plus the ordered root nodes.
 *
 * @param version format version
 * @param platform source platform
 * @param timestamp capture time
 * @param screen primary display metrics
 * @param scope capture scope
 * @param app foreground application (may be null)
 * @param tree root nodes, normally one window (several under {@link Scope#FULL})
 * @param windows window list shown in overview and foreground headers (may be empty)
 * @since 1.0
 */
public record Envelope(
    String version,
    Platform platform,
    Instant timestamp,
    ScreenInfo screen,
    Scope scope,
    AppInfo app,
    List<Node> tree,
    List<WindowInfo> windows) {

  public static final String FORMAT_VERSION = "0.1.0";

  public Envelope {
    if (version == null || platform == null || timestamp == null || screen == null || scope == null) {
      throw new IllegalArgumentException("version/platform/timestamp/screen/scope must not be null.");
    }
    tree = tree == null ? List.of() : List.copyOf(tree);
    windows = windows == null ? List.of() : List.copyOf(windows);
  }

  /**
   * Returns a copy of this envelope carrying a different tree. Metadata is shared.
   *
   * @param newTree replacement roots
   * @return envelope copy
   */
  public Envelope withTree(List<Node> newTree) {
    return new Envelope(version, platform, timestamp, screen, scope, app, newTree, windows);
  }
}
